package com.verlumen.optimize.cli;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParsedArgumentsTest {
  @Test
  public void of_emptyConfigList_substitutesDefault() {
    ParsedArguments parsed = ParsedArguments.of(ImmutableMap.of("config", ImmutableList.of()));

    assertThat(parsed.configPaths()).containsExactly(Constants.DEFAULT_CONFIG);
  }

  @Test
  public void of_copiesListsSoLaterChangesAreNotSeen() {
    List<String> strategies = new ArrayList<>();
    strategies.add("First");
    Map<String, Object> values = new HashMap<>();
    values.put("strategy_list", strategies);

    ParsedArguments parsed = ParsedArguments.of(values);
    strategies.add("Second");
    values.put("strategy", "Changed");

    assertThat(parsed.<String>getList("strategy_list")).containsExactly("First");
    assertThat(parsed.contains("strategy")).isFalse();
  }

  @Test
  public void getList_absentKey_returnsEmptyList() {
    assertThat(ParsedArguments.of(ImmutableMap.of()).getList("spaces")).isEmpty();
  }

  @Test
  public void getBoolean_absentKey_isFalse() {
    assertThat(ParsedArguments.of(ImmutableMap.of()).getBoolean("live")).isFalse();
  }

  @Test
  public void presentValues_skipsNullValues() {
    Map<String, Object> values = new HashMap<>();
    values.put("logfile", null);
    values.put("strategy", "DefaultStrategy");

    ImmutableMap<String, Object> present = ParsedArguments.of(values).presentValues();

    assertThat(present).containsEntry("strategy", "DefaultStrategy");
    assertThat(present).doesNotContainKey("logfile");
    assertThat(present).containsKey("config");
  }
}
