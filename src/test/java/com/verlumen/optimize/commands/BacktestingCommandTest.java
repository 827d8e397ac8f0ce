package com.verlumen.optimize.commands;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.optimize.cli.Constants;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TickerInterval;
import com.verlumen.optimize.time.TimeRange;
import com.verlumen.optimize.time.TimeRangeParser;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class BacktestingCommandTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private TimeRangeParser mockTimeRangeParser;

  @Inject private BacktestingCommand command;

  private final Map<String, Object> values = new HashMap<>();

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
    values.put("strategy", Constants.DEFAULT_STRATEGY);
    values.put("exportfilename", Constants.DEFAULT_EXPORT_FILENAME);
    values.put("use_max_market_positions", true);
    when(mockTimeRangeParser.parse(null)).thenReturn(TimeRange.UNBOUNDED);
  }

  @Test
  public void settings_resolvesTimerangeThroughParser() {
    // Arrange
    values.put("timerange", "20180101-");
    TimeRange expected = mock(TimeRange.class);
    when(mockTimeRangeParser.parse("20180101-")).thenReturn(expected);

    // Act
    BacktestSettings settings = command.settings(ParsedArguments.of(values));

    // Assert
    verify(mockTimeRangeParser).parse("20180101-");
    assertThat(settings.optimizer().timeRange()).isSameInstanceAs(expected);
  }

  @Test
  public void settings_withoutStrategyList_usesSingleStrategy() {
    BacktestSettings settings = command.settings(ParsedArguments.of(values));

    assertThat(settings.strategies()).containsExactly(Constants.DEFAULT_STRATEGY);
    assertThat(settings.exportFilenameFor(Constants.DEFAULT_STRATEGY))
        .isEqualTo(Constants.DEFAULT_EXPORT_FILENAME);
    assertThat(settings.useMaxMarketPositions()).isTrue();
    assertThat(settings.export()).isEmpty();
  }

  @Test
  public void settings_withStrategyList_injectsStrategyIntoExportFilename() {
    values.put("strategy_list", ImmutableList.of("First", "Second"));
    values.put("export", "trades");

    BacktestSettings settings = command.settings(ParsedArguments.of(values));

    assertThat(settings.strategies()).containsExactly("First", "Second").inOrder();
    assertThat(settings.export()).hasValue("trades");
    assertThat(settings.exportFilenameFor("Second"))
        .isEqualTo(
            Paths.get("user_data", "backtest_data", "backtest-result-Second.json").toString());
  }

  @Test
  public void settings_readsSharedOptimizerOptions() {
    values.put("config", ImmutableList.of("base.json", "override.json"));
    values.put("ticker_interval", "5m");
    values.put("max_open_trades", 3);
    values.put("stake_amount", 0.05);
    values.put("refresh_pairs", true);

    OptimizerSettings optimizer = command.settings(ParsedArguments.of(values)).optimizer();

    assertThat(optimizer.primaryConfig()).isEqualTo("base.json");
    assertThat(optimizer.tickerInterval()).hasValue(TickerInterval.FIVE_MIN);
    assertThat(optimizer.maxOpenTrades()).hasValue(3);
    assertThat(optimizer.stakeAmount()).hasValue(0.05);
    assertThat(optimizer.refreshPairs()).isTrue();
  }

  @Test
  public void run_logsWithoutFailing() {
    values.put("export", "trades");

    command.run(ParsedArguments.of(ImmutableMap.copyOf(values)));

    verify(mockTimeRangeParser).parse(null);
  }
}
