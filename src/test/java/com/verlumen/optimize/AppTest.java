package com.verlumen.optimize;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.optimize.cli.OptimizeArguments;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.InvalidTimeRangeException;
import com.verlumen.optimize.time.TimeModule;
import com.verlumen.optimize.time.TimeRange;
import com.verlumen.optimize.time.TimeRangeParser;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class AppTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private TimeRangeParser mockTimeRangeParser;

  private App app;

  @Before
  public void setUp() {
    app = new App(Guice.createInjector(BoundFieldModule.of(this)));
    when(mockTimeRangeParser.parse(any())).thenReturn(TimeRange.UNBOUNDED);
  }

  @Test
  public void run_backtesting_resolvesTimerangeThroughHandler() throws Exception {
    // Arrange
    ParsedArguments arguments =
        parse("backtesting", "--timerange", "20180101-", "-i", "5m");

    // Act
    boolean ran = app.run(arguments);

    // Assert
    assertThat(ran).isTrue();
    verify(mockTimeRangeParser).parse("20180101-");
  }

  @Test
  public void run_noCommand_runsNothing() throws Exception {
    boolean ran = app.run(parse("-v"));

    assertThat(ran).isFalse();
    verifyNoInteractions(mockTimeRangeParser);
  }

  @Test
  public void run_malformedTimerange_propagatesFromHandler() throws Exception {
    App realApp = new App(Guice.createInjector(TimeModule.create()));
    ParsedArguments arguments = parse("hyperopt", "--timerange", "yesterday");

    assertThrows(InvalidTimeRangeException.class, () -> realApp.run(arguments));
  }

  private static ParsedArguments parse(String... args) throws Exception {
    return OptimizeArguments.create(ImmutableList.copyOf(args), "test").parse();
  }
}
