package com.verlumen.optimize.commands;

import com.google.auto.value.AutoValue;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TickerInterval;
import com.verlumen.optimize.time.TimeRange;
import com.verlumen.optimize.time.TimeRangeParser;
import java.util.Optional;

/** Settings taken from the options shared by backtesting, edge and hyperopt. */
@AutoValue
public abstract class OptimizerSettings {
  /**
   * Reads the shared options, resolving {@code --timerange} with {@code timeRangeParser}.
   *
   * @throws com.verlumen.optimize.time.InvalidTimeRangeException if the timerange is malformed
   * @throws IllegalArgumentException if the ticker interval is unknown
   */
  static OptimizerSettings create(ParsedArguments arguments, TimeRangeParser timeRangeParser) {
    return new AutoValue_OptimizerSettings(
        arguments.configPaths().get(0),
        arguments.getString("strategy"),
        Optional.ofNullable(arguments.getString("ticker_interval")).map(TickerInterval::fromLabel),
        timeRangeParser.parse(arguments.getString("timerange")),
        Optional.ofNullable(arguments.getInt("max_open_trades")),
        Optional.ofNullable(arguments.getDouble("stake_amount")),
        arguments.getBoolean("refresh_pairs"));
  }

  /** First configuration file; later ones are merged over it by the configuration loader. */
  public abstract String primaryConfig();

  public abstract String strategy();

  public abstract Optional<TickerInterval> tickerInterval();

  public abstract TimeRange timeRange();

  public abstract Optional<Integer> maxOpenTrades();

  public abstract Optional<Double> stakeAmount();

  public abstract boolean refreshPairs();
}
