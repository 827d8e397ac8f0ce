package com.verlumen.optimize.commands;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.optimize.cli.CommandHandler;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TimeRangeParser;
import java.util.Optional;

/** Hands the backtesting options to the backtesting engine. */
public final class BacktestingCommand implements CommandHandler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TimeRangeParser timeRangeParser;

  @Inject
  BacktestingCommand(TimeRangeParser timeRangeParser) {
    this.timeRangeParser = timeRangeParser;
  }

  @Override
  public void run(ParsedArguments arguments) {
    BacktestSettings settings = settings(arguments);
    logger.atInfo().log(
        "Starting backtesting of %s over %s",
        settings.strategies(), settings.optimizer().timeRange());
    if (settings.export().isPresent()) {
      for (String strategy : settings.strategies()) {
        logger.atInfo().log(
            "Exporting %s results of %s to %s",
            settings.export().get(), strategy, settings.exportFilenameFor(strategy));
      }
    }
  }

  BacktestSettings settings(ParsedArguments arguments) {
    OptimizerSettings optimizer = OptimizerSettings.create(arguments, timeRangeParser);
    ImmutableList<String> strategyList = arguments.getList("strategy_list");
    boolean fromList = !strategyList.isEmpty();
    return BacktestSettings.create(
        optimizer,
        fromList ? strategyList : ImmutableList.of(optimizer.strategy()),
        fromList,
        arguments.getBoolean("position_stacking"),
        arguments.getBoolean("use_max_market_positions"),
        arguments.getBoolean("live"),
        Optional.ofNullable(arguments.getString("export")),
        arguments.getString("exportfilename"));
  }
}
