package com.verlumen.optimize.commands;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.optimize.cli.CommandHandler;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TimeRangeParser;
import java.util.Optional;

/** Hands the edge options to the edge positioning engine. */
public final class EdgeCommand implements CommandHandler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TimeRangeParser timeRangeParser;

  @Inject
  EdgeCommand(TimeRangeParser timeRangeParser) {
    this.timeRangeParser = timeRangeParser;
  }

  @Override
  public void run(ParsedArguments arguments) {
    EdgeSettings settings = settings(arguments);
    logger.atInfo().log(
        "Starting edge analysis of %s over %s",
        settings.optimizer().strategy(), settings.optimizer().timeRange());
    settings
        .stoplossRange()
        .ifPresent(range -> logger.atInfo().log("Assessing stoplosses %s", range.values()));
  }

  EdgeSettings settings(ParsedArguments arguments) {
    return EdgeSettings.create(
        OptimizerSettings.create(arguments, timeRangeParser),
        Optional.ofNullable(arguments.getString("stoploss_range")).map(StoplossRange::parse));
  }
}
