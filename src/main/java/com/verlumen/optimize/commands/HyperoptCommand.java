package com.verlumen.optimize.commands;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.optimize.cli.CommandHandler;
import com.verlumen.optimize.cli.Constants;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TimeRangeParser;
import java.util.Optional;

/** Hands the hyperopt options to the hyperparameter optimizer. */
public final class HyperoptCommand implements CommandHandler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TimeRangeParser timeRangeParser;

  @Inject
  HyperoptCommand(TimeRangeParser timeRangeParser) {
    this.timeRangeParser = timeRangeParser;
  }

  @Override
  public void run(ParsedArguments arguments) {
    HyperoptSettings settings = settings(arguments, Runtime.getRuntime().availableProcessors());
    logger.atInfo().log(
        "Starting hyperopt %s of %s: %d epochs on %d workers, spaces %s",
        settings.hyperopt(),
        settings.optimizer().strategy(),
        settings.epochs(),
        settings.jobs(),
        settings.optimizedSpaces());
  }

  HyperoptSettings settings(ParsedArguments arguments, int cpus) {
    Integer epochs = arguments.getInt("epochs");
    Integer jobs = arguments.getInt("hyperopt_jobs");
    return HyperoptSettings.builder()
        .setOptimizer(OptimizerSettings.create(arguments, timeRangeParser))
        .setHyperopt(arguments.getString("hyperopt"))
        .setEpochs(epochs == null ? Constants.HYPEROPT_EPOCH : epochs)
        .setSpaces(arguments.getList("spaces"))
        .setPrintAll(arguments.getBoolean("print_all"))
        .setPositionStacking(arguments.getBoolean("position_stacking"))
        .setUseMaxMarketPositions(arguments.getBoolean("use_max_market_positions"))
        .setJobs(
            HyperoptSettings.resolveJobs(
                jobs == null ? Constants.HYPEROPT_ALL_CPUS : jobs, cpus))
        .setRandomState(Optional.ofNullable(arguments.getInt("hyperopt_random_state")))
        .build();
  }
}
