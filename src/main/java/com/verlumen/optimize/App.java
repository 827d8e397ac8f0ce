package com.verlumen.optimize;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.verlumen.optimize.cli.CommandHandler;
import com.verlumen.optimize.cli.OptimizeArguments;
import com.verlumen.optimize.cli.ParsedArguments;
import com.verlumen.optimize.time.TimeModule;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.helper.HelpScreenException;

/** Entry point: parses the command line and runs the selected subcommand. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String DESCRIPTION =
      "Backtesting, edge positioning and hyperparameter optimization for trading strategies";
  private static final int USAGE_ERROR = 2;

  private final Injector injector;

  App(Injector injector) {
    this.injector = injector;
  }

  /** Runs the handler of the selected subcommand, returning false when none was selected. */
  boolean run(ParsedArguments arguments) {
    Optional<Class<? extends CommandHandler>> handler = arguments.handler();
    if (handler.isEmpty()) {
      logger.atWarning().log("No command given, nothing to run");
      return false;
    }

    logger.atInfo().log(
        "Running %s with configuration %s", arguments.command().get(), arguments.configPaths());
    try {
      injector.getInstance(handler.get()).run(arguments);
      return true;
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Command %s failed", arguments.command().get());
      throw e;
    }
  }

  public static void main(String[] args) {
    OptimizeArguments arguments = OptimizeArguments.create(ImmutableList.copyOf(args), DESCRIPTION);
    ParsedArguments parsed;
    try {
      parsed = arguments.parse();
    } catch (HelpScreenException e) {
      return;
    } catch (ArgumentParserException e) {
      e.getParser().handleError(e);
      System.exit(USAGE_ERROR);
      return;
    }

    new App(Guice.createInjector(TimeModule.create())).run(parsed);
  }
}
