package com.verlumen.optimize.cli;

import java.nio.file.Paths;

/** Defaults shared by the option groups and the argument facade. */
public final class Constants {
  public static final String VERSION = "0.18.0";
  public static final String PROGRAM_NAME = "optimize";
  public static final String DEFAULT_CONFIG = "config.json";
  public static final String DEFAULT_STRATEGY = "DefaultStrategy";
  public static final String DEFAULT_HYPEROPT = "DefaultHyperOpts";
  public static final String DEFAULT_EXCHANGE = "bittrex";
  public static final int HYPEROPT_EPOCH = 100;
  public static final int DYNAMIC_WHITELIST = 20;
  public static final int HYPEROPT_ALL_CPUS = -1;
  public static final String DEFAULT_EXPORT_FILENAME =
      Paths.get("user_data", "backtest_data", "backtest-result.json").toString();

  /** Destination key holding the selected subcommand name. */
  public static final String COMMAND_DEST = "command";

  /** Destination key holding the selected subcommand's handler class. */
  public static final String HANDLER_DEST = "handler";

  private Constants() {}
}
