package com.verlumen.optimize.cli;

import com.verlumen.optimize.commands.BacktestingCommand;
import com.verlumen.optimize.commands.EdgeCommand;
import com.verlumen.optimize.commands.HyperoptCommand;

/** The command surfaces shipped with the tool. */
public final class CommandSchemas {
  public static final String BACKTESTING = "backtesting";
  public static final String EDGE = "edge";
  public static final String HYPEROPT = "hyperopt";

  /** Global options plus the backtesting, edge and hyperopt subcommands. */
  public static SchemaRegistry optimize() {
    return SchemaRegistry.builder()
        .addGlobalOptions(OptionGroups.globalOptions())
        .addCommand(
            CommandSpec.builder(BACKTESTING, BacktestingCommand.class)
                .setHelp("Backtesting module.")
                .addOptions(OptionGroups.optimizerSharedOptions())
                .addOptions(OptionGroups.backtestingOptions())
                .build())
        .addCommand(
            CommandSpec.builder(EDGE, EdgeCommand.class)
                .setHelp("Edge module.")
                .addOptions(OptionGroups.optimizerSharedOptions())
                .addOptions(OptionGroups.edgeOptions())
                .build())
        .addCommand(
            CommandSpec.builder(HYPEROPT, HyperoptCommand.class)
                .setHelp("Hyperopt module.")
                .addOptions(OptionGroups.optimizerSharedOptions())
                .addOptions(OptionGroups.hyperoptOptions())
                .build())
        .build();
  }

  /** Surface of the plotting scripts, which take no subcommand. */
  public static SchemaRegistry plotScript() {
    return SchemaRegistry.builder()
        .addGlobalOptions(OptionGroups.scriptOptions())
        .addGlobalOptions(OptionGroups.globalOptions())
        .addGlobalOptions(OptionGroups.optimizerSharedOptions())
        .build();
  }

  /** Surface of the test data download script. */
  public static SchemaRegistry testdataDownload() {
    return SchemaRegistry.builder()
        .addGlobalOptions(OptionGroups.testdataDownloadOptions())
        .build();
  }

  private CommandSchemas() {}
}
