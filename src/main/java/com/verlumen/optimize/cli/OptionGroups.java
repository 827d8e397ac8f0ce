package com.verlumen.optimize.cli;

import com.google.common.collect.ImmutableList;
import com.verlumen.optimize.time.TickerInterval;
import com.verlumen.optimize.validation.PositiveIntegerType;

/**
 * Reusable option bundles. Every method builds a new list, so a group merged into one command
 * never shares state with the same group merged into another.
 */
public final class OptionGroups {
  public static final ImmutableList<String> HYPEROPT_SPACES =
      ImmutableList.of("all", "buy", "sell", "roi", "stoploss");

  /** Options accepted by every command. */
  public static ImmutableList<OptionSpec> globalOptions() {
    return ImmutableList.of(
        OptionSpec.builder("loglevel", "-v", "--verbose")
            .setCardinality(Cardinality.COUNT)
            .setDefaultValue(0)
            .setHelp("Verbose mode (-vv for more, -vvv to get all messages).")
            .build(),
        OptionSpec.builder("logfile", "--logfile")
            .setMetavar("FILE")
            .setHelp("Log to the file specified.")
            .build(),
        OptionSpec.builder("version", "--version")
            .setCardinality(Cardinality.VERSION)
            .setHelp("Show program's version number and exit.")
            .build(),
        configOption(),
        OptionSpec.builder("datadir", "-d", "--datadir")
            .setMetavar("PATH")
            .setHelp("Path to backtest data.")
            .build(),
        OptionSpec.builder("strategy", "-s", "--strategy")
            .setDefaultValue(Constants.DEFAULT_STRATEGY)
            .setMetavar("NAME")
            .setHelp("Specify strategy class name (default: " + Constants.DEFAULT_STRATEGY + ").")
            .build(),
        OptionSpec.builder("strategy_path", "--strategy-path")
            .setMetavar("PATH")
            .setHelp("Specify additional strategy lookup path.")
            .build(),
        OptionSpec.builder("dynamic_whitelist", "--dynamic-whitelist")
            .setCardinality(Cardinality.OPTIONAL)
            .setValueType(Integer.class)
            .setConstant(Constants.DYNAMIC_WHITELIST)
            .setMetavar("INT")
            .setHelp(
                "Dynamically generate and update whitelist based on 24h BaseVolume (default: "
                    + Constants.DYNAMIC_WHITELIST
                    + "). DEPRECATED.")
            .build(),
        OptionSpec.builder("db_url", "--db-url")
            .setMetavar("PATH")
            .setHelp(
                "Override trades database URL, this is useful if dry_run is enabled"
                    + " or in custom deployments.")
            .build(),
        OptionSpec.builder("sd_notify", "--sd-notify")
            .setCardinality(Cardinality.FLAG)
            .setDefaultValue(false)
            .setHelp("Notify systemd service manager.")
            .build());
  }

  /** Options common to backtesting, edge and hyperopt. */
  public static ImmutableList<OptionSpec> optimizerSharedOptions() {
    return ImmutableList.of(
        OptionSpec.builder("ticker_interval", "-i", "--ticker-interval")
            .setChoices(TickerInterval.labels())
            .setHelp("Specify ticker interval (" + String.join(", ", TickerInterval.labels()) + ").")
            .build(),
        OptionSpec.builder("timerange", "--timerange")
            .setHelp("Specify what timerange of data to use.")
            .build(),
        OptionSpec.builder("max_open_trades", "--max_open_trades")
            .setValueType(Integer.class)
            .setHelp("Specify max_open_trades to use.")
            .build(),
        OptionSpec.builder("stake_amount", "--stake_amount")
            .setValueType(Double.class)
            .setHelp("Specify stake_amount.")
            .build(),
        OptionSpec.builder("refresh_pairs", "-r", "--refresh-pairs-cached")
            .setCardinality(Cardinality.FLAG)
            .setDefaultValue(false)
            .setHelp(
                "Refresh the pairs files in tests/testdata with the latest data from the exchange."
                    + " Use it if you want to run your optimization commands with up-to-date"
                    + " data.")
            .build());
  }

  public static ImmutableList<OptionSpec> backtestingOptions() {
    return ImmutableList.of(
        positionStackingOption(),
        maxMarketPositionsOption(),
        OptionSpec.builder("live", "-l", "--live")
            .setCardinality(Cardinality.FLAG)
            .setDefaultValue(false)
            .setHelp("Use live data.")
            .build(),
        OptionSpec.builder("strategy_list", "--strategy-list")
            .setCardinality(Cardinality.MANY)
            .setHelp(
                "Provide a space separated list of strategies to backtest. Please note that"
                    + " ticker-interval needs to be set either in config or via command line."
                    + " When using this together with --export trades, the strategy name is"
                    + " injected into the filename (so backtest-data.json becomes"
                    + " backtest-data-DefaultStrategy.json).")
            .build(),
        OptionSpec.builder("export", "--export")
            .setHelp("Export backtest results, argument are: trades. Example --export=trades")
            .build(),
        OptionSpec.builder("exportfilename", "--export-filename")
            .setDefaultValue(Constants.DEFAULT_EXPORT_FILENAME)
            .setMetavar("PATH")
            .setHelp(
                "Save backtest results to this filename, requires --export to be set as well."
                    + " Example --export-filename=user_data/backtest_data/backtest_today.json"
                    + " (default: "
                    + Constants.DEFAULT_EXPORT_FILENAME
                    + ").")
            .build());
  }

  public static ImmutableList<OptionSpec> edgeOptions() {
    return ImmutableList.of(
        OptionSpec.builder("stoploss_range", "--stoplosses")
            .setHelp(
                "Defines a range of stoploss against which edge will assess the strategy,"
                    + " the format is \"min,max,step\" (without any space)."
                    + " Example: --stoplosses=-0.01,-0.1,-0.001")
            .build());
  }

  public static ImmutableList<OptionSpec> hyperoptOptions() {
    return ImmutableList.of(
        OptionSpec.builder("hyperopt", "--customhyperopt")
            .setDefaultValue(Constants.DEFAULT_HYPEROPT)
            .setMetavar("NAME")
            .setHelp("Specify hyperopt class name (default: " + Constants.DEFAULT_HYPEROPT + ").")
            .build(),
        positionStackingOption(),
        maxMarketPositionsOption(),
        OptionSpec.builder("epochs", "-e", "--epochs")
            .setValueType(Integer.class)
            .setDefaultValue(Constants.HYPEROPT_EPOCH)
            .setMetavar("INT")
            .setHelp("Specify number of epochs (default: " + Constants.HYPEROPT_EPOCH + ").")
            .build(),
        OptionSpec.builder("spaces", "-s", "--spaces")
            .setCardinality(Cardinality.MANY)
            .setChoices(HYPEROPT_SPACES)
            .setDefaultValue(ImmutableList.of("all"))
            .setHelp("Specify which parameters to hyperopt. Space separate list. Default: all.")
            .build(),
        OptionSpec.builder("print_all", "--print-all")
            .setCardinality(Cardinality.FLAG)
            .setDefaultValue(false)
            .setHelp("Print all results, not only the best ones.")
            .build(),
        OptionSpec.builder("hyperopt_jobs", "-j", "--job-workers")
            .setValueType(Integer.class)
            .setDefaultValue(Constants.HYPEROPT_ALL_CPUS)
            .setMetavar("JOBS")
            .setHelp(
                "The number of concurrently running jobs for hyperoptimization (hyperopt worker"
                    + " processes). If -1 (default), all CPUs are used, for -2, all CPUs but one"
                    + " are used, etc. If 1 is given, no parallel computing code is used at all.")
            .build(),
        OptionSpec.builder("hyperopt_random_state", "--random-state")
            .setConverter(PositiveIntegerType.create())
            .setMetavar("INT")
            .setHelp(
                "Set random state to some positive integer for reproducible hyperopt results.")
            .build());
  }

  /** Options of the plotting scripts. */
  public static ImmutableList<OptionSpec> scriptOptions() {
    return ImmutableList.of(
        OptionSpec.builder("pairs", "-p", "--pairs")
            .setHelp("Show profits for only this pairs. Pairs are comma-separated.")
            .build());
  }

  /** Options of the test data download script, which does not take the global options. */
  public static ImmutableList<OptionSpec> testdataDownloadOptions() {
    return ImmutableList.of(
        OptionSpec.builder("pairs_file", "--pairs-file")
            .setMetavar("PATH")
            .setHelp("File containing a list of pairs to download.")
            .build(),
        OptionSpec.builder("export", "--export")
            .setMetavar("PATH")
            .setHelp("Export files to given dir.")
            .build(),
        configOption(),
        OptionSpec.builder("days", "--days")
            .setValueType(Integer.class)
            .setMetavar("INT")
            .setHelp("Download data for given number of days.")
            .build(),
        OptionSpec.builder("exchange", "--exchange")
            .setDefaultValue(Constants.DEFAULT_EXCHANGE)
            .setHelp(
                "Exchange name (default: "
                    + Constants.DEFAULT_EXCHANGE
                    + "). Only valid if no config is provided.")
            .build(),
        OptionSpec.builder("timeframes", "-t", "--timeframes")
            .setCardinality(Cardinality.MANY)
            .setChoices(TickerInterval.labels())
            .setDefaultValue(
                ImmutableList.of(
                    TickerInterval.ONE_MIN.getLabel(), TickerInterval.FIVE_MIN.getLabel()))
            .setHelp("Specify which tickers to download. Space separated list. Default: 1m 5m.")
            .build(),
        OptionSpec.builder("erase", "--erase")
            .setCardinality(Cardinality.FLAG)
            .setDefaultValue(false)
            .setHelp("Clean all existing data for the selected exchange/pairs/timeframes.")
            .build());
  }

  // No default here: OptimizeArguments substitutes one after parsing.
  private static OptionSpec configOption() {
    return OptionSpec.builder("config", "-c", "--config")
        .setCardinality(Cardinality.APPEND)
        .setMetavar("PATH")
        .setHelp(
            "Specify configuration file (default: "
                + Constants.DEFAULT_CONFIG
                + "). Multiple --config options may be used.")
        .build();
  }

  private static OptionSpec positionStackingOption() {
    return OptionSpec.builder("position_stacking", "--eps", "--enable-position-stacking")
        .setCardinality(Cardinality.FLAG)
        .setDefaultValue(false)
        .setHelp("Allow buying the same pair multiple times (position stacking).")
        .build();
  }

  private static OptionSpec maxMarketPositionsOption() {
    return OptionSpec.builder("use_max_market_positions", "--dmmp", "--disable-max-market-positions")
        .setCardinality(Cardinality.NEGATED_FLAG)
        .setDefaultValue(true)
        .setHelp(
            "Disable applying `max_open_trades` during backtest"
                + " (same as setting `max_open_trades` to a very high number).")
        .build();
  }

  private OptionGroups() {}
}
