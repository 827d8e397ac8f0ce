package com.verlumen.optimize.cli;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Parses the process arguments against a {@link SchemaRegistry} and normalizes the result.
 *
 * <p>The subcommand is the first positional argument, read past the values taken by global
 * options. Without one only the global options are accepted.
 */
@AutoValue
public abstract class OptimizeArguments {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Arguments for the optimize commands: backtesting, edge and hyperopt. */
  public static OptimizeArguments create(ImmutableList<String> args, String description) {
    return create(args, description, CommandSchemas.optimize());
  }

  public static OptimizeArguments create(
      ImmutableList<String> args, String description, SchemaRegistry registry) {
    return new AutoValue_OptimizeArguments(args, description, registry);
  }

  public abstract ImmutableList<String> args();

  abstract String description();

  public abstract SchemaRegistry registry();

  /**
   * The subcommand named in {@link #args()}, if any. Values of global options are skipped, so
   * {@code -s edge backtesting} selects backtesting and {@code -c edge} selects nothing.
   */
  public Optional<CommandSpec> selectedCommand() {
    ImmutableList<String> args = args();
    int i = 0;
    while (i < args.size()) {
      String arg = args.get(i++);
      if (arg.equals("--")) {
        return i < args.size() ? registry().command(args.get(i)) : Optional.empty();
      }
      if (!arg.startsWith("-") || arg.length() == 1) {
        return registry().command(arg);
      }
      Optional<OptionSpec> option = globalOption(arg);
      if (option.isEmpty()) {
        continue;
      }
      switch (option.get().cardinality()) {
        case SCALAR:
        case APPEND:
          i++;
          break;
        case OPTIONAL:
          if (i < args.size() && !args.get(i).startsWith("-")) {
            i++;
          }
          break;
        case MANY:
          while (i < args.size() && !args.get(i).startsWith("-")) {
            i++;
          }
          break;
        default:
          break;
      }
    }
    return Optional.empty();
  }

  /**
   * The global option spelled by {@code arg} when its value, if it takes one, is the next token.
   * Attached values ({@code --strategy=edge}, {@code -sedge}) and unknown flags yield nothing.
   */
  private Optional<OptionSpec> globalOption(String arg) {
    if (arg.contains("=")) {
      return Optional.empty();
    }
    ImmutableList<OptionSpec> globals = registry().globalOptions();
    Optional<OptionSpec> exact =
        globals.stream().filter(option -> option.flags().contains(arg)).findFirst();
    if (exact.isPresent() || !arg.startsWith("--")) {
      return exact;
    }
    // argparse4j accepts unambiguous prefixes of long flags.
    ImmutableList<OptionSpec> prefixed =
        globals.stream()
            .filter(option -> option.flags().stream().anyMatch(flag -> flag.startsWith(arg)))
            .collect(ImmutableList.toImmutableList());
    return prefixed.size() == 1 ? Optional.of(prefixed.get(0)) : Optional.empty();
  }

  /** Builds the argparse4j parser for {@link #args()}. */
  public ArgumentParser parser() {
    return ArgumentParserFactory.create(
        registry(), description(), selectedCommand().orElse(null));
  }

  /**
   * Parses {@link #args()}.
   *
   * @throws ArgumentParserException if an option is unknown or its value is rejected; a {@link
   *     net.sourceforge.argparse4j.helper.HelpScreenException} after help output
   */
  public ParsedArguments parse() throws ArgumentParserException {
    logger.atFine().log("Parsing %d arguments", args().size());
    Namespace namespace = parser().parseArgs(args().toArray(new String[0]));
    ParsedArguments parsed = ParsedArguments.normalize(namespace, Constants.DEFAULT_CONFIG);
    logger.atFine().log("Parsed arguments: %s", parsed);
    return parsed;
  }
}
