package com.verlumen.optimize.cli;

import com.google.common.flogger.FluentLogger;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;

/** Translates a {@link SchemaRegistry} into an argparse4j parser. */
final class ArgumentParserFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Creates a parser for {@code registry}. When {@code command} is null only the global options
   * are registered; otherwise the parser also accepts exactly that subcommand.
   */
  static ArgumentParser create(SchemaRegistry registry, String description, CommandSpec command) {
    ArgumentParser parser =
        ArgumentParsers.newFor(Constants.PROGRAM_NAME)
            .build()
            .defaultHelp(true)
            .description(description)
            .version("${prog} " + Constants.VERSION);
    if (!registry.commands().isEmpty()) {
      parser.epilog("commands: " + String.join(", ", registry.commandNames()));
    }

    for (OptionSpec option : registry.globalOptions()) {
      addOption(parser, option);
    }

    if (command != null) {
      Subparsers subparsers = parser.addSubparsers().dest(Constants.COMMAND_DEST);
      Subparser subparser =
          subparsers
              .addParser(command.name())
              .help(command.help())
              .setDefault(Constants.HANDLER_DEST, command.handler());
      for (OptionSpec option : command.options()) {
        addOption(subparser, option);
      }
      logger.atFine().log(
          "Built parser for command %s with %d options",
          command.name(), registry.mergedOptions(command).size());
    }
    return parser;
  }

  private static void addOption(ArgumentParser parser, OptionSpec option) {
    Argument argument =
        parser
            .addArgument(option.flags().toArray(new String[0]))
            .dest(option.dest())
            .help(option.help());
    option.metavar().ifPresent(argument::metavar);

    switch (option.cardinality()) {
      case SCALAR:
        setType(argument, option);
        break;
      case APPEND:
        setType(argument, option);
        argument.action(Arguments.append());
        break;
      case FLAG:
        argument.action(Arguments.storeTrue());
        break;
      case NEGATED_FLAG:
        argument.action(Arguments.storeFalse());
        break;
      case COUNT:
        argument.action(Arguments.count());
        break;
      case MANY:
        setType(argument, option);
        argument.nargs("+");
        break;
      case OPTIONAL:
        setType(argument, option);
        argument.nargs("?");
        option.constant().ifPresent(argument::setConst);
        break;
      case VERSION:
        argument.action(Arguments.version());
        break;
    }

    if (!option.choices().isEmpty()) {
      argument.choices(option.choices());
    }
    option.defaultValue().ifPresent(argument::setDefault);
  }

  private static void setType(Argument argument, OptionSpec option) {
    if (option.converter().isPresent()) {
      argument.type(option.converter().get());
    } else {
      argument.type(option.valueType());
    }
  }

  private ArgumentParserFactory() {}
}
