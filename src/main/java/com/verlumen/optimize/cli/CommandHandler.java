package com.verlumen.optimize.cli;

/**
 * Entry point of a subcommand. Implementations are looked up by the dispatcher from the class
 * recorded in {@link CommandSpec#handler()}.
 */
public interface CommandHandler {
  void run(ParsedArguments arguments);
}
