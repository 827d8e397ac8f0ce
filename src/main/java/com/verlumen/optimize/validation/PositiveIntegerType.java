package com.verlumen.optimize.validation;

import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.ArgumentType;

/** Converts an option value to an integer, rejecting anything that is not strictly positive. */
public final class PositiveIntegerType implements ArgumentType<Integer> {
  public static PositiveIntegerType create() {
    return new PositiveIntegerType();
  }

  private PositiveIntegerType() {}

  @Override
  public Integer convert(ArgumentParser parser, Argument arg, String value)
      throws ArgumentParserException {
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ArgumentParserException(message(value), e, parser, arg);
    }
    if (parsed <= 0) {
      throw new ArgumentParserException(message(value), parser, arg);
    }
    return parsed;
  }

  private static String message(String value) {
    return String.format(
        "%s is invalid for this parameter, should be a positive integer value", value);
  }
}
