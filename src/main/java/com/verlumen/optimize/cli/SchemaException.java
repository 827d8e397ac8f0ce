package com.verlumen.optimize.cli;

/** A command schema that cannot be turned into a parser, such as one reusing a destination key. */
public final class SchemaException extends IllegalStateException {
  SchemaException(String message) {
    super(message);
  }
}
