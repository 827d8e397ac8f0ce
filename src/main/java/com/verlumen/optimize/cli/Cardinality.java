package com.verlumen.optimize.cli;

/** How many values an option takes and how they are stored under its destination key. */
public enum Cardinality {
  /** One value, the last occurrence wins. */
  SCALAR,
  /** One value per occurrence, collected into a list. */
  APPEND,
  /** No value; stores {@code true}. */
  FLAG,
  /** No value; stores {@code false}. */
  NEGATED_FLAG,
  /** No value; stores the number of occurrences. */
  COUNT,
  /** One or more values after a single flag. */
  MANY,
  /** Zero or one value; a bare flag stores the option's constant. */
  OPTIONAL,
  /** Prints the program version and stops parsing. */
  VERSION
}
