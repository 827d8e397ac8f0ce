package com.verlumen.optimize.time;

/** Thrown when a {@code --timerange} value matches none of the recognized forms. */
public final class InvalidTimeRangeException extends IllegalArgumentException {
  private final String text;

  InvalidTimeRangeException(String text) {
    super(String.format("Incorrect syntax for timerange \"%s\"", text));
    this.text = text;
  }

  InvalidTimeRangeException(String text, Throwable cause) {
    super(String.format("Incorrect syntax for timerange \"%s\"", text), cause);
    this.text = text;
  }

  /** The rejected input. */
  public String text() {
    return text;
  }
}
