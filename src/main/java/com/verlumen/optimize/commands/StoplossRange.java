package com.verlumen.optimize.commands;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The {@code --stoplosses} sweep: values from {@code min} towards {@code max} by {@code step}. */
@AutoValue
public abstract class StoplossRange {
  private static final Splitter COMMA = Splitter.on(',');
  private static final long MAX_VALUES = 10_000;

  /**
   * Parses {@code min,max,step}.
   *
   * @throws IllegalArgumentException if the text is not three numbers or the step is zero, a number
   *     is not finite or the sweep would exceed 10000 values
   */
  public static StoplossRange parse(String text) {
    List<String> parts = COMMA.splitToList(text);
    checkArgument(
        parts.size() == 3, "Stoploss range must be \"min,max,step\" but was \"%s\"", text);
    double min;
    double max;
    double step;
    try {
      min = Double.parseDouble(parts.get(0));
      max = Double.parseDouble(parts.get(1));
      step = Double.parseDouble(parts.get(2));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Stoploss range contains a non-number: " + text, e);
    }
    checkArgument(
        Double.isFinite(min) && Double.isFinite(max) && Double.isFinite(step),
        "Stoploss range must contain finite numbers: %s",
        text);
    checkArgument(step != 0, "Stoploss range step must not be zero: %s", text);
    checkArgument(
        count(min, max, step) <= MAX_VALUES,
        "Stoploss range %s sweeps more than %s values",
        text,
        MAX_VALUES);
    return new AutoValue_StoplossRange(min, max, step);
  }

  public abstract double min();

  public abstract double max();

  public abstract double step();

  /** The swept values, {@code max} excluded. Empty when {@code step} points away from it. */
  public ImmutableList<Double> values() {
    long count = count(min(), max(), step());
    ImmutableList.Builder<Double> values = ImmutableList.builder();
    for (long i = 0; i < count; i++) {
      values.add(min() + i * step());
    }
    return values.build();
  }

  private static long count(double min, double max, double step) {
    return Math.max(0, (long) Math.ceil((max - min) / step));
  }
}
