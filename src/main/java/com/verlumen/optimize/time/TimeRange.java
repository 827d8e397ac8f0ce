package com.verlumen.optimize.time;

import com.google.auto.value.AutoValue;

/**
 * A resolved {@code --timerange} window. Each side carries the kind of bound it describes and its
 * value; a side whose type is {@link BoundType#NONE} has value 0 and does not restrict the data.
 */
@AutoValue
public abstract class TimeRange {
  /** The range that places no restriction on the data. */
  public static final TimeRange UNBOUNDED = create(BoundType.NONE, BoundType.NONE, 0, 0);

  /** How a bound of the range is interpreted by the data selection. */
  public enum BoundType {
    NONE,
    /** Epoch seconds. */
    DATE,
    /** A line count; a negative stop value selects the last lines. */
    LINE,
    /** An absolute index into the data set. */
    INDEX
  }

  static TimeRange create(
      BoundType startType, BoundType stopType, long startValue, long stopValue) {
    return new AutoValue_TimeRange(startType, stopType, startValue, stopValue);
  }

  public abstract BoundType startType();

  public abstract BoundType stopType();

  public abstract long startValue();

  public abstract long stopValue();

  public boolean hasStart() {
    return startType() != BoundType.NONE;
  }

  public boolean hasStop() {
    return stopType() != BoundType.NONE;
  }
}
