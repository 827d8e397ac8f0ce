package com.verlumen.optimize.time;

import java.io.Serializable;
import javax.annotation.Nullable;

/** Resolves the value of {@code --timerange} into a {@link TimeRange}. */
public interface TimeRangeParser extends Serializable {
  /**
   * Parses {@code text}, returning {@link TimeRange#UNBOUNDED} when it is null.
   *
   * @throws InvalidTimeRangeException if {@code text} matches none of the recognized forms
   */
  TimeRange parse(@Nullable String text);
}
