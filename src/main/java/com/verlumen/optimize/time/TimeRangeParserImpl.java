package com.verlumen.optimize.time;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import javax.annotation.Nullable;

final class TimeRangeParserImpl implements TimeRangeParser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  TimeRangeParserImpl() {}

  @Override
  public TimeRange parse(@Nullable String text) {
    if (text == null) {
      return TimeRange.UNBOUNDED;
    }

    for (TimeRangeSyntax syntax : TimeRangeSyntax.values()) {
      Optional<TimeRange> range;
      try {
        range = syntax.match(text);
      } catch (DateTimeParseException | NumberFormatException e) {
        throw new InvalidTimeRangeException(text, e);
      }
      if (range.isPresent()) {
        logger.atFine().log("Timerange \"%s\" resolved as %s: %s", text, syntax, range.get());
        return range.get();
      }
    }
    throw new InvalidTimeRangeException(text);
  }
}
