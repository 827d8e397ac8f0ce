package com.verlumen.optimize.time;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/** Candle intervals understood by the data download and optimizer commands. */
public enum TickerInterval {
  ONE_MIN("1m", 1),
  THREE_MIN("3m", 3),
  FIVE_MIN("5m", 5),
  FIFTEEN_MIN("15m", 15),
  THIRTY_MIN("30m", 30),
  ONE_HOUR("1h", 60),
  TWO_HOUR("2h", 120),
  FOUR_HOUR("4h", 240),
  SIX_HOUR("6h", 360),
  EIGHT_HOUR("8h", 480),
  TWELVE_HOUR("12h", 720),
  ONE_DAY("1d", 1440),
  THREE_DAY("3d", 4320),
  ONE_WEEK("1w", 10080);

  private final String label;
  private final int minutes;

  TickerInterval(String label, int minutes) {
    this.label = label;
    this.minutes = minutes;
  }

  public String getLabel() {
    return label;
  }

  public int getMinutes() {
    return minutes;
  }

  public static TickerInterval fromLabel(String label) {
    return Arrays.stream(values())
        .filter(interval -> interval.label.equals(label))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No TickerInterval for " + label));
  }

  /** All labels, shortest interval first. */
  public static ImmutableList<String> labels() {
    return Arrays.stream(values())
        .map(TickerInterval::getLabel)
        .collect(ImmutableList.toImmutableList());
  }
}
