package com.verlumen.optimize.commands;

import com.google.auto.value.AutoValue;
import java.util.Optional;

@AutoValue
public abstract class EdgeSettings {
  static EdgeSettings create(OptimizerSettings optimizer, Optional<StoplossRange> stoplossRange) {
    return new AutoValue_EdgeSettings(optimizer, stoplossRange);
  }

  public abstract OptimizerSettings optimizer();

  /** Empty when the configured stoploss range applies. */
  public abstract Optional<StoplossRange> stoplossRange();
}
