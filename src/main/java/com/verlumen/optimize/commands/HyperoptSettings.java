package com.verlumen.optimize.commands;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.optimize.cli.OptionGroups;
import java.util.Optional;

@AutoValue
public abstract class HyperoptSettings {
  static Builder builder() {
    return new AutoValue_HyperoptSettings.Builder();
  }

  /**
   * Number of hyperopt workers for a {@code --job-workers} value. Positive values are used as
   * given; -1 means all {@code cpus}, -2 all but one and so on, never fewer than one.
   */
  static int resolveJobs(int requested, int cpus) {
    checkArgument(requested != 0, "Job workers must not be 0");
    if (requested > 0) {
      return requested;
    }
    return Math.max(1, cpus + 1 + requested);
  }

  public abstract OptimizerSettings optimizer();

  public abstract String hyperopt();

  public abstract int epochs();

  public abstract ImmutableList<String> spaces();

  public abstract boolean printAll();

  public abstract boolean positionStacking();

  public abstract boolean useMaxMarketPositions();

  public abstract int jobs();

  public abstract Optional<Integer> randomState();

  /** Whether {@code space} is optimized, either by name or through {@code all}. */
  public boolean hasSpace(String space) {
    return spaces().contains("all") || spaces().contains(space);
  }

  /** The concrete spaces to optimize, with {@code all} expanded. */
  public ImmutableList<String> optimizedSpaces() {
    return OptionGroups.HYPEROPT_SPACES.stream()
        .filter(space -> !space.equals("all"))
        .filter(this::hasSpace)
        .collect(ImmutableList.toImmutableList());
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setOptimizer(OptimizerSettings optimizer);

    abstract Builder setHyperopt(String hyperopt);

    abstract Builder setEpochs(int epochs);

    abstract Builder setSpaces(ImmutableList<String> spaces);

    abstract Builder setPrintAll(boolean printAll);

    abstract Builder setPositionStacking(boolean positionStacking);

    abstract Builder setUseMaxMarketPositions(boolean useMaxMarketPositions);

    abstract Builder setJobs(int jobs);

    abstract Builder setRandomState(Optional<Integer> randomState);

    abstract HyperoptSettings build();
  }
}
