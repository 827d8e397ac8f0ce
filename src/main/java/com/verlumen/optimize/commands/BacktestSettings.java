package com.verlumen.optimize.commands;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

@AutoValue
public abstract class BacktestSettings {
  static BacktestSettings create(
      OptimizerSettings optimizer,
      ImmutableList<String> strategies,
      boolean strategyList,
      boolean positionStacking,
      boolean useMaxMarketPositions,
      boolean live,
      Optional<String> export,
      String exportFilename) {
    return new AutoValue_BacktestSettings(
        optimizer,
        strategies,
        strategyList,
        positionStacking,
        useMaxMarketPositions,
        live,
        export,
        exportFilename);
  }

  public abstract OptimizerSettings optimizer();

  /** Strategies to backtest, in the order given. */
  public abstract ImmutableList<String> strategies();

  /** Whether the strategies came from {@code --strategy-list}. */
  abstract boolean strategyList();

  public abstract boolean positionStacking();

  public abstract boolean useMaxMarketPositions();

  public abstract boolean live();

  public abstract Optional<String> export();

  public abstract String exportFilename();

  /**
   * Export file for {@code strategy}. With a strategy list the strategy name is appended to the
   * file stem, so {@code backtest-result.json} becomes {@code
   * backtest-result-DefaultStrategy.json}.
   */
  public String exportFilenameFor(String strategy) {
    if (!strategyList()) {
      return exportFilename();
    }
    Path path = Paths.get(exportFilename());
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stamped =
        dot > 0
            ? name.substring(0, dot) + "-" + strategy + name.substring(dot)
            : name + "-" + strategy;
    return path.resolveSibling(stamped).toString();
  }
}
