package com.verlumen.optimize.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.mu.util.stream.BiStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Normalized result of parsing the command line, keyed by destination. Values that were neither
 * supplied nor defaulted are absent (null).
 */
public final class ParsedArguments {
  private final Map<String, Object> values;

  private ParsedArguments(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Copies {@code namespace}, replacing an absent or empty {@code config} list with {@code
   * defaultConfig}. List values are copied into immutable lists.
   */
  static ParsedArguments normalize(Namespace namespace, String defaultConfig) {
    return normalize(namespace.getAttrs(), defaultConfig);
  }

  /** Creates arguments from raw values, normalized as a parse result would be. */
  public static ParsedArguments of(Map<String, ?> values) {
    return normalize(values, Constants.DEFAULT_CONFIG);
  }

  private static ParsedArguments normalize(Map<String, ?> attrs, String defaultConfig) {
    Map<String, Object> values = new LinkedHashMap<>();
    attrs.forEach((key, value) -> values.put(key, immutableCopy(value)));

    Object config = values.get("config");
    if (!(config instanceof List) || ((List<?>) config).isEmpty()) {
      values.put("config", ImmutableList.of(defaultConfig));
    }
    return new ParsedArguments(values);
  }

  /** Name of the selected subcommand, empty when none was given. */
  public Optional<String> command() {
    return Optional.ofNullable(getString(Constants.COMMAND_DEST));
  }

  /** Handler of the selected subcommand, empty when none was given. */
  @SuppressWarnings("unchecked")
  public Optional<Class<? extends CommandHandler>> handler() {
    return Optional.ofNullable((Class<? extends CommandHandler>) values.get(Constants.HANDLER_DEST));
  }

  /** Configuration files in the order given, or the single default file. */
  public ImmutableList<String> configPaths() {
    return getList("config");
  }

  public boolean contains(String dest) {
    return values.containsKey(dest);
  }

  @Nullable
  @SuppressWarnings("unchecked")
  public <T> T get(String dest) {
    return (T) values.get(dest);
  }

  @Nullable
  public String getString(String dest) {
    Object value = values.get(dest);
    return value == null ? null : value.toString();
  }

  @Nullable
  public Integer getInt(String dest) {
    return get(dest);
  }

  @Nullable
  public Double getDouble(String dest) {
    return get(dest);
  }

  /** Returns the flag stored under {@code dest}, false when absent. */
  public boolean getBoolean(String dest) {
    return Boolean.TRUE.equals(values.get(dest));
  }

  /** Returns the list stored under {@code dest}, empty when absent. */
  @SuppressWarnings("unchecked")
  public <E> ImmutableList<E> getList(String dest) {
    Object value = values.get(dest);
    return value == null ? ImmutableList.of() : (ImmutableList<E>) value;
  }

  /** Every value that is present, in parse order. */
  public ImmutableMap<String, Object> presentValues() {
    return BiStream.from(values)
        .filterValues(Objects::nonNull)
        .collect(ImmutableMap::toImmutableMap);
  }

  @Override
  public String toString() {
    return presentValues().toString();
  }

  private static Object immutableCopy(Object value) {
    return value instanceof List ? ImmutableList.copyOf((List<?>) value) : value;
  }
}
