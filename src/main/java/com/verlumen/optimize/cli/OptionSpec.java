package com.verlumen.optimize.cli;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.ArgumentType;

/** Definition of a single command-line option. */
@AutoValue
public abstract class OptionSpec {
  /**
   * Starts an option stored under {@code dest}. The option defaults to a single string value
   * with no default and no help text.
   */
  public static Builder builder(String dest, String... flags) {
    return new AutoValue_OptionSpec.Builder()
        .setDest(dest)
        .setFlags(ImmutableList.copyOf(flags))
        .setCardinality(Cardinality.SCALAR)
        .setValueType(String.class)
        .setChoices(ImmutableList.of())
        .setHelp("");
  }

  public abstract ImmutableList<String> flags();

  public abstract String dest();

  public abstract Cardinality cardinality();

  public abstract Class<?> valueType();

  /** Converter taking precedence over {@link #valueType()}. */
  public abstract Optional<ArgumentType<?>> converter();

  public abstract ImmutableList<String> choices();

  public abstract Optional<Object> defaultValue();

  /** Value stored when an {@link Cardinality#OPTIONAL} option is given without a value. */
  public abstract Optional<Object> constant();

  public abstract Optional<String> metavar();

  public abstract String help();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setFlags(ImmutableList<String> flags);

    abstract Builder setDest(String dest);

    public abstract Builder setCardinality(Cardinality cardinality);

    public abstract Builder setValueType(Class<?> valueType);

    public abstract Builder setConverter(ArgumentType<?> converter);

    public abstract Builder setChoices(ImmutableList<String> choices);

    public abstract Builder setDefaultValue(Object defaultValue);

    public abstract Builder setConstant(Object constant);

    public abstract Builder setMetavar(String metavar);

    public abstract Builder setHelp(String help);

    abstract OptionSpec autoBuild();

    public OptionSpec build() {
      OptionSpec option = autoBuild();
      checkArgument(!option.flags().isEmpty(), "Option %s has no flags", option.dest());
      checkArgument(
          option.flags().stream().allMatch(flag -> flag.startsWith("-")),
          "Option %s has a flag not starting with '-': %s",
          option.dest(),
          option.flags());
      return option;
    }
  }
}
