package com.verlumen.optimize.cli;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A subcommand: its name, the options it accepts on top of the global ones and the handler that
 * runs it.
 */
@AutoValue
public abstract class CommandSpec {
  public static Builder builder(String name, Class<? extends CommandHandler> handler) {
    return new AutoValue_CommandSpec.Builder().setName(name).setHandler(handler).setHelp("");
  }

  public abstract String name();

  public abstract String help();

  /** Options of this command only, in registration order. */
  public abstract ImmutableList<OptionSpec> options();

  public abstract Class<? extends CommandHandler> handler();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setHandler(Class<? extends CommandHandler> handler);

    public abstract Builder setHelp(String help);

    abstract ImmutableList.Builder<OptionSpec> optionsBuilder();

    public Builder addOption(OptionSpec option) {
      optionsBuilder().add(option);
      return this;
    }

    public Builder addOptions(Iterable<OptionSpec> options) {
      optionsBuilder().addAll(options);
      return this;
    }

    public abstract CommandSpec build();
  }
}
