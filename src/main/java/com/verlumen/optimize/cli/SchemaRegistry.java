package com.verlumen.optimize.cli;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * The complete command surface: the global options and every registered subcommand. Instances are
 * checked for destination and flag clashes when built and are immutable afterwards.
 */
@AutoValue
public abstract class SchemaRegistry {
  public static Builder builder() {
    return new AutoValue_SchemaRegistry.Builder();
  }

  /** Options accepted before any subcommand, and the whole surface when no subcommand is given. */
  public abstract ImmutableList<OptionSpec> globalOptions();

  public abstract ImmutableList<CommandSpec> commands();

  public Optional<CommandSpec> command(String name) {
    return commands().stream().filter(command -> command.name().equals(name)).findFirst();
  }

  public ImmutableList<String> commandNames() {
    return commands().stream().map(CommandSpec::name).collect(ImmutableList.toImmutableList());
  }

  /** The global options followed by the options of {@code command}. */
  public ImmutableList<OptionSpec> mergedOptions(CommandSpec command) {
    return ImmutableList.<OptionSpec>builder()
        .addAll(globalOptions())
        .addAll(command.options())
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableList.Builder<OptionSpec> globalOptionsBuilder();

    abstract ImmutableList.Builder<CommandSpec> commandsBuilder();

    public Builder addGlobalOptions(Iterable<OptionSpec> options) {
      globalOptionsBuilder().addAll(options);
      return this;
    }

    public Builder addCommand(CommandSpec command) {
      commandsBuilder().add(command);
      return this;
    }

    abstract SchemaRegistry autoBuild();

    /**
     * Builds the registry.
     *
     * @throws SchemaException if two commands share a name, a command's merged options reuse a
     *     destination key, or a flag is declared twice on the same parser level
     */
    public SchemaRegistry build() {
      SchemaRegistry registry = autoBuild();
      checkDests("global options", registry.globalOptions());
      checkFlags("global options", registry.globalOptions());

      Set<String> names = new HashSet<>();
      for (CommandSpec command : registry.commands()) {
        if (!names.add(command.name())) {
          throw new SchemaException("Duplicate command name: " + command.name());
        }
        checkDests("command " + command.name(), registry.mergedOptions(command));
        checkFlags("command " + command.name(), command.options());
      }
      return registry;
    }

    private static void checkDests(String owner, ImmutableList<OptionSpec> options) {
      Set<String> dests = new HashSet<>();
      for (OptionSpec option : options) {
        if (!dests.add(option.dest())) {
          throw new SchemaException(
              String.format("Destination key '%s' is defined twice in %s", option.dest(), owner));
        }
      }
    }

    private static void checkFlags(String owner, ImmutableList<OptionSpec> options) {
      Set<String> flags = new HashSet<>();
      for (OptionSpec option : options) {
        for (String flag : option.flags()) {
          if (!flags.add(flag)) {
            throw new SchemaException(
                String.format("Flag '%s' is defined twice in %s", flag, owner));
          }
        }
      }
    }
  }
}
