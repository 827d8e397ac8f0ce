package com.verlumen.optimize.cli;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.optimize.commands.BacktestingCommand;
import com.verlumen.optimize.commands.EdgeCommand;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SchemaRegistryTest {
  private final SchemaRegistry registry = CommandSchemas.optimize();

  @Test
  public void optimize_registersCommandsInOrder() {
    assertThat(registry.commandNames())
        .containsExactly("backtesting", "edge", "hyperopt")
        .inOrder();
  }

  @Test
  public void command_boundToHandler() {
    assertThat(registry.command("backtesting").get().handler())
        .isEqualTo(BacktestingCommand.class);
    assertThat(registry.command("edge").get().handler()).isEqualTo(EdgeCommand.class);
    assertThat(registry.command("trade")).isEmpty();
  }

  @Test
  public void mergedOptions_prependsGlobalOptions() {
    CommandSpec edge = registry.command("edge").get();

    ImmutableList<OptionSpec> merged = registry.mergedOptions(edge);

    assertThat(merged.subList(0, registry.globalOptions().size()))
        .containsExactlyElementsIn(registry.globalOptions())
        .inOrder();
    assertThat(merged.get(merged.size() - 1).dest()).isEqualTo("stoploss_range");
  }

  @Test
  public void sharedGroup_mergedIntoTwoCommands_yieldsIndependentLists() {
    CommandSpec backtesting = registry.command("backtesting").get();
    CommandSpec hyperopt = registry.command("hyperopt").get();
    OptionSpec extra = OptionSpec.builder("extra", "--extra").build();

    CommandSpec extended = backtesting.toBuilder().addOption(extra).build();

    assertThat(extended.options()).contains(extra);
    assertThat(backtesting.options()).doesNotContain(extra);
    assertThat(hyperopt.options()).doesNotContain(extra);
    assertThat(backtesting.options()).isNotSameInstanceAs(hyperopt.options());
  }

  @Test
  public void options_cannotBeModified() {
    CommandSpec backtesting = registry.command("backtesting").get();

    assertThrows(
        UnsupportedOperationException.class,
        () -> backtesting.options().add(OptionSpec.builder("extra", "--extra").build()));
  }

  @Test
  public void build_duplicateDestinationAcrossGroups_throws() {
    CommandSpec command =
        CommandSpec.builder("backtesting", BacktestingCommand.class)
            .addOption(OptionSpec.builder("strategy", "--other-strategy").build())
            .build();

    SchemaException thrown =
        assertThrows(
            SchemaException.class,
            () ->
                SchemaRegistry.builder()
                    .addGlobalOptions(OptionGroups.globalOptions())
                    .addCommand(command)
                    .build());

    assertThat(thrown).hasMessageThat().contains("'strategy'");
  }

  @Test
  public void build_groupMergedTwiceIntoCommand_throws() {
    CommandSpec command =
        CommandSpec.builder("edge", EdgeCommand.class)
            .addOptions(OptionGroups.optimizerSharedOptions())
            .addOptions(OptionGroups.optimizerSharedOptions())
            .build();

    assertThrows(
        SchemaException.class, () -> SchemaRegistry.builder().addCommand(command).build());
  }

  @Test
  public void build_duplicateCommandName_throws() {
    CommandSpec edge = CommandSpec.builder("edge", EdgeCommand.class).build();

    SchemaException thrown =
        assertThrows(
            SchemaException.class,
            () -> SchemaRegistry.builder().addCommand(edge).addCommand(edge).build());

    assertThat(thrown).hasMessageThat().contains("edge");
  }

  @Test
  public void build_duplicateFlagOnOneLevel_throws() {
    CommandSpec command =
        CommandSpec.builder("edge", EdgeCommand.class)
            .addOption(OptionSpec.builder("first", "-x").build())
            .addOption(OptionSpec.builder("second", "-x").build())
            .build();

    assertThrows(
        SchemaException.class, () -> SchemaRegistry.builder().addCommand(command).build());
  }

  @Test
  public void build_sameFlagOnGlobalAndCommandLevel_isAllowed() {
    // -s is --strategy globally and --spaces for hyperopt.
    assertThat(registry.command("hyperopt").get().options().stream()
            .anyMatch(option -> option.flags().contains("-s")))
        .isTrue();
    assertThat(registry.globalOptions().stream()
            .anyMatch(option -> option.flags().contains("-s")))
        .isTrue();
  }
}
