package io.chainrun.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Top-level `chainrun` command.
///
/// Registers the subcommands:
/// - `run` - Execute a chain file or a stored chain by name
/// - `validate` - Report configuration problems of chain files
///
/// Without a subcommand, prints usage.
///
/// @see ChainRunCommand
/// @see ChainValidateCommand
@Command(
        name = "chainrun",
        description = "Runs chains of operations sequentially or in parallel",
        mixinStandardHelpOptions = true,
        version = "chainrun 0.1.0",
        subcommands = {ChainRunCommand.class, ChainValidateCommand.class})
public class ChainrunCli implements Runnable {

    @Spec private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    /// Creates the command line with enum options accepted in any case (`--mode parallel`).
    public static CommandLine commandLine() {
        return new CommandLine(new ChainrunCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }
}
