package io.chainrun.cli.commands;

import io.chainrun.cli.ui.AnsiStyles;
import io.chainrun.core.ChainConfig;
import io.chainrun.core.ChainEngine;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ExecutionMode;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for checking chain definitions without running them.
///
/// Reports every configuration problem of each chain: missing steps, duplicate step
/// names, unknown or disabled operations, dangling `next` targets, RETRY without
/// `max_retries`, and branching in parallel mode. Operations are checked against the
/// built-in set.
///
/// ### Usage
/// ```bash
/// chainrun validate [-m <mode>] [--allow-branching-in-parallel] <file-or-directory>
/// ```
///
/// @see ChainCommand
@Command(name = "validate", description = "Validate chain definition files")
class ChainValidateCommand extends ChainCommand {

    @Parameters(index = "0", description = "Chain JSON file, or a directory of them")
    private Path target;

    @Option(
            names = {"-m", "--mode"},
            description = "Validate for this mode instead of the chain's own")
    private ExecutionMode mode;

    @Option(
            names = {"--allow-branching-in-parallel"},
            description = "Ignore `next` in parallel mode with a warning instead of rejecting it")
    private boolean allowBranchingInParallel;

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        List<ChainDefinition> chains;
        try {
            chains = loadChains(target);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Validation failed:"), e.getMessage());
            return EXIT_FAILED;
        }

        ChainConfig config =
                ChainConfig.builder().rejectBranchingInParallel(!allowBranchingInParallel).build();
        ChainEngine engine = createEngine(config, List.of());

        int invalid = 0;
        for (ChainDefinition chain : chains) {
            List<String> problems = engine.validate(chain, mode);
            if (problems.isEmpty()) {
                System.out.printf(
                        "%s %s%n",
                        styles.checkmark(), styles.bold("Chain is valid: " + chain.name()));
                System.out.println(
                        styles.gray(
                                "  Steps: "
                                        + chain.size()
                                        + " "
                                        + styles.bullet()
                                        + " Mode: "
                                        + effectiveMode(chain, config)));
            } else {
                invalid++;
                System.out.printf(
                        "%s %s%n",
                        styles.crossmark(), styles.bold("Chain is invalid: " + chain.name()));
                problems.forEach(problem -> System.out.println("  - " + styles.error(problem)));
            }
        }
        return invalid == 0 ? EXIT_OK : EXIT_FAILED;
    }

    private String effectiveMode(ChainDefinition chain, ChainConfig config) {
        ExecutionMode effective = mode != null ? mode : chain.modeOr(config.getDefaultMode());
        return effective.name().toLowerCase(Locale.ROOT);
    }
}
