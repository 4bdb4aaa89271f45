package io.chainrun.cli.commands;

import io.chainrun.cli.operations.BuiltinOperations;
import io.chainrun.core.ChainConfig;
import io.chainrun.core.ChainEngine;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.execution.ChainObserver;
import io.chainrun.serialization.ChainSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for chain commands.
///
/// Owns the banner, the shared `--verbose` and `--no-color` options, chain file loading
/// and engine assembly with the built-in operations. Subclasses implement
/// {@link #execute()} and return the process exit code.
///
/// ### Exit Codes
/// - `0` - chain valid, or run completed
/// - `1` - chain invalid, could not be loaded, or run failed
/// - `2` - usage error (reported by picocli)
/// - `3` - run partially completed
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ChainRunCommand
/// @see ChainValidateCommand
public abstract class ChainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PARTIAL = 3;

    private static final String[] BANNER = {
        "",
        "       _           _",
        "   ___| |__   __ _(_)_ __  _ __ _   _ _ __",
        "  / __| '_ \\ / _` | | '_ \\| '__| | | | '_ \\",
        " | (__| | | | (_| | | | | | |  | |_| | | | |",
        "  \\___|_| |_|\\__,_|_|_| |_|_|   \\__,_|_| |_|",
        "",
        " Operation chains, sequential or parallel",
        ""
    };

    @Option(
            names = {"-v", "--verbose"},
            description = "Print every step attempt and enable debug logging")
    protected boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    protected boolean color = true;

    @Override
    public final Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    protected abstract int execute();

    /// Whether to print the banner before executing; machine-readable output turns it off.
    protected boolean showBanner() {
        return true;
    }

    /// Loads one chain file, or every `*.json` file of a directory.
    ///
    /// @param target file or directory, not null
    /// @return loaded chains, never null
    /// @throws IllegalArgumentException if a file is not a chain or the directory is empty
    /// @throws java.io.UncheckedIOException if a file cannot be read
    protected List<ChainDefinition> loadChains(Path target) {
        if (Files.isDirectory(target)) {
            List<ChainDefinition> chains = ChainSerializer.loadFromDirectory(target);
            if (chains.isEmpty()) {
                throw new IllegalArgumentException("No chain files found in " + target);
            }
            return chains;
        }
        return List.of(ChainSerializer.loadFromFile(target));
    }

    /// Builds an engine with the built-in operations registered.
    ///
    /// @param config    engine configuration, not null
    /// @param observers observers to attach, not null
    /// @return new engine, never null
    protected ChainEngine createEngine(ChainConfig config, List<ChainObserver> observers) {
        ChainEngine.Builder builder = ChainEngine.builder().config(config);
        BuiltinOperations.definitions().forEach(builder::operation);
        observers.forEach(builder::observer);
        return builder.build();
    }

    private static void enableDebugLogging() {
        Logger.getLogger("io.chainrun").setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
