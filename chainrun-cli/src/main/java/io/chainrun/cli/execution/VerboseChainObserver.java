package io.chainrun.cli.execution;

import io.chainrun.cli.ui.AnsiStyles;
import io.chainrun.core.execution.ChainEvent;
import io.chainrun.core.execution.ChainObserver;
import io.chainrun.core.execution.StepStatus;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/// Observer that prints one line per step attempt to the terminal.
///
/// ### Output Format
/// ```
///   → search (gmail_search_messages) attempt 1
///   ✓ search ok [messages] 12 ms
///   ✗ upload [QUOTA] storage full 3 ms
/// ```
///
/// @implNote Thread-safe. Each event is printed under the stream's lock so lines from
/// parallel steps do not interleave.
/// @see io.chainrun.core.execution.ChainObserver
public class VerboseChainObserver implements ChainObserver {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out      output stream for printing (typically System.out), not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseChainObserver(PrintStream out, boolean useColor) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onEvent(ChainEvent event) {
        String line = format(event);
        if (line == null) {
            return;
        }
        synchronized (out) {
            out.println(line);
        }
    }

    private String format(ChainEvent event) {
        if (event instanceof ChainEvent.ChainStarted started) {
            return styles.gray(
                    "  Running "
                            + started.stepCount()
                            + " step(s) in "
                            + started.mode().name().toLowerCase(Locale.ROOT)
                            + " mode");
        }
        if (event instanceof ChainEvent.StepStarted started) {
            return String.format(
                    "  %s %s (%s) attempt %d",
                    styles.arrow(),
                    styles.bold(started.stepId()),
                    started.operationName(),
                    started.attempt());
        }
        if (event instanceof ChainEvent.StepCompleted completed) {
            boolean ok = completed.status() == StepStatus.SUCCESS;
            return String.format(
                    "  %s %s %s %s",
                    ok ? styles.checkmark() : styles.crossmark(),
                    styles.bold(completed.stepId()),
                    styles.successOrError(completed.summary(), ok),
                    styles.gray(completed.duration().toMillis() + " ms"));
        }
        return null;
    }
}
