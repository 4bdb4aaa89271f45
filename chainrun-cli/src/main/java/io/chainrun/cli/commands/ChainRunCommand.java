package io.chainrun.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainrun.cli.execution.VerboseChainObserver;
import io.chainrun.cli.ui.AnsiStyles;
import io.chainrun.core.ChainConfig;
import io.chainrun.core.ChainEngine;
import io.chainrun.core.chain.ChainConfigurationException;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ChainNotFoundException;
import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.chain.InputOverrides;
import io.chainrun.core.execution.ChainObserver;
import io.chainrun.core.execution.ChainResult;
import io.chainrun.core.execution.ChainStatus;
import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.serialization.ChainSerializer;
import io.chainrun.serialization.audit.JsonLinesAuditSink;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/// CLI command for running a chain.
///
/// The target is a chain file; a directory is refused. With `--chains-dir`, every chain
/// in that directory is registered and the target is the name of the chain to run, so
/// overrides can address a stored chain the way a composite operation call would.
///
/// ### Usage
/// ```bash
/// chainrun run [-v] [--json] [-m <mode>] [--parallelism <n>] [--max-revisits <n>]
///              [--pass-results] [--continue-on-error]
///              [-c <json-or-file>] [-p key=value]... [-o step.input=value]...
///              [-d <chains-dir>] [--audit-log <file>] <file-or-name>
/// ```
///
/// Non-positive `--parallelism` and `--max-revisits` values are usage errors (exit `2`).
///
/// ### Initial State
/// `-c` is merged first, then every `-p`. Values of `-p` and `-o` are read as JSON when
/// they parse (`10`, `true`, `[1,2]`) and as plain strings otherwise.
///
/// @see ChainCommand
@Command(name = "run", description = "Run a chain")
class ChainRunCommand extends ChainCommand {

    private static final Logger logger = Logger.getLogger(ChainRunCommand.class.getName());

    private static final ObjectMapper JSON =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Spec private CommandSpec spec;

    @Parameters(
            index = "0",
            description = "Chain JSON file, or a chain name when --chains-dir is given")
    private String target;

    @Option(
            names = {"-d", "--chains-dir"},
            description = "Directory of chain files to register; the target is then a name")
    private Path chainsDir;

    @Option(
            names = {"-p", "--param"},
            description = "Initial state entry as key=value")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(
            names = {"-c", "--context"},
            description = "Initial state as a JSON object string or a path to a JSON file")
    private String contextInput;

    @Option(
            names = {"-o", "--override"},
            description = "Literal input override as <step-or-operation>.<input>=value")
    private Map<String, String> overrides = new LinkedHashMap<>();

    @Option(
            names = {"-m", "--mode"},
            description = "Execution mode, overriding the chain's own: sequential or parallel")
    private ExecutionMode mode;

    private Integer parallelism;

    private Integer maxRevisits;

    @Option(
            names = {"--pass-results"},
            description = "Pass each step's output to the next as _previous_result (sequential)")
    private boolean passResults;

    @Option(
            names = {"--continue-on-error"},
            description = "Record stopping failures as bypassed and go on with the next step")
    private boolean continueOnError;

    @Option(
            names = {"--allow-branching-in-parallel"},
            description = "Ignore `next` in parallel mode with a warning instead of rejecting it")
    private boolean allowBranchingInParallel;

    @Option(
            names = {"--json"},
            description = "Print the full chain result as JSON")
    private boolean json;

    @Option(
            names = {"--audit-log"},
            description = "Append one JSON line per step attempt to this file")
    private Path auditLog;

    @Option(
            names = {"--parallelism"},
            paramLabel = "<n>",
            description = "Maximum concurrent steps in parallel mode (default: 8)")
    void setParallelism(int value) {
        parallelism = requirePositive(value, "--parallelism");
    }

    @Option(
            names = {"--max-revisits", "--max-steps"},
            paramLabel = "<n>",
            description = "Maximum jumps back to executed steps before a looping chain is "
                    + "stopped (default: 100)")
    void setMaxRevisits(int value) {
        maxRevisits = requirePositive(value, "--max-revisits");
    }

    private int requirePositive(int value, String option) {
        if (value < 1) {
            throw new ParameterException(
                    spec.commandLine(),
                    "Invalid value for option '" + option + "': must be positive but was " + value);
        }
        return value;
    }

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color && !json);

        JsonLinesAuditSink auditSink = null;
        try {
            Map<String, Object> state = initialState();
            Map<String, Object> inputOverrides = parseValues(overrides);

            List<ChainObserver> observers = new ArrayList<>();
            if (verbose && !json) {
                observers.add(new VerboseChainObserver(System.out, color));
            }
            if (auditLog != null) {
                auditSink = JsonLinesAuditSink.appendingTo(auditLog);
                observers.add(auditSink);
            }
            ChainEngine engine = createEngine(buildConfig(), observers);
            ExecutionContext context =
                    ExecutionContext.of(System.getProperty("user.name"), Map.of("source", "cli"));

            ChainResult result;
            if (chainsDir != null) {
                loadChains(chainsDir).forEach(engine::registerChain);
                result = engine.execute(target, state, inputOverrides, mode, context);
            } else {
                Path chainFile = Path.of(target);
                if (Files.isDirectory(chainFile)) {
                    throw new IllegalArgumentException(
                            target + " is a directory; use --chains-dir " + target
                                    + " <chain-name> to run a chain from it");
                }
                ChainDefinition chain = loadChains(chainFile).get(0);
                if (!chain.enabled()) {
                    throw new ChainConfigurationException("Chain is disabled: " + chain.name());
                }
                result =
                        engine.execute(
                                InputOverrides.apply(chain, inputOverrides), state, mode, context);
            }

            if (json) {
                System.out.println(ChainSerializer.resultToJson(result));
            } else {
                printSummary(result, styles);
            }
            return exitCodeOf(result.status());
        } catch (ChainConfigurationException e) {
            System.err.printf("%s %s%n", styles.crossmark(), styles.bold("Invalid chain:"));
            e.problems().forEach(problem -> System.err.println("  - " + problem));
            return EXIT_FAILED;
        } catch (ChainNotFoundException
                | IllegalArgumentException
                | IOException
                | UncheckedIOException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Chain execution failed:"), e.getMessage());
            return EXIT_FAILED;
        } finally {
            closeQuietly(auditSink);
        }
    }

    private ChainConfig buildConfig() {
        ChainConfig.Builder builder =
                ChainConfig.builder()
                        .rejectBranchingInParallel(!allowBranchingInParallel)
                        .passResults(passResults)
                        .stopOnError(!continueOnError);
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (maxRevisits != null) {
            builder.maxStepRevisits(maxRevisits);
        }
        return builder.build();
    }

    private Map<String, Object> initialState() throws IOException {
        Map<String, Object> state = new LinkedHashMap<>(loadContext(contextInput));
        state.putAll(parseValues(params));
        return state;
    }

    /// Loads the `-c` value: a JSON object string when it starts with `{`, otherwise a file.
    private static Map<String, Object> loadContext(String input) throws IOException {
        if (input == null || input.isBlank()) {
            return Map.of();
        }
        String content = input.trim().startsWith("{") ? input : Files.readString(Path.of(input));
        try {
            return JSON.readValue(content, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Context is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> parseValues(Map<String, String> raw) {
        Map<String, Object> values = new LinkedHashMap<>();
        raw.forEach((key, value) -> values.put(key, parseValue(value)));
        return values;
    }

    static Object parseValue(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return JSON.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    private static void printSummary(ChainResult result, AnsiStyles styles) {
        boolean completed = result.status() == ChainStatus.COMPLETED;
        String name = result.chainName() != null ? result.chainName() : result.chainId();
        System.out.printf(
                "%n%s %s%n",
                completed ? styles.checkmark() : styles.crossmark(),
                styles.bold("Chain " + name + " finished"));
        System.out.printf(
                "  Status: %s %s Steps: %d (%d ok, %d failed) %s %d ms%n",
                styles.status(result.status()),
                styles.bullet(),
                result.stepsExecuted(),
                result.stepsSucceeded(),
                result.stepsFailed(),
                styles.bullet(),
                result.duration().toMillis());
        if (result.cancelled()) {
            System.out.println(styles.warn("  Cancelled"));
        }
        result.errorMessage().ifPresent(error -> System.out.println("  Error: " + error));
        if (!result.finalState().isEmpty()) {
            System.out.println(styles.bold("  Final state:"));
            result.finalState()
                    .forEach((key, value) -> System.out.printf("    %s = %s%n", key, value));
        }
    }

    private static int exitCodeOf(ChainStatus status) {
        return switch (status) {
            case COMPLETED -> EXIT_OK;
            case PARTIALLY_COMPLETED -> EXIT_PARTIAL;
            case FAILED -> EXIT_FAILED;
        };
    }

    private static void closeQuietly(JsonLinesAuditSink sink) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (IOException e) {
            logger.warning("Failed to close audit log: " + e.getMessage());
        }
    }
}
