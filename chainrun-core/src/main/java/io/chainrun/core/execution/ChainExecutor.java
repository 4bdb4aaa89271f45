package io.chainrun.core.execution;

import io.chainrun.core.ChainConfig;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ChainValidator;
import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.execution.ChainEvent.ChainCompleted;
import io.chainrun.core.execution.ChainEvent.ChainStarted;
import io.chainrun.core.execution.ChainEvent.StepCompleted;
import io.chainrun.core.execution.ChainEvent.StepStarted;
import io.chainrun.core.operation.InvocationOutcome;
import io.chainrun.core.operation.OperationInvoker;
import io.chainrun.core.operation.OperationRegistry;
import io.chainrun.core.policy.PolicyDecision;
import io.chainrun.core.policy.PolicyEvaluator;
import io.chainrun.core.state.ChainState;
import io.chainrun.core.template.StepInputResolver;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs chain definitions and produces a {@link ChainResult}.
///
/// ### Sequential Flow
/// 1. Validate the chain, failing fast with
///    {@link io.chainrun.core.chain.ChainConfigurationException}
/// 2. Seed {@link ChainState} from the initial parameters, cursor at step 0
/// 3. For the step under the cursor: resolve inputs, invoke, evaluate the policy
/// 4. Apply state writes, append one {@link StepResult} per attempt
/// 5. Retry the same step, jump, fall through or stop as the decision says
///
/// Jumping back to a step that already ran counts as a revisit. A run that exceeds
/// {@link ChainConfig#getMaxStepRevisits()} revisits fails. With
/// {@link ChainConfig#isPassResults()} each step also receives the output of the step
/// executed before it under {@value #PREVIOUS_RESULT}.
///
/// ### Parallel Flow
/// Every step resolves against one snapshot of the initial state and runs on a pool
/// created for this call only. Each step retries on its own. After all tasks join,
/// output mappings are applied and history appended in step order; `next` is not used.
///
/// ### Cancellation
/// Interrupting the calling thread stops the run before the next step, cancels in-flight
/// parallel tasks and yields a cancelled, partially completed result. The interrupt flag
/// stays set when `execute` returns. Worker threads are drained before the completion
/// event; events from a worker that outlives the drain timeout are dropped.
///
/// @implNote Thread-safe. One executor may run many chains concurrently; all per-run state
/// lives on the stack of the calling thread, apart from the registry of
/// {@link #activeChains() active runs}. Observer registration uses a
/// {@link CopyOnWriteArrayList}.
///
/// @see PolicyEvaluator for the decision rules
/// @see ChainObserver for event subscription
public class ChainExecutor {

    private static final Logger logger = Logger.getLogger(ChainExecutor.class.getName());

    /// Argument key under which a step receives the previous step's output.
    public static final String PREVIOUS_RESULT = "_previous_result";

    private static final long WORKER_DRAIN_SECONDS = 5;

    private final OperationRegistry registry;
    private final OperationInvoker invoker;
    private final StepInputResolver resolver;
    private final ChainConfig config;
    private final List<ChainObserver> observers = new CopyOnWriteArrayList<>();
    private final Map<String, ActiveChain> activeChains = new ConcurrentHashMap<>();

    public ChainExecutor(OperationRegistry registry) {
        this(registry, new StepInputResolver(), new ChainConfig());
    }

    public ChainExecutor(OperationRegistry registry, ChainConfig config) {
        this(registry, new StepInputResolver(), config);
    }

    /// Creates an executor.
    ///
    /// @param registry operations available to chains, not null
    /// @param resolver input resolver, not null
    /// @param config   execution options, not null
    public ChainExecutor(OperationRegistry registry, StepInputResolver resolver, ChainConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.invoker = new OperationInvoker(registry);
    }

    public void addObserver(ChainObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        observers.add(observer);
    }

    public boolean removeObserver(ChainObserver observer) {
        return observers.remove(observer);
    }

    /// Returns the runs currently in progress on this executor.
    ///
    /// @return snapshot of active runs, never null
    public List<ActiveChain> activeChains() {
        return List.copyOf(activeChains.values());
    }

    /// Executes the chain in its preferred mode, or the configured default, with an
    /// anonymous context.
    public ChainResult execute(ChainDefinition chain, Map<String, Object> initialState) {
        Objects.requireNonNull(chain, "chain must not be null");
        return execute(
                chain,
                initialState,
                chain.modeOr(config.getDefaultMode()),
                chain.name(),
                ExecutionContext.anonymous());
    }

    /// Executes a chain.
    ///
    /// @param chain        chain to run, not null
    /// @param initialState parameters seeding chain state, not null
    /// @param mode         execution mode, not null
    /// @param chainName    name for correlation, may be null
    /// @param context      caller context passed to every operation, not null
    /// @return the result, never null, also when steps fail
    /// @throws io.chainrun.core.chain.ChainConfigurationException if the chain is invalid;
    ///         no step has run in that case
    public ChainResult execute(
            ChainDefinition chain,
            Map<String, Object> initialState,
            ExecutionMode mode,
            String chainName,
            ExecutionContext context) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(initialState, "initialState must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(context, "context must not be null");

        ChainValidator.requireValid(chain, mode, registry, config.isRejectBranchingInParallel());

        Run run = new Run(UUID.randomUUID().toString(), chain, context);
        ChainState state = new ChainState(initialState);
        Instant startedAt = Instant.now();

        logger.info(
                "Starting chain "
                        + label(chainName)
                        + " ["
                        + run.chainId
                        + "] in "
                        + mode
                        + " mode with "
                        + chain.size()
                        + " steps");
        notifyObservers(ChainStarted.now(run.chainId, chainName, mode, chain.size()));

        Ledger ledger = new Ledger();
        activeChains.put(
                run.chainId, new ActiveChain(run.chainId, chainName, mode, chain.size(), startedAt));
        try {
            if (mode == ExecutionMode.PARALLEL) {
                executeParallel(run, state, ledger);
            } else {
                executeSequential(run, state, ledger);
            }
        } finally {
            run.finished = true;
            activeChains.remove(run.chainId);
        }

        ChainResult result =
                new ChainResult(
                        run.chainId,
                        chainName,
                        mode,
                        ledger.status(),
                        ledger.executed,
                        ledger.succeeded,
                        ledger.failed,
                        ledger.history,
                        state.snapshot(),
                        state.metadataSnapshot(),
                        state.writes(),
                        ledger.error,
                        ledger.cancelled,
                        startedAt,
                        Instant.now());

        logger.info(
                "Chain "
                        + label(chainName)
                        + " ["
                        + run.chainId
                        + "] finished "
                        + result.status()
                        + ": "
                        + result.stepsSucceeded()
                        + " succeeded, "
                        + result.stepsFailed()
                        + " failed");
        if (ledger.cancelled) {
            Thread.currentThread().interrupt();
        }
        notifyObservers(ChainCompleted.now(result));
        return result;
    }

    // -----------------------------------------------------------------------
    // Modes
    // -----------------------------------------------------------------------

    private void executeSequential(Run run, ChainState state, Ledger ledger) {
        Set<Integer> visited = new HashSet<>();
        int revisits = 0;
        Map<String, Object> previousOutput = null;
        int cursor = 0;
        while (cursor != PolicyDecision.END) {
            if (Thread.currentThread().isInterrupted()) {
                ledger.cancelled = true;
                break;
            }
            if (!visited.add(cursor) && ++revisits > config.getMaxStepRevisits()) {
                ledger.stop(
                        "Exceeded maximum of "
                                + config.getMaxStepRevisits()
                                + " step revisits, the chain may loop");
                break;
            }

            String stepId = run.chain.stepId(cursor);
            StepExecution execution = runStep(run, cursor, state.view(), previousOutput);
            ledger.record(execution);
            if (execution.cancelled()) {
                ledger.cancelled = true;
                break;
            }
            previousOutput = config.isPassResults() ? successfulOutput(execution) : null;

            PolicyDecision decision = execution.decision();
            state.apply(stepId, execution.attempts().size(), decision.stateWrites());
            recordRetries(state, stepId, execution);

            if (Thread.currentThread().isInterrupted()) {
                ledger.cancelled = true;
                break;
            }
            if (decision.terminate()) {
                if (config.isStopOnError()) {
                    ledger.stop(decision.reason());
                    break;
                }
                ledger.bypass(stepId, decision.reason());
                cursor = cursor + 1 < run.chain.size() ? cursor + 1 : PolicyDecision.END;
                continue;
            }
            if (decision.failureBypassed()) {
                ledger.bypass(stepId, decision.reason());
            }
            cursor = decision.nextIndex();
        }
    }

    private void executeParallel(Run run, ChainState state, Ledger ledger) {
        Map<String, Object> snapshot = state.snapshot();
        int steps = run.chain.size();
        int poolSize = Math.max(1, Math.min(config.getParallelism(), steps));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerFactory(run.chainId));

        List<Future<StepExecution>> futures = new ArrayList<>(steps);
        StepExecution[] executions = new StepExecution[steps];
        try {
            for (int i = 0; i < steps; i++) {
                int index = i;
                futures.add(pool.submit(() -> runStep(run, index, snapshot, null)));
            }
            for (int i = 0; i < steps; i++) {
                try {
                    executions[i] = futures.get(i).get();
                } catch (InterruptedException e) {
                    ledger.cancelled = true;
                    futures.forEach(f -> f.cancel(true));
                    break;
                } catch (ExecutionException e) {
                    executions[i] = crashed(run, i, e.getCause());
                }
            }
            if (ledger.cancelled) {
                collectFinished(futures, executions);
            }
        } finally {
            pool.shutdownNow();
            awaitWorkers(pool, run.chainId);
        }

        for (int i = 0; i < steps; i++) {
            StepExecution execution = executions[i];
            if (execution == null) {
                continue;
            }
            ledger.record(execution);
            if (execution.cancelled()) {
                ledger.cancelled = true;
                continue;
            }
            String stepId = run.chain.stepId(i);
            PolicyDecision decision = execution.decision();
            state.apply(stepId, execution.attempts().size(), decision.stateWrites());
            recordRetries(state, stepId, execution);
            if (decision.terminate() && config.isStopOnError()) {
                ledger.stop(decision.reason());
            } else if (decision.terminate() || decision.failureBypassed()) {
                ledger.bypass(stepId, decision.reason());
            }
        }
    }

    private static void awaitWorkers(ExecutorService pool, String chainId) {
        try {
            if (!pool.awaitTermination(WORKER_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                logger.warning(
                        "Workers of chain ["
                                + chainId
                                + "] still running after "
                                + WORKER_DRAIN_SECONDS
                                + "s, their events are dropped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.fine("Interrupted while draining workers of chain [" + chainId + "]");
        }
    }

    private static void collectFinished(
            List<Future<StepExecution>> futures, StepExecution[] executions) {
        for (int i = 0; i < futures.size(); i++) {
            Future<StepExecution> future = futures.get(i);
            if (executions[i] != null || !future.isDone() || future.isCancelled()) {
                continue;
            }
            try {
                executions[i] = future.get();
            } catch (InterruptedException | ExecutionException | CancellationException e) {
                logger.log(Level.FINE, "Discarding unfinished parallel step " + i, e);
            }
        }
    }

    // -----------------------------------------------------------------------
    // Step execution
    // -----------------------------------------------------------------------

    /// Runs one execution of a step: attempts until the policy stops retrying.
    ///
    /// @param previousOutput output added under {@value #PREVIOUS_RESULT}, may be null
    private StepExecution runStep(
            Run run, int index, Map<String, Object> visibleState,
            Map<String, Object> previousOutput) {
        StepDefinition step = run.chain.steps().get(index);
        String stepId = step.id(index);
        Map<String, Object> arguments = resolver.resolve(step.inputs(), visibleState);
        if (previousOutput != null) {
            arguments = new LinkedHashMap<>(arguments);
            arguments.put(PREVIOUS_RESULT, previousOutput);
        }

        List<StepResult> attempts = new ArrayList<>();
        int attempt = 1;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return new StepExecution(attempts, null, true);
            }
            notifyStepObservers(
                    run, StepStarted.now(run.chainId, stepId, step.operationName(), attempt));

            Instant startedAt = Instant.now();
            InvocationOutcome outcome =
                    invoker.invoke(step.operationName(), arguments, run.context);
            Duration duration = Duration.between(startedAt, Instant.now());

            StepResult result =
                    StepResult.of(
                            stepId, index, step.operationName(), attempt, outcome, startedAt,
                            duration);
            attempts.add(result);
            notifyStepObservers(run, StepCompleted.now(run.chainId, result));

            PolicyDecision decision = run.evaluator.evaluate(index, outcome, attempt);
            if (result.isFailure()) {
                logger.fine(
                        "Step '" + stepId + "' attempt " + attempt + " failed: " + result.error());
            } else {
                logger.fine("Step '" + stepId + "' attempt " + attempt + " succeeded");
            }
            if (!decision.retry()) {
                return new StepExecution(attempts, decision, false);
            }
            attempt++;
        }
    }

    private StepExecution crashed(Run run, int index, Throwable cause) {
        StepDefinition step = run.chain.steps().get(index);
        logger.log(Level.WARNING, "Parallel step " + step.id(index) + " crashed", cause);
        InvocationOutcome outcome =
                InvocationOutcome.failure(
                        String.valueOf(cause.getMessage()), cause.getClass().getSimpleName());
        StepResult result =
                StepResult.of(
                        step.id(index), index, step.operationName(), 1, outcome, Instant.now(),
                        Duration.ZERO);
        return new StepExecution(
                List.of(result), PolicyDecision.stop(String.valueOf(cause.getMessage())), false);
    }

    private static Map<String, Object> successfulOutput(StepExecution execution) {
        StepResult last = execution.attempts().get(execution.attempts().size() - 1);
        return last.isSuccess() ? last.output() : null;
    }

    private static void recordRetries(ChainState state, String stepId, StepExecution execution) {
        int retries = execution.attempts().size() - 1;
        if (retries > 0 || state.retryCount(stepId) > 0) {
            state.recordRetries(stepId, retries);
        }
    }

    private void notifyStepObservers(Run run, ChainEvent event) {
        if (run.finished) {
            logger.fine("Dropping late event of chain [" + run.chainId + "]: " + event);
            return;
        }
        notifyObservers(event);
    }

    private void notifyObservers(ChainEvent event) {
        for (ChainObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Chain observer failed on " + event, e);
            }
        }
    }

    private static ThreadFactory workerFactory(String chainId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "chain-" + chainId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String label(String chainName) {
        return chainName != null ? "'" + chainName + "'" : "<unnamed>";
    }

    // -----------------------------------------------------------------------
    // Per-run bookkeeping
    // -----------------------------------------------------------------------

    /// Attempts of one step execution and the decision taken after the last one.
    /// `decision` is null when the execution was cancelled.
    private record StepExecution(
            List<StepResult> attempts, PolicyDecision decision, boolean cancelled) {}

    private static final class Run {
        final String chainId;
        final ChainDefinition chain;
        final ExecutionContext context;
        final PolicyEvaluator evaluator;
        volatile boolean finished;

        Run(String chainId, ChainDefinition chain, ExecutionContext context) {
            this.chainId = chainId;
            this.chain = chain;
            this.context = context;
            this.evaluator = new PolicyEvaluator(chain);
        }
    }

    private static final class Ledger {
        final List<StepResult> history = new ArrayList<>();
        int executed;
        int succeeded;
        int failed;
        boolean unrecovered;
        boolean cancelled;
        String error;

        void record(StepExecution execution) {
            if (execution.attempts().isEmpty()) {
                return;
            }
            history.addAll(execution.attempts());
            executed++;
            StepResult last = execution.attempts().get(execution.attempts().size() - 1);
            if (last.isSuccess()) {
                succeeded++;
            } else {
                failed++;
            }
        }

        void stop(String reason) {
            if (!unrecovered) {
                error = reason;
            }
            unrecovered = true;
            logger.warning("Chain stopped: " + reason);
        }

        void bypass(String stepId, String reason) {
            if (error == null) {
                error = reason;
            }
            logger.warning("Continuing past failed step '" + stepId + "': " + reason);
        }

        ChainStatus status() {
            if (cancelled) {
                return ChainStatus.PARTIALLY_COMPLETED;
            }
            if (unrecovered) {
                return ChainStatus.FAILED;
            }
            if (failed == 0) {
                return ChainStatus.COMPLETED;
            }
            return succeeded > 0 ? ChainStatus.PARTIALLY_COMPLETED : ChainStatus.FAILED;
        }
    }
}
