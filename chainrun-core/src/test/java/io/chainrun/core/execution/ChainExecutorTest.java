package io.chainrun.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import io.chainrun.core.ChainConfig;
import io.chainrun.core.chain.ChainConfigurationException;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.chain.FailurePolicy;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.chain.SuccessPolicy;
import io.chainrun.core.execution.ChainEvent.ChainCompleted;
import io.chainrun.core.execution.ChainEvent.ChainStarted;
import io.chainrun.core.execution.ChainEvent.StepCompleted;
import io.chainrun.core.execution.ChainEvent.StepStarted;
import io.chainrun.core.operation.DefaultOperationRegistry;
import io.chainrun.core.operation.Operation;
import io.chainrun.core.operation.OperationDefinition;
import io.chainrun.core.operation.OperationException;
import io.chainrun.core.state.StateWrite;
import io.chainrun.core.state.Undefined;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChainExecutorTest {

    private DefaultOperationRegistry registry;
    private ChainExecutor executor;
    private List<ChainEvent> events;
    private Map<String, AtomicInteger> invocations;

    @BeforeEach
    void setUp() {
        registry = new DefaultOperationRegistry();
        executor = new ChainExecutor(registry);
        events = Collections.synchronizedList(new ArrayList<>());
        executor.addObserver(events::add);
        invocations = new ConcurrentHashMap<>();

        register("fetch", (args, ctx) -> Map.of("value", "fetched:" + args.get("id")));
        register("enrich", (args, ctx) -> Map.of("value", "enriched:" + args.get("input")));
        register("publish", (args, ctx) -> Map.of("value", "published:" + args.get("input")));
        register("recover", (args, ctx) -> Map.of("value", "recovered"));
        register(
                "broken",
                (args, ctx) -> {
                    throw new OperationException("E_BROKEN", "backend unavailable");
                });
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private void register(String name, Operation operation) {
        registry.register(
                OperationDefinition.simple(
                        name,
                        (args, ctx) -> {
                            invocations.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
                            return operation.invoke(args, ctx);
                        }));
    }

    private int invocationsOf(String name) {
        AtomicInteger count = invocations.get(name);
        return count != null ? count.get() : 0;
    }

    /// Registers an operation that fails `failures` times, then succeeds.
    private void registerFlaky(String name, int failures) {
        AtomicInteger calls = new AtomicInteger();
        register(
                name,
                (args, ctx) -> {
                    if (calls.incrementAndGet() <= failures) {
                        throw new IllegalStateException("transient failure " + calls.get());
                    }
                    return Map.of("value", "ok");
                });
    }

    private static StepDefinition step(String operation, String outputKey) {
        return StepDefinition.builder(operation)
                .onSuccess(SuccessPolicy.mapping(Map.of("value", outputKey)))
                .build();
    }

    @Nested
    class Sequential {

        @Test
        void shouldCompleteChainWhenAllStepsSucceed() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .input("id", "{{ state.order_id }}")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "fetched")))
                                    .build(),
                            StepDefinition.builder("enrich")
                                    .input("input", "state.fetched")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "enriched")))
                                    .build(),
                            StepDefinition.builder("publish")
                                    .input("input", "{{ enriched }}")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "published")))
                                    .build());

            ChainResult result = executor.execute(chain, Map.of("order_id", 42));

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.stepsSucceeded()).isEqualTo(3);
            assertThat(result.stepsExecuted()).isEqualTo(3);
            assertThat(result.stepsFailed()).isZero();
            assertThat(result.finalState())
                    .containsEntry("fetched", "fetched:42")
                    .containsEntry("enriched", "enriched:fetched:42")
                    .containsEntry("published", "published:enriched:fetched:42")
                    .containsEntry("order_id", 42);
            assertThat(result.error()).isNull();
        }

        @Test
        void shouldStopOnFailureWithStopPolicy() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            step("fetch", "a"),
                            StepDefinition.builder("broken").onFailure(FailurePolicy.stop()).build(),
                            step("publish", "c"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.history()).hasSize(2);
            assertThat(result.history().get(0).status()).isEqualTo(StepStatus.SUCCESS);
            assertThat(result.history().get(1).status()).isEqualTo(StepStatus.FAILURE);
            assertThat(result.history().get(1).errorCode()).isEqualTo("E_BROKEN");
            assertThat(invocationsOf("publish")).isZero();
            assertThat(result.error()).isEqualTo("backend unavailable");
        }

        @Test
        void shouldRetryUntilSuccess() {
            registerFlaky("flaky", 2);
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("flaky")
                                    .name("unstable")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "flaky_out")))
                                    .onFailure(FailurePolicy.retry(3))
                                    .build(),
                            step("publish", "published"));

            ChainResult result = executor.execute(chain, Map.of());

            List<StepResult> attempts = result.attemptsOf("unstable");
            assertThat(attempts).hasSize(3);
            assertThat(attempts)
                    .extracting(StepResult::status)
                    .containsExactly(StepStatus.FAILURE, StepStatus.FAILURE, StepStatus.SUCCESS);
            assertThat(attempts).extracting(StepResult::attempt).containsExactly(1, 2, 3);
            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.finalState()).containsKeys("flaky_out", "published");
            assertThat(result.stepsExecuted()).isEqualTo(2);
            assertThat(result.history()).hasSize(4);
        }

        @Test
        void shouldInvokeAlwaysFailingStepExactlyMaxRetriesTimes() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken").onFailure(FailurePolicy.retry(4)).build(),
                            step("publish", "published"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(invocationsOf("broken")).isEqualTo(4);
            assertThat(invocationsOf("publish")).isZero();
            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.error()).contains("after 4 attempts");
        }

        @Test
        void shouldContinueAfterExhaustedRetriesWhenConfigured() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.retryThenContinue(2, "recovery"))
                                    .build(),
                            step("publish", "skipped"),
                            StepDefinition.builder("recover")
                                    .name("recovery")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "recovered")))
                                    .build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(invocationsOf("broken")).isEqualTo(2);
            assertThat(invocationsOf("publish")).isZero();
            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.finalState()).containsEntry("recovered", "recovered");
        }

        @Test
        void shouldJumpToRecoveryStepOnContinue() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            step("fetch", "fetched"),
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.continueTo("recovery"))
                                    .build(),
                            step("publish", "skipped"),
                            StepDefinition.builder("recover")
                                    .name("recovery")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "recovered")))
                                    .build(),
                            step("enrich", "after_recovery"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.history())
                    .extracting(StepResult::stepId)
                    .containsExactly("step_0", "step_1", "recovery", "step_4");
            assertThat(invocationsOf("publish")).isZero();
            assertThat(result.stepsFailed()).isEqualTo(1);
            assertThat(result.stepsSucceeded()).isEqualTo(3);
            assertThat(result.finalState()).containsKeys("recovered", "after_recovery");
        }

        @Test
        void shouldNotMapOutputsOfBypassedFailure() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "never")))
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build(),
                            step("fetch", "fetched"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.finalState()).doesNotContainKey("never").containsKey("fetched");
            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
        }

        @Test
        void shouldFailWhenEveryStepFailsAndIsBypassed() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build(),
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.stepsExecuted()).isEqualTo(2);
        }

        @Test
        void shouldJumpForwardOnSuccessNext() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .onSuccess(SuccessPolicy.fallthrough().thenGoTo("last"))
                                    .build(),
                            step("publish", "skipped"),
                            StepDefinition.builder("enrich").name("last").build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.history()).extracting(StepResult::stepId).containsExactly("step_0", "last");
            assertThat(invocationsOf("publish")).isZero();
        }

        @Test
        void shouldPassUndefinedForMissingStateKey() {
            AtomicReference<Object> seen = new AtomicReference<>();
            register(
                    "inspect",
                    (args, ctx) -> {
                        seen.set(args.get("missing"));
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("inspect").input("missing", "state.absent").build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(seen.get()).isSameAs(Undefined.VALUE);
        }

        @Test
        void shouldKeepRetryCountersOutOfFinalStateAndInputs() {
            registerFlaky("flaky", 1);
            AtomicReference<Object> seen = new AtomicReference<>();
            register(
                    "inspect",
                    (args, ctx) -> {
                        seen.set(args.get("counter"));
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("flaky")
                                    .name("unstable")
                                    .onFailure(FailurePolicy.retry(2))
                                    .build(),
                            StepDefinition.builder("inspect")
                                    .input("counter", "state.unstable_retry_count")
                                    .build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.finalState()).doesNotContainKey("unstable_retry_count");
            assertThat(result.engineMetadata()).containsEntry("unstable_retry_count", 1);
            assertThat(seen.get()).isSameAs(Undefined.VALUE);
        }

        @Test
        void shouldLogStateWritesPerStep() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            step("fetch", "shared"),
                            StepDefinition.builder("enrich")
                                    .name("overwriter")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "shared")))
                                    .build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.stateWrites())
                    .extracting(w -> w.stepId() + ":" + w.key())
                    .containsExactly("step_0:shared", "overwriter:shared");
            assertThat(result.finalState()).containsEntry("shared", "enriched:null");
        }

        @Test
        void shouldProduceIdenticalFinalStateOnRerun() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .input("id", "{{ state.order_id }}")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "fetched")))
                                    .build(),
                            step("enrich", "enriched"));

            ChainResult first = executor.execute(chain, Map.of("order_id", 7));
            ChainResult second = executor.execute(chain, Map.of("order_id", 7));

            assertThat(second.finalState()).isEqualTo(first.finalState());
            assertThat(second.chainId()).isNotEqualTo(first.chainId());
        }

        @Test
        void shouldStopCyclicChainWithRevisitGuard() {
            ChainExecutor guarded =
                    new ChainExecutor(registry, ChainConfig.builder().maxStepRevisits(5).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .name("loop")
                                    .onSuccess(SuccessPolicy.fallthrough().thenGoTo("loop"))
                                    .build());

            ChainResult result = guarded.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.stepsExecuted()).isEqualTo(6);
            assertThat(result.error()).contains("maximum of 5 step revisits");
        }

        @Test
        void shouldCompleteLinearChainLongerThanRevisitLimit() {
            List<StepDefinition> steps = new ArrayList<>();
            for (int i = 0; i < 150; i++) {
                steps.add(step("fetch", "fetched_" + i));
            }

            ChainResult result = executor.execute(ChainDefinition.of("long_chain", steps), Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.stepsExecuted()).isEqualTo(150);
            assertThat(result.finalState()).containsKeys("fetched_0", "fetched_149");
        }

        @Test
        void shouldNotCountRetriesAsRevisits() {
            registerFlaky("flaky", 3);
            ChainExecutor guarded =
                    new ChainExecutor(registry, ChainConfig.builder().maxStepRevisits(1).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("flaky").onFailure(FailurePolicy.retry(3)).build());

            ChainResult result = guarded.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.history()).hasSize(4);
        }

        @Test
        void shouldRecordThrownErrorAndContinue() {
            register(
                    "asserting",
                    (args, ctx) -> {
                        throw new AssertionError("boom");
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("asserting")
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build(),
                            step("fetch", "fetched"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.history().get(0).errorType()).isEqualTo("AssertionError");
            assertThat(result.history().get(0).error()).isEqualTo("boom");
            assertThat(result.finalState()).containsKey("fetched");
        }

        @Test
        void shouldCountRevisitedStepAsNewExecution() {
            AtomicInteger calls = new AtomicInteger();
            register(
                    "counter",
                    (args, ctx) -> {
                        if (calls.incrementAndGet() < 3) {
                            throw new IllegalStateException("not yet");
                        }
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch").name("start").build(),
                            StepDefinition.builder("counter")
                                    .onFailure(FailurePolicy.continueTo("start"))
                                    .build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.stepsExecuted()).isEqualTo(6);
            assertThat(result.stepsFailed()).isEqualTo(2);
            assertThat(result.stepsSucceeded()).isEqualTo(4);
            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
        }
    }

    @Nested
    class Parallel {

        @Test
        void shouldPreserveStepOrderWhenOneStepContinuesOnFailure() {
            register(
                    "slow",
                    (args, ctx) -> {
                        Thread.sleep(100);
                        return Map.of("value", "slow");
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            step("slow", "first"),
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build(),
                            step("fetch", "third"));

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, "fanout",
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.history())
                    .extracting(StepResult::stepId)
                    .containsExactly("step_0", "step_1", "step_2");
            assertThat(result.finalState()).containsKeys("first", "third");
            assertThat(result.mode()).isEqualTo(ExecutionMode.PARALLEL);
        }

        @Test
        void shouldResolveAllStepsAgainstInitialSnapshot() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            step("fetch", "fetched"),
                            StepDefinition.builder("enrich")
                                    .input("input", "state.fetched")
                                    .onSuccess(SuccessPolicy.mapping(Map.of("value", "enriched")))
                                    .build());

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.finalState()).containsEntry("enriched", "enriched:undefined");
        }

        @Test
        void shouldApplyMappingsInStepOrderAfterJoin() {
            CountDownLatch release = new CountDownLatch(1);
            register(
                    "late",
                    (args, ctx) -> {
                        release.await(5, TimeUnit.SECONDS);
                        return Map.of("value", "late");
                    });
            register(
                    "early",
                    (args, ctx) -> {
                        release.countDown();
                        return Map.of("value", "early");
                    });
            ChainDefinition chain =
                    ChainDefinition.of(step("late", "shared"), step("early", "shared"));

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.finalState()).containsEntry("shared", "early");
            assertThat(result.stateWrites())
                    .extracting(StateWrite::stepId)
                    .containsExactly("step_0", "step_1");
        }

        @Test
        void shouldRunStepsConcurrently() {
            CountDownLatch bothRunning = new CountDownLatch(2);
            Set<String> threads = ConcurrentHashMap.newKeySet();
            register(
                    "meet",
                    (args, ctx) -> {
                        threads.add(Thread.currentThread().getName());
                        bothRunning.countDown();
                        if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                            throw new IllegalStateException("steps did not overlap");
                        }
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("meet").build(),
                            StepDefinition.builder("meet").build());

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(threads).hasSize(2);
        }

        @Test
        void shouldRetryEachStepIndependently() {
            registerFlaky("flaky", 1);
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("flaky").onFailure(FailurePolicy.retry(2)).build(),
                            step("fetch", "fetched"));

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.history())
                    .extracting(StepResult::stepId)
                    .containsExactly("step_0", "step_0", "step_1");
            assertThat(result.stepsExecuted()).isEqualTo(2);
        }

        @Test
        void shouldFailWhenAStepStopsButKeepOtherOutputs() {
            ChainDefinition chain =
                    ChainDefinition.of(StepDefinition.builder("broken").build(), step("fetch", "fetched"));

            ChainResult result =
                    executor.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.finalState()).containsKey("fetched");
        }

        @Test
        void shouldRejectBranchingInParallelMode() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .onSuccess(SuccessPolicy.fallthrough().thenGoTo("other"))
                                    .build(),
                            StepDefinition.builder("enrich").name("other").build());

            assertThatThrownBy(
                            () ->
                                    executor.execute(
                                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                                            ExecutionContext.anonymous()))
                    .isInstanceOf(ChainConfigurationException.class)
                    .hasMessageContaining("parallel");
            assertThat(invocations).isEmpty();
        }

        @Test
        void shouldIgnoreBranchingWhenToleranceConfigured() {
            ChainExecutor tolerant =
                    new ChainExecutor(
                            registry, ChainConfig.builder().rejectBranchingInParallel(false).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("fetch")
                                    .onSuccess(SuccessPolicy.fallthrough().thenGoTo("other"))
                                    .build(),
                            StepDefinition.builder("enrich").name("other").build());

            ChainResult result =
                    tolerant.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
            assertThat(result.stepsExecuted()).isEqualTo(2);
        }
    }

    @Nested
    class CallerOptions {

        private final List<Map<String, Object>> captured = new ArrayList<>();

        @BeforeEach
        void registerCapture() {
            register(
                    "capture",
                    (args, ctx) -> {
                        captured.add(args);
                        return Map.of();
                    });
        }

        @Test
        void shouldPassPreviousOutputWhenEnabled() {
            ChainExecutor passing =
                    new ChainExecutor(registry, ChainConfig.builder().passResults(true).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("recover").build(),
                            StepDefinition.builder("capture").input("q", "invoices").build());

            passing.execute(chain, Map.of());

            assertThat(captured).hasSize(1);
            assertThat(captured.get(0))
                    .containsEntry("q", "invoices")
                    .containsEntry(ChainExecutor.PREVIOUS_RESULT, Map.of("value", "recovered"));
        }

        @Test
        void shouldNotPassOutputOfFailedStep() {
            ChainExecutor passing =
                    new ChainExecutor(registry, ChainConfig.builder().passResults(true).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken")
                                    .onFailure(FailurePolicy.continueOnFailure())
                                    .build(),
                            StepDefinition.builder("capture").build());

            passing.execute(chain, Map.of());

            assertThat(captured.get(0)).doesNotContainKey(ChainExecutor.PREVIOUS_RESULT);
        }

        @Test
        void shouldNotPassPreviousOutputByDefault() {
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("recover").build(),
                            StepDefinition.builder("capture").build());

            executor.execute(chain, Map.of());

            assertThat(captured.get(0)).doesNotContainKey(ChainExecutor.PREVIOUS_RESULT);
        }

        @Test
        void shouldFallThroughStoppingFailureWhenStopOnErrorDisabled() {
            ChainExecutor lenient =
                    new ChainExecutor(registry, ChainConfig.builder().stopOnError(false).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken").onFailure(FailurePolicy.stop()).build(),
                            step("fetch", "fetched"));

            ChainResult result = lenient.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.stepsExecuted()).isEqualTo(2);
            assertThat(result.finalState()).containsKey("fetched");
            assertThat(result.error()).isNotNull();
        }

        @Test
        void shouldReportFailedWhenEveryStepFailsWithStopOnErrorDisabled() {
            ChainExecutor lenient =
                    new ChainExecutor(registry, ChainConfig.builder().stopOnError(false).build());
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("broken").build(),
                            StepDefinition.builder("broken").build());

            ChainResult result = lenient.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.stepsExecuted()).isEqualTo(2);
        }

        @Test
        void shouldBypassStoppingFailureInParallelWhenStopOnErrorDisabled() {
            ChainExecutor lenient =
                    new ChainExecutor(registry, ChainConfig.builder().stopOnError(false).build());
            ChainDefinition chain =
                    ChainDefinition.of(StepDefinition.builder("broken").build(), step("fetch", "f"));

            ChainResult result =
                    lenient.execute(
                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                            ExecutionContext.anonymous());

            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.finalState()).containsKey("f");
        }

        @Test
        void shouldTrackActiveChainOnlyWhileRunning() {
            List<ActiveChain> seen = new ArrayList<>();
            register(
                    "inspect",
                    (args, ctx) -> {
                        seen.addAll(executor.activeChains());
                        return Map.of();
                    });

            ChainResult result =
                    executor.execute(
                            ChainDefinition.of(StepDefinition.builder("inspect").build()),
                            Map.of(),
                            ExecutionMode.SEQUENTIAL,
                            "tracked",
                            ExecutionContext.anonymous());

            assertThat(seen)
                    .singleElement()
                    .satisfies(
                            active -> {
                                assertThat(active.chainId()).isEqualTo(result.chainId());
                                assertThat(active.chainName()).isEqualTo("tracked");
                                assertThat(active.stepCount()).isEqualTo(1);
                            });
            assertThat(executor.activeChains()).isEmpty();
        }
    }

    @Nested
    class ConfigurationErrors {

        @Test
        void shouldRejectUnknownOperationBeforeAnyInvocation() {
            ChainDefinition chain =
                    ChainDefinition.of(step("fetch", "a"), StepDefinition.builder("missing").build());

            assertThatThrownBy(() -> executor.execute(chain, Map.of()))
                    .isInstanceOf(ChainConfigurationException.class)
                    .hasMessageContaining("unknown operation: missing");
            assertThat(invocations).isEmpty();
            assertThat(events).isEmpty();
        }

        @Test
        void shouldRejectEmptyChain() {
            assertThatThrownBy(() -> executor.execute(ChainDefinition.of(), Map.of()))
                    .isInstanceOf(ChainConfigurationException.class)
                    .hasMessageContaining("no steps");
        }

        @Test
        void shouldFailWithoutRetryWhenOperationRemovedAfterValidation() {
            register(
                    "self_destruct",
                    (args, ctx) -> {
                        registry.remove("publish");
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("self_destruct").build(),
                            StepDefinition.builder("publish")
                                    .name("gone")
                                    .onFailure(FailurePolicy.retryThenContinue(3, null))
                                    .build(),
                            step("fetch", "fetched"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.FAILED);
            assertThat(result.attemptsOf("gone")).hasSize(1);
            assertThat(result.attemptsOf("gone").get(0).errorType()).isEqualTo("UnknownOperation");
            assertThat(invocationsOf("fetch")).isZero();
        }
    }

    @Nested
    class Events {

        @Test
        void shouldEmitEventsPerAttempt() {
            registerFlaky("flaky", 1);
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("flaky").onFailure(FailurePolicy.retry(2)).build());

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(events.get(0)).isInstanceOf(ChainStarted.class);
            assertThat(events.stream().filter(e -> e instanceof StepStarted).count()).isEqualTo(2);
            List<StepCompleted> completed =
                    events.stream()
                            .filter(StepCompleted.class::isInstance)
                            .map(StepCompleted.class::cast)
                            .toList();
            assertThat(completed)
                    .extracting(StepCompleted::attempt, StepCompleted::status)
                    .containsExactly(
                            tuple(1, StepStatus.FAILURE),
                            tuple(2, StepStatus.SUCCESS));
            assertThat(completed).allMatch(e -> e.chainId().equals(result.chainId()));
            assertThat(events.get(events.size() - 1)).isInstanceOf(ChainCompleted.class);
        }

        @Test
        void shouldIgnoreObserverFailures() {
            executor.addObserver(
                    event -> {
                        throw new IllegalStateException("observer down");
                    });

            ChainResult result = executor.execute(ChainDefinition.of(step("fetch", "f")), Map.of());

            assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
        }

        @Test
        void shouldPassContextUnchanged() {
            AtomicReference<ExecutionContext> seen = new AtomicReference<>();
            register(
                    "capture",
                    (args, ctx) -> {
                        seen.set(ctx);
                        return Map.of();
                    });
            ExecutionContext context = new ExecutionContext("corr-1", "alice", Map.of("tenant", "t1"));

            executor.execute(
                    ChainDefinition.of(StepDefinition.builder("capture").build()),
                    Map.of(),
                    ExecutionMode.SEQUENTIAL,
                    "ctx",
                    context);

            assertThat(seen.get()).isSameAs(context);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldStopBeforeNextStepWhenInterrupted() {
            register(
                    "interrupting",
                    (args, ctx) -> {
                        Thread.currentThread().interrupt();
                        return Map.of("value", "done");
                    });
            ChainDefinition chain =
                    ChainDefinition.of(step("interrupting", "first"), step("fetch", "second"));

            ChainResult result = executor.execute(chain, Map.of());

            assertThat(result.cancelled()).isTrue();
            assertThat(result.status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(result.finalState()).containsKey("first").doesNotContainKey("second");
            assertThat(invocationsOf("fetch")).isZero();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        }

        @Test
        void shouldCancelInFlightParallelSteps() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            register(
                    "blocking",
                    (args, ctx) -> {
                        started.countDown();
                        try {
                            Thread.sleep(10_000);
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            throw e;
                        }
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("blocking").build(),
                            StepDefinition.builder("blocking").build());
            AtomicReference<ChainResult> result = new AtomicReference<>();

            Thread caller =
                    new Thread(
                            () ->
                                    result.set(
                                            executor.execute(
                                                    chain, Map.of(), ExecutionMode.PARALLEL,
                                                    null, ExecutionContext.anonymous())));
            caller.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            caller.interrupt();
            caller.join(5_000);

            assertThat(result.get()).isNotNull();
            assertThat(result.get().cancelled()).isTrue();
            assertThat(result.get().status()).isEqualTo(ChainStatus.PARTIALLY_COMPLETED);
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void shouldDeliverNoStepEventAfterCompletionWhenWorkerIgnoresInterrupt() throws Exception {
            CountDownLatch started = new CountDownLatch(2);
            register(
                    "stubborn",
                    (args, ctx) -> {
                        started.countDown();
                        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
                        while (System.nanoTime() < deadline) {
                            Thread.onSpinWait();
                        }
                        return Map.of();
                    });
            ChainDefinition chain =
                    ChainDefinition.of(
                            StepDefinition.builder("stubborn").build(),
                            StepDefinition.builder("stubborn").build());

            Thread caller =
                    new Thread(
                            () ->
                                    executor.execute(
                                            chain, Map.of(), ExecutionMode.PARALLEL, null,
                                            ExecutionContext.anonymous()));
            caller.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            caller.interrupt();
            caller.join(5_000);
            Thread.sleep(500);

            synchronized (events) {
                assertThat(events.get(events.size() - 1)).isInstanceOf(ChainCompleted.class);
                assertThat(events.stream().filter(ChainCompleted.class::isInstance).count())
                        .isEqualTo(1);
            }
        }
    }
}
