package io.chainrun.cli.operations;

import static org.assertj.core.api.Assertions.assertThat;

import io.chainrun.core.ChainEngine;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.chain.SuccessPolicy;
import io.chainrun.core.execution.ChainResult;
import io.chainrun.core.execution.ChainStatus;
import io.chainrun.core.operation.DefaultOperationRegistry;
import io.chainrun.core.operation.OperationDefinition;
import io.chainrun.core.operation.OperationRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuiltinOperationsTest {

    @Test
    void shouldRegisterAllBuiltins() {
        OperationRegistry registry = new DefaultOperationRegistry();

        BuiltinOperations.registerAll(registry);

        assertThat(registry.all())
                .extracting(OperationDefinition::name)
                .containsExactlyInAnyOrder("echo", "transform", "validate");
        assertThat(registry.all()).allMatch(OperationDefinition::enabled);
    }

    @Test
    void shouldEchoInputsThroughChain() {
        ChainEngine.Builder builder = ChainEngine.builder();
        BuiltinOperations.definitions().forEach(builder::operation);
        ChainEngine engine = builder.build();
        ChainDefinition chain =
                ChainDefinition.of(
                        StepDefinition.builder("echo")
                                .input("copy", "{{ state.source }}")
                                .onSuccess(SuccessPolicy.mapping(Map.of("copy", "target")))
                                .build());

        ChainResult result = engine.execute(chain, Map.of("source", "payload"));

        assertThat(result.status()).isEqualTo(ChainStatus.COMPLETED);
        assertThat(result.finalState()).containsEntry("target", "payload");
    }
}
