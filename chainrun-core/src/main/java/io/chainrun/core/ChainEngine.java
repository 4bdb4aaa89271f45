package io.chainrun.core;

import io.chainrun.core.chain.ChainConfigurationException;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.ChainNotFoundException;
import io.chainrun.core.chain.ChainRepository;
import io.chainrun.core.chain.ChainValidator;
import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.chain.InMemoryChainRepository;
import io.chainrun.core.chain.InputOverrides;
import io.chainrun.core.execution.ChainExecutor;
import io.chainrun.core.execution.ChainObserver;
import io.chainrun.core.execution.ChainResult;
import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.core.operation.DefaultOperationRegistry;
import io.chainrun.core.operation.OperationDefinition;
import io.chainrun.core.operation.OperationRegistry;
import io.chainrun.core.template.StepInputResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for running chains: wires the operation registry, the chain repository,
/// configuration and observers around one {@link ChainExecutor}.
///
/// ### Mode Selection
/// An explicit mode passed by the caller wins, then the chain's own mode, then
/// {@link ChainConfig#getDefaultMode()}.
///
/// ### Usage
/// {@snippet :
/// ChainEngine engine = ChainEngine.builder()
///         .operation(OperationDefinition.simple("echo", (args, ctx) -> args))
///         .build();
/// engine.registerChain(chain);
/// ChainResult result = engine.execute("triage", Map.of("search_query", "invoices"));
/// }
///
/// @implNote Thread-safe as long as the supplied registry and repository are.
/// @see ChainExecutor for execution semantics
public final class ChainEngine {

    private static final Logger logger = Logger.getLogger(ChainEngine.class.getName());

    private final OperationRegistry operationRegistry;
    private final ChainRepository chainRepository;
    private final ChainConfig config;
    private final ChainExecutor executor;

    private ChainEngine(Builder builder) {
        this.operationRegistry = builder.operationRegistry;
        this.chainRepository = builder.chainRepository;
        this.config = builder.config;
        this.executor = new ChainExecutor(operationRegistry, builder.resolver, config);
        builder.observers.forEach(executor::addObserver);
    }

    /// Runs a stored chain by name.
    ///
    /// @param chainName  name of a chain in the repository, not null
    /// @param parameters initial state, not null
    /// @return the result, never null
    /// @throws ChainNotFoundException if no chain has that name
    /// @throws ChainConfigurationException if the chain is disabled or invalid
    public ChainResult execute(String chainName, Map<String, Object> parameters)
            throws ChainNotFoundException {
        return execute(chainName, parameters, Map.of(), null, ExecutionContext.anonymous());
    }

    public ChainResult execute(
            String chainName, Map<String, Object> parameters, ExecutionContext context)
            throws ChainNotFoundException {
        return execute(chainName, parameters, Map.of(), null, context);
    }

    /// Runs a stored chain by name with input overrides and an optional mode.
    ///
    /// @param chainName  name of a chain in the repository, not null
    /// @param parameters initial state, not null
    /// @param overrides  `<step-or-operation>.<input>` to literal value, not null
    /// @param mode       mode to run in, may be null to use the chain's or the default
    /// @param context    caller context, not null
    /// @return the result, never null
    /// @throws ChainNotFoundException if no chain has that name
    /// @throws ChainConfigurationException if the chain is disabled or invalid
    public ChainResult execute(
            String chainName,
            Map<String, Object> parameters,
            Map<String, Object> overrides,
            ExecutionMode mode,
            ExecutionContext context)
            throws ChainNotFoundException {
        Objects.requireNonNull(chainName, "chainName must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");

        ChainDefinition chain =
                chainRepository
                        .findByName(chainName)
                        .orElseThrow(
                                () -> new ChainNotFoundException("Chain not found: " + chainName));
        if (!chain.enabled()) {
            throw new ChainConfigurationException("Chain is disabled: " + chainName);
        }
        if (!overrides.isEmpty()) {
            logger.fine("Applying " + overrides.size() + " overrides to chain '" + chainName + "'");
        }
        return execute(InputOverrides.apply(chain, overrides), parameters, mode, context);
    }

    /// Runs an ad hoc chain definition.
    ///
    /// @throws ChainConfigurationException if the chain is invalid
    public ChainResult execute(ChainDefinition chain, Map<String, Object> parameters) {
        return execute(chain, parameters, null, ExecutionContext.anonymous());
    }

    /// Runs an ad hoc chain definition.
    ///
    /// @param chain      chain to run, not null
    /// @param parameters initial state, not null
    /// @param mode       mode to run in, may be null to use the chain's or the default
    /// @param context    caller context, not null
    /// @return the result, never null
    /// @throws ChainConfigurationException if the chain is invalid
    public ChainResult execute(
            ChainDefinition chain,
            Map<String, Object> parameters,
            ExecutionMode mode,
            ExecutionContext context) {
        Objects.requireNonNull(chain, "chain must not be null");
        ExecutionMode effective = mode != null ? mode : chain.modeOr(config.getDefaultMode());
        return executor.execute(chain, parameters, effective, chain.name(), context);
    }

    /// Returns the configuration problems of a chain against the registered operations.
    ///
    /// @param chain chain to check, not null
    /// @param mode  mode to check for, may be null to use the chain's or the default
    /// @return problems, empty when the chain is runnable
    public List<String> validate(ChainDefinition chain, ExecutionMode mode) {
        Objects.requireNonNull(chain, "chain must not be null");
        ExecutionMode effective = mode != null ? mode : chain.modeOr(config.getDefaultMode());
        return ChainValidator.validate(
                chain, effective, operationRegistry, config.isRejectBranchingInParallel());
    }

    public void registerOperation(OperationDefinition operation) {
        operationRegistry.register(operation);
    }

    /// Stores a named chain after validating it.
    ///
    /// @param chain named chain, not null
    /// @throws ChainConfigurationException if the chain is invalid
    public void registerChain(ChainDefinition chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        ChainValidator.requireValid(
                chain,
                chain.modeOr(config.getDefaultMode()),
                operationRegistry,
                config.isRejectBranchingInParallel());
        chainRepository.save(chain);
    }

    public void addObserver(ChainObserver observer) {
        executor.addObserver(observer);
    }

    public OperationRegistry getOperationRegistry() {
        return operationRegistry;
    }

    public ChainRepository getChainRepository() {
        return chainRepository;
    }

    public ChainConfig getConfig() {
        return config;
    }

    public ChainExecutor getExecutor() {
        return executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ChainEngine}. Unset collaborators get in-memory defaults.
    public static final class Builder {
        private OperationRegistry operationRegistry = new DefaultOperationRegistry();
        private ChainRepository chainRepository = new InMemoryChainRepository();
        private ChainConfig config = new ChainConfig();
        private StepInputResolver resolver = new StepInputResolver();
        private final List<OperationDefinition> operations = new ArrayList<>();
        private final List<ChainObserver> observers = new ArrayList<>();

        private Builder() {}

        public Builder operationRegistry(OperationRegistry operationRegistry) {
            this.operationRegistry =
                    Objects.requireNonNull(operationRegistry, "operationRegistry must not be null");
            return this;
        }

        public Builder chainRepository(ChainRepository chainRepository) {
            this.chainRepository =
                    Objects.requireNonNull(chainRepository, "chainRepository must not be null");
            return this;
        }

        public Builder config(ChainConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder resolver(StepInputResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
            return this;
        }

        /// Registers an operation once the engine is built.
        public Builder operation(OperationDefinition operation) {
            operations.add(Objects.requireNonNull(operation, "operation must not be null"));
            return this;
        }

        public Builder observer(ChainObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer must not be null"));
            return this;
        }

        public ChainEngine build() {
            operations.forEach(operationRegistry::register);
            return new ChainEngine(this);
        }
    }
}
