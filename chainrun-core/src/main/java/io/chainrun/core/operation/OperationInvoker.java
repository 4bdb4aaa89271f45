package io.chainrun.core.operation;

import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.core.operation.InvocationOutcome.Failure;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Looks operations up in the registry and calls them, never letting an operation failure
/// escape.
///
/// ### Contracts
/// - **Postcondition**: every call returns an outcome, never throws for operation errors
/// - Any {@link Throwable} thrown by the operation, {@link Error}s included, becomes a
///   {@link Failure}; only a {@link VirtualMachineError} propagates
/// - Unknown or disabled operations produce a {@link Failure} flagged as configuration error
/// - A null result is a success with an empty output
/// - An {@link InterruptedException} is recorded as failure and the interrupt flag restored
///
/// ### Thread Safety
/// @implNote Stateless apart from the registry reference; safe for concurrent use.
public class OperationInvoker {

    private static final Logger logger = Logger.getLogger(OperationInvoker.class.getName());

    /// Error type of failures caused by a missing operation.
    public static final String UNKNOWN_OPERATION = "UnknownOperation";

    /// Error type of failures caused by a disabled operation.
    public static final String DISABLED_OPERATION = "DisabledOperation";

    private final OperationRegistry registry;

    public OperationInvoker(OperationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Invokes the named operation once.
    ///
    /// @param name      operation name, not null
    /// @param arguments resolved arguments, not null
    /// @param context   caller context, not null
    /// @return the outcome, never null
    public InvocationOutcome invoke(
            String name, Map<String, Object> arguments, ExecutionContext context) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Optional<OperationDefinition> definition = registry.get(name);
        if (definition.isEmpty()) {
            return new Failure("Operation not found: " + name, UNKNOWN_OPERATION, null, true);
        }
        if (!definition.get().enabled()) {
            return new Failure("Operation is disabled: " + name, DISABLED_OPERATION, null, true);
        }

        try {
            Map<String, Object> output = definition.get().operation().invoke(arguments, context);
            return InvocationOutcome.success(output);
        } catch (OperationException e) {
            logger.fine("Operation '" + name + "' failed [" + e.code() + "]: " + e.getMessage());
            return new Failure(messageOf(e), e.getClass().getSimpleName(), e.code(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Failure("Interrupted", e.getClass().getSimpleName(), null, false);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            logger.log(Level.FINE, "Operation '" + name + "' threw", e);
            return new Failure(messageOf(e), e.getClass().getSimpleName(), null, false);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
