package io.chainrun.core.operation;

import io.chainrun.core.execution.ExecutionContext;
import java.util.Map;

/// A named unit of work invoked by a chain step.
///
/// Implementations receive resolved arguments and the caller's execution context and
/// return a result object whose fields output mappings can copy into chain state.
/// Any thrown exception is captured by {@link OperationInvoker} and handled by the
/// step's failure policy; throw {@link OperationException} to attach a structured code.
///
/// ### Thread Safety
/// @implNote Implementations must be thread-safe when registered with an engine that
/// runs chains in parallel mode or on several threads at once.
///
/// @see OperationDefinition for registration metadata
@FunctionalInterface
public interface Operation {

    /// Executes the operation.
    ///
    /// @param arguments resolved step inputs, never null; missing state references carry
    ///                  {@link io.chainrun.core.state.Undefined#VALUE}
    /// @param context   caller context, never null
    /// @return result fields, may be null (treated as empty)
    /// @throws Exception on any failure
    Map<String, Object> invoke(Map<String, Object> arguments, ExecutionContext context)
            throws Exception;
}
