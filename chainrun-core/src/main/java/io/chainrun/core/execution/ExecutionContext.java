package io.chainrun.core.execution;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/// Caller-supplied context passed unchanged into every operation invocation.
///
/// The engine does not interpret any field; authentication and tenancy are the caller's
/// concern.
///
/// @param correlationId identifier for tracing the caller's request, not null
/// @param principal     identity of the caller, may be null
/// @param attributes    arbitrary caller data, not null (may be empty)
public record ExecutionContext(
        String correlationId, String principal, Map<String, Object> attributes) {

    public ExecutionContext {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /// Creates a context with a random correlation id and no principal.
    public static ExecutionContext anonymous() {
        return new ExecutionContext(UUID.randomUUID().toString(), null, Map.of());
    }

    public static ExecutionContext of(String principal, Map<String, Object> attributes) {
        return new ExecutionContext(UUID.randomUUID().toString(), principal, attributes);
    }

    public Optional<String> principalName() {
        return Optional.ofNullable(principal);
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
