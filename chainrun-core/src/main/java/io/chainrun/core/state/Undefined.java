package io.chainrun.core.state;

/// Marker passed to operations for inputs that reference a key absent from chain state.
///
/// Distinct from `null`, which is a value a step may legitimately have written.
public enum Undefined {
    VALUE;

    @Override
    public String toString() {
        return "undefined";
    }
}
