package io.chainrun.core.execution;

/// Outcome of one attempt of a step.
public enum StepStatus {
    SUCCESS,
    FAILURE
}
