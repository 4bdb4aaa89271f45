package io.chainrun.core;

import io.chainrun.core.chain.ExecutionMode;

/// Configuration options for chain execution.
///
/// ### Default Values
/// - `parallelism`: `8` (upper bound on worker threads of one parallel run)
/// - `maxStepRevisits`: `100` (guard against jump loops; first visits are not counted)
/// - `passResults`: `false` (sequential steps receive the previous output as `_previous_result`)
/// - `stopOnError`: `true` (`false` turns every stopping failure into a bypass)
/// - `rejectBranchingInParallel`: `true` (`next` in a parallel chain is a configuration error)
/// - `defaultMode`: `SEQUENTIAL` (used when neither caller nor chain chooses a mode)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ChainEngine} and do not
/// modify afterwards.
///
/// @see Builder
public class ChainConfig {
    private int parallelism = 8;
    private int maxStepRevisits = 100;
    private boolean passResults = false;
    private boolean stopOnError = true;
    private boolean rejectBranchingInParallel = true;
    private ExecutionMode defaultMode = ExecutionMode.SEQUENTIAL;

    public ChainConfig() {}

    /// Returns the maximum number of threads a parallel run uses.
    public int getParallelism() {
        return parallelism;
    }

    /// Sets the maximum number of threads a parallel run uses.
    ///
    /// @param parallelism thread count, must be positive
    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /// Returns how many times one sequential run may re-enter steps it already executed
    /// before it fails. Retries of a step do not count.
    public int getMaxStepRevisits() {
        return maxStepRevisits;
    }

    public void setMaxStepRevisits(int maxStepRevisits) {
        if (maxStepRevisits < 1) {
            throw new IllegalArgumentException(
                    "maxStepRevisits must be positive: " + maxStepRevisits);
        }
        this.maxStepRevisits = maxStepRevisits;
    }

    public boolean isPassResults() {
        return passResults;
    }

    /// Makes each sequential step see the output of the step executed before it.
    ///
    /// @param passResults `true` to add the previous successful output to the arguments
    ///        under `_previous_result`; ignored in parallel mode
    public void setPassResults(boolean passResults) {
        this.passResults = passResults;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }

    /// Chooses whether a failure that would stop the chain actually stops it.
    ///
    /// @param stopOnError `false` to record such failures as bypassed and fall through
    ///        to the next step
    public void setStopOnError(boolean stopOnError) {
        this.stopOnError = stopOnError;
    }

    public boolean isRejectBranchingInParallel() {
        return rejectBranchingInParallel;
    }

    /// Chooses between failing and warning when a parallel chain declares `next`.
    ///
    /// @param rejectBranchingInParallel `true` to reject such chains at load time,
    ///        `false` to ignore the fields with a warning
    public void setRejectBranchingInParallel(boolean rejectBranchingInParallel) {
        this.rejectBranchingInParallel = rejectBranchingInParallel;
    }

    public ExecutionMode getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(ExecutionMode defaultMode) {
        this.defaultMode = defaultMode != null ? defaultMode : ExecutionMode.SEQUENTIAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ChainConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ChainConfig config = new ChainConfig();

        public Builder parallelism(int parallelism) {
            config.setParallelism(parallelism);
            return this;
        }

        public Builder maxStepRevisits(int maxStepRevisits) {
            config.setMaxStepRevisits(maxStepRevisits);
            return this;
        }

        public Builder passResults(boolean passResults) {
            config.setPassResults(passResults);
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            config.setStopOnError(stopOnError);
            return this;
        }

        public Builder rejectBranchingInParallel(boolean reject) {
            config.setRejectBranchingInParallel(reject);
            return this;
        }

        public Builder defaultMode(ExecutionMode defaultMode) {
            config.setDefaultMode(defaultMode);
            return this;
        }

        public ChainConfig build() {
            return config;
        }
    }
}
