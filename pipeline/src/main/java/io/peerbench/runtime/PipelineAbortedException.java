package io.peerbench.runtime;

/**
 * Raised from {@link Pipeline#awaitCompletion} when a record failed with a run-fatal error.
 */
public class PipelineAbortedException extends RuntimeException {
    public PipelineAbortedException(Exception cause) {
        super("pipeline aborted: " + cause.getMessage(), cause);
    }
}
