package ai.pulse.model.exceptions;

import jakarta.annotation.Nullable;

/**
 * Failure of one workflow step, with enough context to diagnose it without re-running.
 */
public class StepFailedException extends WorkflowException {
    private final String stepId;
    @Nullable
    private final String fingerprint;

    public StepFailedException(String stepId, @Nullable String fingerprint, Throwable cause) {
        super("Step '%s' (fingerprint %s) failed: %s".formatted(stepId, fingerprint, cause.getMessage()), cause);
        this.stepId = stepId;
        this.fingerprint = fingerprint;
    }

    public String stepId() {
        return stepId;
    }

    @Nullable
    public String fingerprint() {
        return fingerprint;
    }
}
