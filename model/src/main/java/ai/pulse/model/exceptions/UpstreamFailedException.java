package ai.pulse.model.exceptions;

/**
 * A step was skipped because a step it reads from did not produce a result.
 */
public class UpstreamFailedException extends WorkflowException {
    private final String upstreamId;

    public UpstreamFailedException(String stepId, String upstreamId) {
        super("Step '%s' skipped: input step '%s' has no result".formatted(stepId, upstreamId));
        this.upstreamId = upstreamId;
    }

    public String upstreamId() {
        return upstreamId;
    }
}
