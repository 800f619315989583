package ai.pulse.model.exceptions;

public class StepNotRequestedException extends WorkflowException {
    private final String stepId;

    public StepNotRequestedException(String stepId) {
        super("No result for step '%s': it was not requested in this workflow".formatted(stepId));
        this.stepId = stepId;
    }

    public String stepId() {
        return stepId;
    }
}
