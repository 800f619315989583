package ai.pulse.model.exceptions;

public class StepCancelledException extends WorkflowException {

    public StepCancelledException(String message) {
        super(message);
    }
}
