package ai.pulse.model.exceptions;

public abstract class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getMessage() {
        return "[%s] %s".formatted(getClass().getSimpleName(), super.getMessage());
    }

    /**
     * Message without the class name prefix.
     */
    public String details() {
        return super.getMessage();
    }
}
