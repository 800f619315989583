package ai.pulse.model.exceptions;

public class TransportException extends WorkflowException {
    private final int attempts;

    public TransportException(String message) {
        this(message, null, 1);
    }

    public TransportException(String message, Throwable cause) {
        this(message, cause, 1);
    }

    public TransportException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Number of requests issued before giving up.
     */
    public int attempts() {
        return attempts;
    }
}
