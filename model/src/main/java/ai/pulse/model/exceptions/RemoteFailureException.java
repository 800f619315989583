package ai.pulse.model.exceptions;

import jakarta.annotation.Nullable;

/**
 * Failure reported by the remote side: a non-success response or a job that ended in the failed state.
 */
public class RemoteFailureException extends WorkflowException {
    public static final int NO_STATUS_CODE = -1;

    private final int statusCode;
    @Nullable
    private final String remoteMessage;

    public RemoteFailureException(String message, @Nullable String remoteMessage) {
        this(message, NO_STATUS_CODE, remoteMessage);
    }

    public RemoteFailureException(String message, int statusCode, @Nullable String remoteMessage) {
        super(message);
        this.statusCode = statusCode;
        this.remoteMessage = remoteMessage;
    }

    public static RemoteFailureException fromResponse(int statusCode, @Nullable String detail) {
        return new RemoteFailureException("Status code: %d, Detail: %s".formatted(statusCode, detail),
            statusCode, detail);
    }

    public int statusCode() {
        return statusCode;
    }

    @Nullable
    public String remoteMessage() {
        return remoteMessage;
    }

    /**
     * Not found yet or server error, both worth asking again.
     */
    public boolean isTransient() {
        return statusCode == 404 || statusCode >= 500;
    }
}
