package ai.pulse.model.remote;

import ai.pulse.model.exceptions.RemoteFailureException;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    /**
     * Client-local state while a status query is being retried; never reported by the remote side.
     */
    ERROR;

    public boolean finished() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromRemote(String status) {
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "queued", "pending" -> QUEUED;
            case "running" -> RUNNING;
            case "completed" -> COMPLETED;
            case "failed", "error" -> FAILED;
            default -> throw new RemoteFailureException("Unexpected job status: " + status, status);
        };
    }
}
