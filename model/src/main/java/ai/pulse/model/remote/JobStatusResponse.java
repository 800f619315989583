package ai.pulse.model.remote;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Remote view of a job, as returned by one status query.
 */
public record JobStatusResponse(
    JobStatus status,
    @Nullable String resultLocation,
    @Nullable String errorMessage,
    @Nullable JsonNode payload
) {
    public JobStatusResponse {
        Objects.requireNonNull(status);
    }

    public static JobStatusResponse of(JobStatus status) {
        return new JobStatusResponse(status, null, null, null);
    }

    public static JobStatusResponse completed(String resultLocation) {
        return new JobStatusResponse(JobStatus.COMPLETED, resultLocation, null, null);
    }

    public static JobStatusResponse completedWith(JsonNode payload) {
        return new JobStatusResponse(JobStatus.COMPLETED, null, null, payload);
    }

    public static JobStatusResponse failed(@Nullable String errorMessage) {
        return new JobStatusResponse(JobStatus.FAILED, null, errorMessage, null);
    }
}
