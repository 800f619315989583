package ai.pulse.longrunning;

import ai.pulse.model.remote.JobStatus;
import ai.pulse.model.remote.JobStatusResponse;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Client-side handle of a remote job. Holds the last observed remote state; every successful status
 * query replaces it as a whole.
 */
public final class Job {
    private final String id;
    private volatile JobStatusResponse state = JobStatusResponse.of(JobStatus.QUEUED);

    public Job(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String id() {
        return id;
    }

    public JobStatus status() {
        return state.status();
    }

    @Nullable
    public String resultLocation() {
        return state.resultLocation();
    }

    @Nullable
    public String errorMessage() {
        return state.errorMessage();
    }

    @Nullable
    public JsonNode payload() {
        return state.payload();
    }

    public JobStatusResponse state() {
        return state;
    }

    void update(JobStatusResponse response) {
        this.state = Objects.requireNonNull(response);
    }

    void markError(String message) {
        this.state = new JobStatusResponse(JobStatus.ERROR, null, message, null);
    }

    @Override
    public String toString() {
        return "Job{id='%s', status=%s}".formatted(id, state.status());
    }
}
