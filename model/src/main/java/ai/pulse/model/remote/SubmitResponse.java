package ai.pulse.model.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public sealed interface SubmitResponse {

    /**
     * Remote side answered synchronously.
     */
    record Completed(JsonNode payload) implements SubmitResponse {
        public Completed {
            Objects.requireNonNull(payload);
        }
    }

    /**
     * Remote side enqueued the work; completion is tracked by polling the job.
     */
    record Deferred(String jobId) implements SubmitResponse {
        public Deferred {
            Objects.requireNonNull(jobId);
        }
    }

    static SubmitResponse completed(JsonNode payload) {
        return new Completed(payload);
    }

    static SubmitResponse deferred(String jobId) {
        return new Deferred(jobId);
    }
}
