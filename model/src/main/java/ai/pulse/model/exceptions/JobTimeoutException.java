package ai.pulse.model.exceptions;

import ai.pulse.model.remote.JobStatus;

import java.time.Duration;

public class JobTimeoutException extends WorkflowException {
    private final String jobId;
    private final Duration timeout;
    private final JobStatus lastStatus;

    public JobTimeoutException(String jobId, Duration timeout, JobStatus lastStatus) {
        super("Job %s did not finish in %d seconds, last status %s"
            .formatted(jobId, timeout.toSeconds(), lastStatus));
        this.jobId = jobId;
        this.timeout = timeout;
        this.lastStatus = lastStatus;
    }

    public String jobId() {
        return jobId;
    }

    public Duration timeout() {
        return timeout;
    }

    public JobStatus lastStatus() {
        return lastStatus;
    }
}
