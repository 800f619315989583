package ai.pulse.longrunning;

import ai.pulse.model.exceptions.JobTimeoutException;
import ai.pulse.model.exceptions.RemoteFailureException;
import ai.pulse.model.exceptions.StepCancelledException;
import ai.pulse.model.exceptions.TransportException;
import ai.pulse.model.exceptions.WorkflowException;
import ai.pulse.model.remote.AnalysisTransport;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Tracks remote jobs until they finish. Status queries are retried on transient faults; waiting is a
 * chain of timer-driven polls on a {@link PollingExecutor}, so no caller thread sleeps.
 */
public class JobMonitor implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(JobMonitor.class);

    public static final String NO_ERROR_MESSAGE = "no error message provided";

    private final AnalysisTransport transport;
    private final JobMonitorConfig config;
    private final PollingExecutor executor;
    // futures of refreshes and waits not settled yet, failed on close
    private final Set<CompletableFuture<?>> outstanding = ConcurrentHashMap.newKeySet();

    public JobMonitor(AnalysisTransport transport, JobMonitorConfig config) {
        this.transport = transport;
        this.config = config;
        this.executor = new PollingExecutor(config.getPollerThreads());
    }

    public JobMonitorConfig config() {
        return config;
    }

    /**
     * Queries the job status once, retrying transient faults up to {@code maxAttempts} queries in total.
     * Completes with the same job, its state replaced by the answer.
     */
    public CompletableFuture<Job> refreshAsync(Job job) {
        var result = track(new CompletableFuture<Job>());
        var policy = new RetryPolicy(config.getMaxAttempts(), config.getRetryDelay());
        submit(() -> queryStatus(job, policy, result), Duration.ZERO, result);
        return result;
    }

    public Job refresh(Job job) {
        return FutureUtils.join(refreshAsync(job));
    }

    public CompletableFuture<JsonNode> await(Job job) {
        return await(job, config.getTimeout(), () -> false);
    }

    /**
     * Polls the job every {@code pollInterval} until it finishes, then completes with its result.
     *
     * @param cancelled checked before every poll; once it answers {@code true} polling stops and the
     *                  future fails with {@link StepCancelledException}
     */
    public CompletableFuture<JsonNode> await(Job job, Duration timeout, BooleanSupplier cancelled) {
        var result = track(new CompletableFuture<JsonNode>());
        var deadline = System.nanoTime() + timeout.toNanos();
        LOG.debug("Wait for job {} up to {}s", job.id(), timeout.toSeconds());
        poll(job, timeout, deadline, cancelled, result);
        return result;
    }

    public JsonNode wait(Job job) {
        return FutureUtils.join(await(job));
    }

    public JsonNode wait(Job job, Duration timeout) {
        return FutureUtils.join(await(job, timeout, () -> false));
    }

    /**
     * Stops the poller. Scheduled polls and retries are dropped, so every refresh or wait still pending
     * fails with {@link StepCancelledException}.
     */
    @Override
    public void close() {
        executor.close();
        for (var future : outstanding) {
            if (future.completeExceptionally(new StepCancelledException("Job monitor is closed"))) {
                LOG.debug("Pending job future cancelled on close");
            }
        }
        outstanding.clear();
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        outstanding.add(future);
        future.whenComplete((r, e) -> outstanding.remove(future));
        return future;
    }

    private void poll(Job job, Duration timeout, long deadline, BooleanSupplier cancelled,
                      CompletableFuture<JsonNode> result)
    {
        if (cancelled.getAsBoolean()) {
            LOG.info("Stop polling job {}: run cancelled", job.id());
            result.completeExceptionally(new StepCancelledException("Polling of job %s cancelled, last status %s"
                .formatted(job.id(), job.status())));
            return;
        }

        refreshAsync(job).whenComplete((j, error) -> {
            if (error != null) {
                result.completeExceptionally(FutureUtils.unwrap(error));
                return;
            }

            var status = job.status();
            switch (status) {
                case COMPLETED -> finish(job, result);
                case FAILED -> {
                    var message = job.errorMessage() != null ? job.errorMessage() : NO_ERROR_MESSAGE;
                    LOG.error("Job {} failed: {}", job.id(), message);
                    result.completeExceptionally(new RemoteFailureException(
                        "Job %s failed: %s".formatted(job.id(), message), message));
                }
                default -> {
                    var remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        LOG.error("Job {} timed out in status {}", job.id(), status);
                        result.completeExceptionally(new JobTimeoutException(job.id(), timeout, status));
                        return;
                    }
                    var delay = Duration.ofNanos(Math.min(config.getPollInterval().toNanos(), remaining));
                    LOG.debug("Job {} is {}, next poll in {}ms", job.id(), status, delay.toMillis());
                    submit(() -> poll(job, timeout, deadline, cancelled, result), delay, result);
                }
            }
        });
    }

    private void finish(Job job, CompletableFuture<JsonNode> result) {
        var location = job.resultLocation();
        if (location == null) {
            var payload = job.payload();
            if (payload == null) {
                result.completeExceptionally(new RemoteFailureException(
                    "Job %s completed without result location or payload".formatted(job.id()), null));
            } else {
                LOG.debug("Job {} completed with inline payload", job.id());
                result.complete(payload);
            }
            return;
        }

        LOG.debug("Job {} completed, fetch result from {}", job.id(), location);
        submit(() -> {
            try {
                result.complete(transport.fetchResult(location));
            } catch (WorkflowException e) {
                LOG.error("Cannot fetch result of job {} from {}: {}", job.id(), location, e.getMessage());
                result.completeExceptionally(e);
            } catch (RuntimeException e) {
                LOG.error("Cannot fetch result of job {} from {}: {}", job.id(), location, e.getMessage(), e);
                result.completeExceptionally(new TransportException(
                    "Cannot fetch result of job %s: %s".formatted(job.id(), e.getMessage()), e));
            }
        }, Duration.ZERO, result);
    }

    private void queryStatus(Job job, RetryPolicy policy, CompletableFuture<Job> result) {
        try {
            var response = transport.pollStatus(job.id());
            job.update(response);
            result.complete(job);
        } catch (RuntimeException e) {
            if (!canRetry(e)) {
                LOG.error("Got non-retryable error on status of job {}: {}", job.id(), e.getMessage());
                result.completeExceptionally(e);
                return;
            }

            var delay = policy.nextDelayMs();
            if (delay >= 0) {
                job.markError(e.getMessage());
                LOG.warn("Got retryable error on status of job {} #{}: {}. Retry after {}ms.",
                    job.id(), policy.attempts(), e.getMessage(), delay);
                submit(() -> queryStatus(job, policy, result), Duration.ofMillis(delay), result);
            } else {
                job.markError(e.getMessage());
                LOG.error("Got retryable error on status of job {}: {}. Retries limit {} exceeded.",
                    job.id(), e.getMessage(), policy.maxAttempts());
                result.completeExceptionally(new TransportException(
                    "Cannot get status of job %s after %d attempts: %s"
                        .formatted(job.id(), policy.attempts(), e.getMessage()),
                    e, policy.attempts()));
            }
        }
    }

    private static boolean canRetry(RuntimeException e) {
        if (e instanceof TransportException) {
            return true;
        }
        return e instanceof RemoteFailureException rfe && rfe.isTransient();
    }

    private void submit(Runnable task, Duration delay, CompletableFuture<?> result) {
        try {
            executor.schedule(task, delay);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new StepCancelledException("Job monitor is closed: " + e.getMessage()));
        }
    }
}
