package ai.pulse.longrunning;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * Timer for status queries and retry delays. Work waits in the scheduler queue instead of sleeping
 * on a thread, so a few threads serve every job of a run.
 */
public final class PollingExecutor implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(PollingExecutor.class);

    private final ScheduledThreadPoolExecutor executor;
    private final AtomicBoolean terminating = new AtomicBoolean(false);
    private final AtomicInteger pending = new AtomicInteger(0);

    public PollingExecutor(int threads) {
        this.executor = new ScheduledThreadPoolExecutor(
            threads,
            new ThreadFactoryBuilder()
                .setNameFormat("job-poller-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) ->
                    LOG.error("Unexpected exception in thread {}: {}", t.getName(), e.getMessage(), e))
                .build())
        {
            @Override
            protected void afterExecute(Runnable r, Throwable t) {
                pending.getAndDecrement();
                super.afterExecute(r, t);
                if (t == null && r instanceof Future<?> f && f.isDone()) {
                    try {
                        f.get();
                    } catch (CancellationException ce) {
                        LOG.debug("Polling task cancelled");
                    } catch (ExecutionException ee) {
                        t = ee.getCause();
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                }
                if (t != null) {
                    LOG.error("Unexpected exception {}: {}", t.getClass().getSimpleName(), t.getMessage(), t);
                }
            }
        };
        executor.setRemoveOnCancelPolicy(true);
    }

    public void execute(Runnable task) {
        schedule(task, Duration.ZERO);
    }

    public void schedule(Runnable task, Duration delay) {
        if (terminating.get()) {
            throw new RejectedExecutionException("Cannot schedule polling, executor is terminating");
        }

        try {
            pending.getAndIncrement();
            executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            pending.getAndDecrement();
            throw e;
        }
    }

    public boolean isTerminating() {
        return terminating.get();
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    /**
     * Lets already due tasks finish within {@code timeout}, then drops whatever is left.
     */
    public void shutdown(Duration timeout) {
        if (!terminating.compareAndSet(false, true)) {
            return;
        }

        LOG.debug("Shutdown PollingExecutor. Tasks in queue: {}, running tasks: {}",
            executor.getQueue().size(), executor.getActiveCount());

        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.shutdown();

        var deadline = Instant.now().plus(timeout);
        while (!executor.isTerminated() && Instant.now().isBefore(deadline)) {
            LockSupport.parkNanos(Duration.ofMillis(20).toNanos());
        }

        if (!executor.isTerminated()) {
            LOG.warn("Polling tasks did not finish in {}, remains {}", timeout, pending.get());
            executor.shutdownNow();
        }
    }
}
