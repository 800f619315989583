package ai.pulse.longrunning;

import java.time.Duration;

/**
 * Fixed-delay budget of one retried operation. Not thread-safe: create one per operation.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long delayMs;
    private int attempts = 0;

    public RetryPolicy(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delayMs = delay.toMillis();
    }

    /**
     * Records a failed attempt.
     *
     * @return delay before the next attempt in ms, or {@code -1} when the budget is spent
     */
    public long nextDelayMs() {
        if (++attempts >= maxAttempts) {
            return -1;
        }
        return delayMs;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
