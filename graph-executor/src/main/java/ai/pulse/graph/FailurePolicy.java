package ai.pulse.graph;

public enum FailurePolicy {
    /**
     * Stop at the first failed step: cancel what has not started and rethrow the failure.
     */
    ABORT,
    /**
     * Keep running independent branches; steps reading from a failed step fail too.
     */
    BEST_EFFORT
}
