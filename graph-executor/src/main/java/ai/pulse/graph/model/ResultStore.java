package ai.pulse.graph.model;

import ai.pulse.model.StepResult;
import ai.pulse.model.exceptions.StepNotRequestedException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Results of one run, by step id. Append-only: a step's result is written once.
 */
public final class ResultStore {
    private final Set<String> requested;
    private final Map<String, StepResult> results = new ConcurrentHashMap<>();

    public ResultStore(Collection<String> requested) {
        this.requested = Set.copyOf(requested);
    }

    public void put(String stepId, StepResult result) {
        checkRequested(stepId);
        if (results.putIfAbsent(stepId, result) != null) {
            throw new IllegalStateException("Result of step '%s' already stored".formatted(stepId));
        }
    }

    /**
     * @return result of the step, empty if it was requested but has not produced one
     * @throws StepNotRequestedException if the step was never part of the run
     */
    public Optional<StepResult> find(String stepId) {
        checkRequested(stepId);
        return Optional.ofNullable(results.get(stepId));
    }

    /**
     * @throws NoSuchElementException if the step was requested but has no result
     */
    public StepResult get(String stepId) {
        return find(stepId).orElseThrow(() -> new NoSuchElementException(
            "Step '%s' has no result".formatted(stepId)));
    }

    public boolean contains(String stepId) {
        return results.containsKey(stepId);
    }

    public Set<String> stepIds() {
        return Set.copyOf(results.keySet());
    }

    /**
     * Snapshot of all stored results, ordered by step id.
     */
    public Map<String, StepResult> asMap() {
        var out = new LinkedHashMap<String, StepResult>();
        results.keySet().stream().sorted().forEach(id -> out.put(id, results.get(id)));
        return out;
    }

    private void checkRequested(String stepId) {
        if (!requested.contains(stepId)) {
            throw new StepNotRequestedException(stepId);
        }
    }
}
