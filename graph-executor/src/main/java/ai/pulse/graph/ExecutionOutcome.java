package ai.pulse.graph;

import ai.pulse.graph.model.ExecutionGraph;
import ai.pulse.graph.model.ResultStore;
import ai.pulse.model.StepResult;
import ai.pulse.model.exceptions.StepFailedException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * What a run produced. Under {@link FailurePolicy#ABORT} a run with a failed step throws instead, so an
 * outcome with failures only comes from {@link FailurePolicy#BEST_EFFORT}.
 *
 * @param order     step ids in the order they were started
 * @param cacheHits steps answered from the cache, without a remote call of their own
 */
public record ExecutionOutcome(
    ExecutionGraph graph,
    ResultStore results,
    Map<String, StepFailedException> failures,
    Set<String> cancelled,
    List<String> order,
    Set<String> cacheHits
) {
    public ExecutionOutcome {
        failures = Map.copyOf(failures);
        cancelled = Set.copyOf(cancelled);
        order = List.copyOf(order);
        cacheHits = Set.copyOf(cacheHits);
    }

    public boolean isSuccessful() {
        return failures.isEmpty() && cancelled.isEmpty();
    }

    public StepResult result(String stepId) {
        return results.get(stepId);
    }

    public Optional<StepResult> find(String stepId) {
        return results.find(stepId);
    }
}
