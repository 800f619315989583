package ai.pulse.graph;

import ai.pulse.graph.model.ExecutionGraph;
import ai.pulse.graph.model.ResultStore;
import ai.pulse.model.Dependency;
import ai.pulse.model.Step;
import ai.pulse.model.StepContext;
import ai.pulse.model.StepResult;
import ai.pulse.model.remote.AnalysisTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.annotation.Nullable;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inputs of a step, read from sources and from results of finished steps when the step is dispatched.
 */
final class ResolvedStepContext implements StepContext {
    private final Step step;
    private final boolean fastDefault;
    private final AnalysisTransport transport;
    private final Map<Dependency.Role, ArrayNode> inputs = new EnumMap<>(Dependency.Role.class);
    private final Map<String, StepResult> dependencyResults = new HashMap<>();

    ResolvedStepContext(Step step, ExecutionGraph graph, ResultStore results, boolean fastDefault,
                        AnalysisTransport transport)
    {
        this.step = step;
        this.fastDefault = fastDefault;
        this.transport = transport;

        for (var dependency : step.dependencies()) {
            var name = dependency.name();
            var source = graph.source(name);
            if (source.isPresent()) {
                var items = JsonNodeFactory.instance.arrayNode(source.get().items().size());
                source.get().items().forEach(items::add);
                inputs.put(dependency.role(), items);
            } else {
                var result = results.get(name);
                dependencyResults.put(name, result);
                inputs.put(dependency.role(), asArray(result.items(), name));
            }
        }
    }

    /**
     * Resolved inputs by role; what the step's fingerprint is computed from.
     */
    Map<Dependency.Role, JsonNode> inputs() {
        return Map.copyOf(inputs);
    }

    @Override
    public String stepId() {
        return step.id();
    }

    @Override
    public ArrayNode texts() {
        return inputs.get(Dependency.Role.TEXTS).deepCopy();
    }

    @Override
    public Optional<ArrayNode> themes() {
        return Optional.ofNullable(inputs.get(Dependency.Role.THEMES)).map(ArrayNode::deepCopy);
    }

    @Override
    public boolean fastDefault() {
        return fastDefault;
    }

    @Override
    public AnalysisTransport transport() {
        return transport;
    }

    @Override
    public Optional<StepResult> dependencyResult(String name) {
        return Optional.ofNullable(dependencyResults.get(name));
    }

    private static ArrayNode asArray(JsonNode items, @Nullable String name) {
        if (items instanceof ArrayNode array) {
            return array;
        }
        throw new IllegalStateException("Output of step '%s' is not a list: %s".formatted(name, items.getNodeType()));
    }
}
