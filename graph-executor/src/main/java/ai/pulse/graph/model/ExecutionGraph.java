package ai.pulse.graph.model;

import ai.pulse.model.Dependency;
import ai.pulse.model.Source;
import ai.pulse.model.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated plan of one workflow run: every dependency resolved to a source or a step by name, steps
 * inserted for missing providers, and the order the steps run in.
 */
public final class ExecutionGraph {
    private static final String EDGE = " -> ";

    private final Map<String, Source> sources;
    private final Map<String, Step> steps;
    private final List<String> order;
    private final Set<String> inserted;
    private final Map<String, List<String>> upstream;

    public ExecutionGraph(List<Source> sources, List<Step> steps, List<String> order, Set<String> inserted) {
        this.sources = new LinkedHashMap<>();
        sources.forEach(s -> this.sources.put(s.name(), s));
        this.steps = new LinkedHashMap<>();
        steps.forEach(s -> this.steps.put(s.id(), s));
        this.order = List.copyOf(order);
        this.inserted = Collections.unmodifiableSet(new LinkedHashSet<>(inserted));
        this.upstream = upstreamOf(this.steps);
    }

    /**
     * Step id to the ids of the steps it reads from. Sources are left out.
     */
    public static Map<String, List<String>> upstreamOf(Map<String, Step> steps) {
        var adjacency = new LinkedHashMap<String, List<String>>();
        for (var step : steps.values()) {
            var inputs = new LinkedHashSet<String>();
            for (var dependency : step.dependencies()) {
                if (dependency.name() != null && steps.containsKey(dependency.name())) {
                    inputs.add(dependency.name());
                }
            }
            adjacency.put(step.id(), List.copyOf(inputs));
        }
        return Collections.unmodifiableMap(adjacency);
    }

    public List<Source> sources() {
        return List.copyOf(sources.values());
    }

    public Optional<Source> source(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    /**
     * Steps in declaration order, inserted ones included.
     */
    public List<Step> steps() {
        return List.copyOf(steps.values());
    }

    public Optional<Step> step(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    /**
     * Step ids in execution order.
     */
    public List<String> order() {
        return order;
    }

    public Set<String> insertedSteps() {
        return inserted;
    }

    public Map<String, List<String>> adjacency() {
        return upstream;
    }

    public List<String> upstream(String stepId) {
        return upstream.getOrDefault(stepId, List.of());
    }

    public List<String> downstream(String stepId) {
        var out = new ArrayList<String>();
        upstream.forEach((id, inputs) -> {
            if (inputs.contains(stepId)) {
                out.add(id);
            }
        });
        return out;
    }

    public String toDotNotation() {
        var sb = new StringBuilder("digraph {");
        for (var source : sources.keySet()) {
            sb.append("\n\t").append('"').append(source).append('"').append(";");
        }
        for (var id : order) {
            var step = steps.get(id);
            sb.append("\n\t").append('"').append(id).append('"')
                .append(" [label=\"").append(id).append(" (").append(step.kind().id()).append(")\"];");
            for (var dependency : step.dependencies()) {
                sb.append("\n\t")
                    .append('"').append(dependency.name()).append('"')
                    .append(EDGE)
                    .append('"').append(id).append('"');
                if (dependency.role() == Dependency.Role.THEMES) {
                    sb.append(" [label=\"themes\"]");
                }
                sb.append(";");
            }
        }
        sb.append("\n}");
        return sb.toString();
    }

    @Override
    public String toString() {
        return toDotNotation();
    }
}
