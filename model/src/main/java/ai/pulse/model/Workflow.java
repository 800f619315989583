package ai.pulse.model;

import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.workflow.WorkflowBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared sources and steps, in declaration order.
 */
public final class Workflow {
    public static final String DATASET = "dataset";

    private final Map<String, Source> sources = new LinkedHashMap<>();
    private final Map<String, Step> steps = new LinkedHashMap<>();

    public Workflow(Collection<Source> sources, Collection<Step> steps) {
        for (var source : sources) {
            if (this.sources.putIfAbsent(source.name(), source) != null) {
                throw new ConfigurationException("Source '%s' already registered".formatted(source.name()));
            }
        }
        for (var step : steps) {
            if (this.sources.containsKey(step.id())) {
                throw new ConfigurationException("Step name '%s' clashes with a source".formatted(step.id()));
            }
            if (this.steps.putIfAbsent(step.id(), step) != null) {
                throw new ConfigurationException("Process name '%s' already registered".formatted(step.id()));
            }
        }
    }

    public static WorkflowBuilder builder() {
        return new WorkflowBuilder();
    }

    public List<Source> sources() {
        return List.copyOf(sources.values());
    }

    public List<Step> steps() {
        return List.copyOf(steps.values());
    }

    public Optional<Source> source(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public Optional<Step> step(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    public boolean hasDataset() {
        return sources.containsKey(DATASET);
    }

    /**
     * Same workflow reading the given items as its primary dataset.
     */
    public Workflow withDataset(List<String> items) {
        if (hasDataset()) {
            throw new ConfigurationException("Workflow already declares a '%s' source".formatted(DATASET));
        }
        var allSources = new ArrayList<Source>(sources.size() + 1);
        allSources.add(new Source(DATASET, items));
        allSources.addAll(sources.values());
        return new Workflow(allSources, steps.values());
    }

    @Override
    public String toString() {
        return "Workflow{sources=%s, steps=%s}".formatted(sources.keySet(), steps.values());
    }
}
