package ai.pulse.model.workflow;

import ai.pulse.model.Dependency;
import ai.pulse.model.Source;
import ai.pulse.model.Step;
import ai.pulse.model.StepKind;
import ai.pulse.model.Workflow;
import ai.pulse.model.analysis.Analysis;
import ai.pulse.model.analysis.Cluster;
import ai.pulse.model.analysis.Sentiment;
import ai.pulse.model.analysis.ThemeAllocation;
import ai.pulse.model.analysis.ThemeExtraction;
import ai.pulse.model.analysis.ThemeGeneration;
import ai.pulse.model.exceptions.ConfigurationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent declaration of a workflow.
 *
 * <p>Steps without an explicit name are called after their kind; repeated kinds get a counter suffix,
 * e.g. {@code sentiment}, {@code sentiment_2}.
 */
public final class WorkflowBuilder {
    private final List<Source> sources = new ArrayList<>();
    private final List<Step> steps = new ArrayList<>();
    private final Map<StepKind, Integer> kindCounts = new EnumMap<>(StepKind.class);
    private final Set<String> names = new HashSet<>();

    public WorkflowBuilder dataset(List<String> items) {
        return source(Workflow.DATASET, items);
    }

    public WorkflowBuilder source(String name, List<String> items) {
        if (!names.add(name)) {
            throw new ConfigurationException("Source '%s' already registered".formatted(name));
        }
        sources.add(new Source(name, items));
        return this;
    }

    public WorkflowBuilder themeGeneration() {
        return step(ThemeGeneration.defaults(), StepWiring.defaults());
    }

    public WorkflowBuilder themeGeneration(ThemeGeneration analysis, StepWiring wiring) {
        return step(analysis, wiring);
    }

    public WorkflowBuilder themeAllocation() {
        return step(ThemeAllocation.defaults(), StepWiring.defaults());
    }

    public WorkflowBuilder themeAllocation(ThemeAllocation analysis, StepWiring wiring) {
        return step(analysis, wiring);
    }

    public WorkflowBuilder themeExtraction() {
        return step(ThemeExtraction.defaults(), StepWiring.defaults());
    }

    public WorkflowBuilder themeExtraction(ThemeExtraction analysis, StepWiring wiring) {
        return step(analysis, wiring);
    }

    public WorkflowBuilder sentiment() {
        return step(Sentiment.defaults(), StepWiring.defaults());
    }

    public WorkflowBuilder sentiment(Sentiment analysis, StepWiring wiring) {
        return step(analysis, wiring);
    }

    public WorkflowBuilder cluster() {
        return step(Cluster.defaults(), StepWiring.defaults());
    }

    public WorkflowBuilder cluster(Cluster analysis, StepWiring wiring) {
        return step(analysis, wiring);
    }

    public WorkflowBuilder step(Analysis analysis) {
        return step(analysis, StepWiring.defaults());
    }

    public WorkflowBuilder step(Analysis analysis, StepWiring wiring) {
        var kind = analysis.kind();
        int count = kindCounts.merge(kind, 1, Integer::sum);

        String id;
        if (wiring.name() != null) {
            id = wiring.name();
        } else {
            id = count == 1 ? kind.id() : kind.id() + "_" + count;
        }
        if (names.contains(id)) {
            throw new ConfigurationException("Process name '%s' already registered".formatted(id));
        }

        var dependencies = new ArrayList<Dependency>(2);
        if (wiring.input() != null) {
            dependencies.add(Dependency.texts(wiring.input()));
        }
        if (wiring.themesFrom() != null) {
            dependencies.add(Dependency.themes(wiring.themesFrom()));
        }

        steps.add(new Step(id, analysis, dependencies));
        names.add(id);
        return this;
    }

    public Workflow build() {
        return new Workflow(sources, steps);
    }
}
