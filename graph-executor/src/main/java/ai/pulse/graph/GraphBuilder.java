package ai.pulse.graph;

import ai.pulse.graph.algo.Algorithms;
import ai.pulse.graph.model.ExecutionGraph;
import ai.pulse.model.Dependency;
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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a declared {@link Workflow} into an {@link ExecutionGraph}. Fails with
 * {@link ConfigurationException} on unknown inputs, missing providers (when insertion is off) and
 * cycles, before anything runs.
 */
public class GraphBuilder {
    private static final Logger LOG = LogManager.getLogger(GraphBuilder.class);

    private static final String EDGE = " -> ";

    private final AutoInsertMode mode;
    private final Function<StepKind, Analysis> defaults;

    public GraphBuilder(AutoInsertMode mode) {
        this(mode, GraphBuilder::defaultAnalysis);
    }

    public GraphBuilder(AutoInsertMode mode, Function<StepKind, Analysis> defaults) {
        this.mode = mode;
        this.defaults = defaults;
    }

    public ExecutionGraph build(Workflow workflow) {
        var steps = new ArrayList<>(workflow.steps());
        var inserted = new LinkedHashSet<String>();
        resolveKinds(workflow, steps, inserted);

        var byId = new LinkedHashMap<String, Step>();
        steps.forEach(s -> byId.put(s.id(), s));
        checkNames(workflow, byId);

        var upstream = ExecutionGraph.upstreamOf(byId);
        Algorithms.findCycle(upstream).ifPresent(cycle -> {
            throw new ConfigurationException("Workflow contains a cycle: " + String.join(EDGE, cycle));
        });

        var order = Algorithms.topologicalOrder(upstream, List.copyOf(byId.keySet()));
        LOG.debug("Execution order: {}", order);
        return new ExecutionGraph(workflow.sources(), steps, order, inserted);
    }

    /**
     * Replaces every dependency on a step kind by a dependency on a concrete step: the last step of that
     * kind declared before the dependent, otherwise the last one declared at all. Inserts a default
     * provider when none exists and insertion is on.
     */
    private void resolveKinds(Workflow workflow, List<Step> steps, Set<String> inserted) {
        int i = 0;
        while (i < steps.size()) {
            var step = steps.get(i);
            var resolved = new ArrayList<Dependency>(step.dependencies().size());
            Step provider = null;

            for (var dependency : step.dependencies()) {
                if (!dependency.byKind()) {
                    resolved.add(dependency);
                    continue;
                }
                var target = findProvider(steps, i, dependency.kind());
                if (target == null) {
                    if (mode == AutoInsertMode.FAIL) {
                        throw new ConfigurationException("Step '%s' needs a %s step, but none is declared"
                            .formatted(step.id(), dependency.kind().id()));
                    }
                    provider = insertProvider(workflow, steps, step, dependency.kind());
                    break;
                }
                resolved.add(dependency.resolvedTo(target));
            }

            if (provider != null) {
                steps.add(i, provider);
                inserted.add(provider.id());
                LOG.info("Insert step '{}' of kind {} for step '{}'", provider.id(), provider.kind().id(), step.id());
                // the inserted step itself is resolved next, then the dependent again
                continue;
            }

            steps.set(i, step.withDependencies(resolved));
            i++;
        }
    }

    private static String findProvider(List<Step> steps, int dependentIndex, StepKind kind) {
        String before = null;
        String any = null;
        for (int j = 0; j < steps.size(); j++) {
            if (steps.get(j).kind() != kind) {
                continue;
            }
            if (j < dependentIndex) {
                before = steps.get(j).id();
            }
            any = steps.get(j).id();
        }
        return before != null ? before : any;
    }

    private Step insertProvider(Workflow workflow, List<Step> steps, Step dependent, StepKind kind) {
        var taken = new HashSet<String>();
        workflow.sources().forEach(s -> taken.add(s.name()));
        steps.forEach(s -> taken.add(s.id()));

        var id = kind.id();
        for (int n = 2; taken.contains(id); n++) {
            id = kind.id() + "_" + n;
        }

        var analysis = defaults.apply(kind);
        if (analysis.kind() != kind) {
            throw new IllegalStateException("Default analysis for %s is of kind %s"
                .formatted(kind.id(), analysis.kind().id()));
        }
        var texts = dependent.dependency(Dependency.Role.TEXTS).orElseThrow();
        return new Step(id, analysis, List.of(texts));
    }

    private static void checkNames(Workflow workflow, Map<String, Step> steps) {
        for (var step : steps.values()) {
            for (var dependency : step.dependencies()) {
                var name = dependency.name();
                if (workflow.source(name).isEmpty() && !steps.containsKey(name)) {
                    if (Workflow.DATASET.equals(name)) {
                        throw new ConfigurationException(
                            "Step '%s' reads the primary dataset, but the workflow has none".formatted(step.id()));
                    }
                    throw new ConfigurationException("Step '%s' depends on unknown input '%s'"
                        .formatted(step.id(), name));
                }
            }
        }
    }

    public static Analysis defaultAnalysis(StepKind kind) {
        return switch (kind) {
            case THEME_GENERATION -> ThemeGeneration.defaults();
            case THEME_ALLOCATION -> ThemeAllocation.defaults();
            case THEME_EXTRACTION -> ThemeExtraction.defaults();
            case SENTIMENT -> Sentiment.defaults();
            case CLUSTER -> Cluster.defaults();
        };
    }
}
