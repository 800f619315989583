package ai.pulse.model;

import ai.pulse.model.analysis.Analysis;
import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Step {
    private final String id;
    private final Analysis analysis;
    private final List<Dependency> dependencies;

    public Step(String id, Analysis analysis) {
        this(id, analysis, List.of());
    }

    /**
     * Texts are read from the primary dataset unless a {@link Dependency.Role#TEXTS} dependency is given.
     * A step whose analysis needs themes and declares no themes dependency depends on its kind's themes
     * provider, resolved when the graph is built.
     */
    public Step(String id, Analysis analysis, List<Dependency> dependencies) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Step id must not be empty");
        }
        this.id = id;
        this.analysis = Objects.requireNonNull(analysis);

        var texts = dependencies.stream().filter(d -> d.role() == Dependency.Role.TEXTS).toList();
        var themes = dependencies.stream().filter(d -> d.role() == Dependency.Role.THEMES).toList();
        if (texts.size() > 1 || themes.size() > 1) {
            throw new ConfigurationException("Step '%s' declares more than one input per role: %s"
                .formatted(id, dependencies));
        }
        if (!themes.isEmpty() && !analysis.needsThemes()) {
            throw new ConfigurationException("Step '%s' of kind %s does not take a themes input"
                .formatted(id, analysis.kind().id()));
        }

        var deps = new ArrayList<Dependency>(2);
        deps.add(texts.isEmpty() ? Dependency.texts(Workflow.DATASET) : texts.get(0));
        if (analysis.needsThemes()) {
            deps.add(themes.isEmpty() ? Dependency.themesOfKind(analysis.kind().themesProvider()) : themes.get(0));
        }
        this.dependencies = List.copyOf(deps);
    }

    public String id() {
        return id;
    }

    public Analysis analysis() {
        return analysis;
    }

    public StepKind kind() {
        return analysis.kind();
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public Optional<Dependency> dependency(Dependency.Role role) {
        return dependencies.stream().filter(d -> d.role() == role).findFirst();
    }

    public Step withDependencies(List<Dependency> dependencies) {
        return new Step(id, analysis, dependencies);
    }

    /**
     * Issues the step's remote call. Either completes right away or hands back a job to poll.
     */
    public SubmitResponse run(StepContext ctx) {
        return analysis.submit(ctx);
    }

    public StepResult complete(JsonNode payload, StepContext ctx) {
        return analysis.toResult(payload, ctx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Step step)) {
            return false;
        }
        return id.equals(step.id) && analysis.equals(step.analysis) && dependencies.equals(step.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, analysis, dependencies);
    }

    @Override
    public String toString() {
        return "Step{id='%s', kind=%s, dependencies=%s}".formatted(id, kind().id(), dependencies);
    }
}
