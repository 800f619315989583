package ai.pulse.model;

import ai.pulse.model.exceptions.ConfigurationException;
import jakarta.annotation.Nullable;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum StepKind {
    THEME_GENERATION("theme_generation", null),
    THEME_ALLOCATION("theme_allocation", THEME_GENERATION),
    THEME_EXTRACTION("theme_extraction", THEME_GENERATION),
    SENTIMENT("sentiment", null),
    CLUSTER("cluster", null);

    private final String id;
    @Nullable
    private final StepKind themesProvider;

    StepKind(String id, @Nullable StepKind themesProvider) {
        this.id = id;
        this.themesProvider = themesProvider;
    }

    /**
     * Stable identifier, used as default step id and in workflow files.
     */
    public String id() {
        return id;
    }

    /**
     * Kind of step which produces themes for this one when no static themes are given.
     */
    @Nullable
    public StepKind themesProvider() {
        return themesProvider;
    }

    public static StepKind fromId(String id) {
        for (var kind : values()) {
            if (kind.id.equals(id)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unknown pipeline step: '%s', expected one of %s".formatted(id,
            Arrays.stream(values()).map(StepKind::id).collect(Collectors.joining(", ", "[", "]"))));
    }
}
