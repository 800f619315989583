package ai.pulse.model.workflow;

import jakarta.annotation.Nullable;

/**
 * How a declared step is named and where it reads from. Unset fields fall back to the defaults:
 * an automatic name, the primary dataset and the latest theme generation step.
 */
public record StepWiring(@Nullable String name, @Nullable String input, @Nullable String themesFrom) {

    public static StepWiring defaults() {
        return new StepWiring(null, null, null);
    }

    public static StepWiring named(String name) {
        return defaults().withName(name);
    }

    public StepWiring withName(String name) {
        return new StepWiring(name, input, themesFrom);
    }

    public StepWiring withInput(String input) {
        return new StepWiring(name, input, themesFrom);
    }

    public StepWiring withThemesFrom(String themesFrom) {
        return new StepWiring(name, input, themesFrom);
    }
}
