package ai.pulse.model;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Named input of a step. Targets either a name (a source or another step) or a step kind, which is
 * resolved to a concrete step when the execution graph is built.
 */
public record Dependency(Role role, @Nullable String name, @Nullable StepKind kind) {

    public enum Role {
        TEXTS,
        THEMES
    }

    public Dependency {
        Objects.requireNonNull(role);
        if ((name == null) == (kind == null)) {
            throw new IllegalArgumentException("Dependency must target either a name or a step kind");
        }
    }

    public static Dependency texts(String name) {
        return new Dependency(Role.TEXTS, name, null);
    }

    public static Dependency themes(String name) {
        return new Dependency(Role.THEMES, name, null);
    }

    public static Dependency themesOfKind(StepKind kind) {
        return new Dependency(Role.THEMES, null, kind);
    }

    public boolean byKind() {
        return kind != null;
    }

    public Dependency resolvedTo(String target) {
        return new Dependency(role, target, null);
    }

    @Override
    public String toString() {
        return role + "<-" + (name != null ? name : "kind:" + kind.id());
    }
}
