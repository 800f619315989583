package ai.pulse.model;

import ai.pulse.model.exceptions.RemoteFailureException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Output of a completed step. The payload is copied on construction and never exposed mutably
 * through {@link #items()}.
 */
public record StepResult(StepKind kind, JsonNode payload) {

    public StepResult {
        Objects.requireNonNull(kind);
        payload = Objects.requireNonNull(payload).deepCopy();
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /**
     * Part of the payload another step consumes when it reads this step's output as a source.
     */
    public JsonNode items() {
        if (payload.isArray()) {
            return payload.deepCopy();
        }
        return switch (kind) {
            case THEME_GENERATION -> field("themes");
            case THEME_EXTRACTION -> field("extractions");
            case THEME_ALLOCATION -> field("assignments");
            case SENTIMENT -> payload.has("sentiments") ? field("sentiments") : field("results");
            case CLUSTER -> field("similarity");
        };
    }

    private JsonNode field(String name) {
        var node = payload.get(name);
        if (node == null || !node.isArray()) {
            throw new RemoteFailureException("Result of %s has no '%s' list".formatted(kind.id(), name), null);
        }
        return node.deepCopy();
    }
}
