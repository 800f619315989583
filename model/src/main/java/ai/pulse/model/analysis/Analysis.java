package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Closed family of analyses a step can run. Each variant holds its own options and knows how to
 * build its remote request and how to turn the final payload into a {@link StepResult}.
 */
public sealed interface Analysis permits ThemeGeneration, ThemeAllocation, ThemeExtraction, Sentiment, Cluster {

    StepKind kind();

    /**
     * Per-step fast flag; {@code null} inherits the run default.
     */
    @Nullable
    Boolean fast();

    /**
     * Options keyed by their wire names, sorted, with every default materialized.
     */
    Map<String, Object> options(boolean fastDefault);

    default boolean needsThemes() {
        return false;
    }

    SubmitResponse submit(StepContext ctx);

    default StepResult toResult(JsonNode payload, StepContext ctx) {
        return new StepResult(kind(), payload);
    }

    default boolean effectiveFast(boolean fastDefault) {
        var fast = fast();
        return fast != null ? fast : fastDefault;
    }
}
