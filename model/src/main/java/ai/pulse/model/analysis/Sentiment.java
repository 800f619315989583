package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Sentiment of every text. Nested inputs, such as extractions of another step, are flattened for the
 * request and the answer is reshaped to the input nesting.
 */
public record Sentiment(@Nullable Boolean fast) implements Analysis {

    public static Sentiment defaults() {
        return new Sentiment(null);
    }

    @Override
    public StepKind kind() {
        return StepKind.SENTIMENT;
    }

    @Override
    public Map<String, Object> options(boolean fastDefault) {
        return AnalysisSupport.options("fast", effectiveFast(fastDefault));
    }

    @Override
    public SubmitResponse submit(StepContext ctx) {
        var texts = ctx.texts();
        var inputs = NestedItems.isNested(texts) ? NestedItems.flatten(texts) : texts;
        return ctx.transport().submit(kind(), options(ctx.fastDefault()), Map.of("inputs", inputs));
    }

    @Override
    public StepResult toResult(JsonNode payload, StepContext ctx) {
        var texts = ctx.texts();
        if (!NestedItems.isNested(texts)) {
            return new StepResult(kind(), payload);
        }
        var field = payload.has("sentiments") ? "sentiments" : "results";
        var flat = AnalysisSupport.requireArray(payload, field, kind().id());
        ObjectNode out = payload.isObject() ? ((ObjectNode) payload).deepCopy() : AnalysisSupport.NODES.objectNode();
        out.set("sentiments", NestedItems.reshape(texts, flat));
        out.remove("results");
        return new StepResult(kind(), out);
    }
}
