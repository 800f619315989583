package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.analysis.AnalysisSupport.ThemeText;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

import static ai.pulse.model.analysis.AnalysisSupport.NODES;
import static ai.pulse.model.analysis.AnalysisSupport.array;

public record ThemeExtraction(@Nullable List<String> themes, @Nullable String version, @Nullable Boolean fast)
    implements Analysis
{
    public ThemeExtraction {
        themes = AnalysisSupport.themesCopy(themes, "theme_extraction");
    }

    public static ThemeExtraction defaults() {
        return new ThemeExtraction(null, null, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.THEME_EXTRACTION;
    }

    @Override
    public boolean needsThemes() {
        return themes == null;
    }

    @Override
    public Map<String, Object> options(boolean fastDefault) {
        return AnalysisSupport.options(
            "themes", themes,
            "version", version,
            "fast", effectiveFast(fastDefault));
    }

    @Override
    public SubmitResponse submit(StepContext ctx) {
        return ctx.transport().submit(kind(), options(ctx.fastDefault()),
            Map.of("inputs", ctx.texts(), "themes", array(labels(ctx))));
    }

    /**
     * Keeps the labels the extraction was asked for next to the extracted elements.
     */
    @Override
    public StepResult toResult(JsonNode payload, StepContext ctx) {
        var extractions = AnalysisSupport.requireArray(payload, "extractions", kind().id());
        ObjectNode out = payload.isObject() ? ((ObjectNode) payload).deepCopy() : NODES.objectNode();
        out.set("extractions", extractions.deepCopy());
        out.set("themes", array(labels(ctx)));
        return new StepResult(kind(), out);
    }

    private List<String> labels(StepContext ctx) {
        if (themes != null) {
            return themes;
        }
        var provided = ctx.themes().orElseThrow(() -> new IllegalStateException(
            "No themes input resolved for step " + ctx.stepId()));
        return AnalysisSupport.themeTexts(provided).stream().map(ThemeText::label).toList();
    }
}
