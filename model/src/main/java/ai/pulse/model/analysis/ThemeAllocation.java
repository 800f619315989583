package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.analysis.AnalysisSupport.ThemeText;
import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.exceptions.RemoteFailureException;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

import static ai.pulse.model.analysis.AnalysisSupport.NODES;
import static ai.pulse.model.analysis.AnalysisSupport.array;

/**
 * Assigns texts to themes by their similarity to the themes. Themes are either given statically or
 * taken from a theme generation step.
 *
 * <p>With {@code singleLabel} every text gets the index of its most similar theme, or {@code -1} when
 * even that one is below {@code threshold}. Otherwise every text gets the list of indexes of all
 * themes at or above {@code threshold}.
 */
public record ThemeAllocation(@Nullable List<String> themes, boolean singleLabel, double threshold,
                              @Nullable Boolean fast) implements Analysis
{
    public static final double DEFAULT_THRESHOLD = 0.5;

    public ThemeAllocation {
        themes = AnalysisSupport.themesCopy(themes, "theme_allocation");
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException("theme_allocation threshold must be within [0, 1], got " + threshold);
        }
    }

    public static ThemeAllocation defaults() {
        return new ThemeAllocation(null, true, DEFAULT_THRESHOLD, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.THEME_ALLOCATION;
    }

    @Override
    public boolean needsThemes() {
        return themes == null;
    }

    @Override
    public Map<String, Object> options(boolean fastDefault) {
        return AnalysisSupport.options(
            "themes", themes,
            "single_label", singleLabel,
            "threshold", threshold,
            "fast", effectiveFast(fastDefault));
    }

    @Override
    public SubmitResponse submit(StepContext ctx) {
        var texts = resolveThemes(ctx).stream().map(ThemeText::text).toList();
        return ctx.transport().submit(kind(), options(ctx.fastDefault()),
            Map.of("set_a", ctx.texts(), "set_b", array(texts)));
    }

    @Override
    public StepResult toResult(JsonNode payload, StepContext ctx) {
        var labels = resolveThemes(ctx).stream().map(ThemeText::label).toList();
        var similarity = AnalysisSupport.requireArray(payload, "similarity", kind().id());
        if (similarity.size() != ctx.texts().size()) {
            throw new RemoteFailureException("Similarity matrix has %d rows for %d texts"
                .formatted(similarity.size(), ctx.texts().size()), null);
        }

        var out = NODES.objectNode();
        out.set("themes", array(labels));
        out.set("assignments", assign(similarity, labels.size(), singleLabel, threshold));
        out.set("similarity", similarity.deepCopy());
        return new StepResult(kind(), out);
    }

    static ArrayNode assign(JsonNode similarity, int themesCount, boolean singleLabel, double threshold) {
        var assignments = NODES.arrayNode(similarity.size());
        for (var row : similarity) {
            if (row.size() != themesCount) {
                throw new RemoteFailureException("Similarity row has %d columns for %d themes"
                    .formatted(row.size(), themesCount), null);
            }
            if (singleLabel) {
                int best = -1;
                double bestScore = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < row.size(); i++) {
                    var score = row.get(i).asDouble();
                    if (score > bestScore) {
                        best = i;
                        bestScore = score;
                    }
                }
                assignments.add(bestScore >= threshold ? best : -1);
            } else {
                var matched = NODES.arrayNode();
                for (int i = 0; i < row.size(); i++) {
                    if (row.get(i).asDouble() >= threshold) {
                        matched.add(i);
                    }
                }
                assignments.add(matched);
            }
        }
        return assignments;
    }

    private List<ThemeText> resolveThemes(StepContext ctx) {
        if (themes != null) {
            return themes.stream().map(t -> new ThemeText(t, t)).toList();
        }
        var provided = ctx.themes().orElseThrow(() -> new IllegalStateException(
            "No themes input resolved for step " + ctx.stepId()));
        return AnalysisSupport.themeTexts(provided);
    }
}
