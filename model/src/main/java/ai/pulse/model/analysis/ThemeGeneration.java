package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.remote.SubmitResponse;
import jakarta.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static ai.pulse.model.analysis.AnalysisSupport.array;

public record ThemeGeneration(int minThemes, int maxThemes, @Nullable String context, @Nullable Boolean fast)
    implements Analysis
{
    public static final int DEFAULT_MIN_THEMES = 2;
    public static final int DEFAULT_MAX_THEMES = 50;
    public static final int FAST_SAMPLE_SIZE = 200;
    public static final int SAMPLE_SIZE = 1000;

    private static final long SAMPLE_SEED = 0x5eedL;

    public ThemeGeneration {
        if (minThemes < 1 || maxThemes < minThemes) {
            throw new ConfigurationException("theme_generation needs 1 <= min_themes <= max_themes, got %d and %d"
                .formatted(minThemes, maxThemes));
        }
    }

    public static ThemeGeneration defaults() {
        return new ThemeGeneration(DEFAULT_MIN_THEMES, DEFAULT_MAX_THEMES, null, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.THEME_GENERATION;
    }

    @Override
    public Map<String, Object> options(boolean fastDefault) {
        return AnalysisSupport.options(
            "min_themes", minThemes,
            "max_themes", maxThemes,
            "context", context,
            "fast", effectiveFast(fastDefault));
    }

    @Override
    public SubmitResponse submit(StepContext ctx) {
        var fast = effectiveFast(ctx.fastDefault());
        var texts = sample(ctx.textList(), fast ? FAST_SAMPLE_SIZE : SAMPLE_SIZE);
        return ctx.transport().submit(kind(), options(ctx.fastDefault()), Map.of("inputs", array(texts)));
    }

    /**
     * Fixed-seed sample, so the same texts always produce the same request.
     */
    static List<String> sample(List<String> texts, int size) {
        if (texts.size() <= size) {
            return texts;
        }
        var shuffled = new ArrayList<>(texts);
        Collections.shuffle(shuffled, new Random(SAMPLE_SEED));
        return List.copyOf(shuffled.subList(0, size));
    }
}
