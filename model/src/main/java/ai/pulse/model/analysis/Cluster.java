package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.remote.SubmitResponse;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Full self-similarity matrix of the texts, the input of client-side clustering.
 */
public record Cluster(int k, @Nullable Boolean fast) implements Analysis {
    public static final int DEFAULT_K = 2;

    public Cluster {
        if (k < 1) {
            throw new ConfigurationException("cluster needs k >= 1, got " + k);
        }
    }

    public static Cluster defaults() {
        return new Cluster(DEFAULT_K, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.CLUSTER;
    }

    @Override
    public Map<String, Object> options(boolean fastDefault) {
        return AnalysisSupport.options("k", k, "fast", effectiveFast(fastDefault));
    }

    @Override
    public SubmitResponse submit(StepContext ctx) {
        return ctx.transport().submit(kind(), options(ctx.fastDefault()), Map.of("set", ctx.texts()));
    }
}
