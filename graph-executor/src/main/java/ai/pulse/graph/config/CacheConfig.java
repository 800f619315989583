package ai.pulse.graph.config;

import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CacheConfig {
    private boolean enabled = true;

    /**
     * Directory of the persistent cache; memory only when unset.
     */
    @Nullable
    private String directory;
}
