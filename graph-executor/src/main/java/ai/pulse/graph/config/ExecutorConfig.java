package ai.pulse.graph.config;

import ai.pulse.graph.AutoInsertMode;
import ai.pulse.graph.FailurePolicy;
import ai.pulse.longrunning.JobMonitorConfig;
import ai.pulse.model.exceptions.ConfigurationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of a {@link ai.pulse.graph.WorkflowExecutor}. Loadable from YAML, kebab-case keys under
 * {@code executor}:
 *
 * <pre>
 * executor:
 *   parallelism: 4
 *   failure-policy: BEST_EFFORT
 *   cache:
 *     directory: /var/cache/pulse
 *   jobs:
 *     poll-interval: PT1S
 * </pre>
 */
@Getter
@Setter
public class ExecutorConfig {
    private static final String ROOT = "executor";

    private static final YAMLMapper YAML = YAMLMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
        .addModule(new JavaTimeModule())
        .build();

    /**
     * Steps running at the same time; {@code 1} runs everything on the calling thread.
     */
    private int parallelism = 4;
    private FailurePolicy failurePolicy = FailurePolicy.ABORT;
    private AutoInsertMode autoInsert = AutoInsertMode.INSERT_DEFAULT;

    /**
     * Fast mode for steps that do not set it themselves.
     */
    private boolean fast = false;

    private CacheConfig cache = new CacheConfig();
    private JobMonitorConfig jobs = new JobMonitorConfig();

    public static ExecutorConfig load(Path file) {
        try (var in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read executor config %s: %s".formatted(file, e.getMessage()), e);
        }
    }

    public static ExecutorConfig load(InputStream in) {
        ExecutorConfig config;
        try {
            var root = YAML.readTree(in);
            var section = root == null ? null : root.get(ROOT);
            config = section == null || section.isNull()
                ? new ExecutorConfig()
                : YAML.treeToValue(section, ExecutorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid executor config: " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    public void validate() {
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be positive, got " + parallelism);
        }
        if (jobs.getMaxAttempts() < 1) {
            throw new ConfigurationException("jobs.max-attempts must be positive, got " + jobs.getMaxAttempts());
        }
        if (jobs.getPollerThreads() < 1) {
            throw new ConfigurationException("jobs.poller-threads must be positive, got " + jobs.getPollerThreads());
        }
        if (jobs.getTimeout().isNegative() || jobs.getPollInterval().isNegative()
            || jobs.getRetryDelay().isNegative())
        {
            throw new ConfigurationException("jobs durations must not be negative");
        }
    }
}
