package ai.pulse.graph.config;

import ai.pulse.graph.AutoInsertMode;
import ai.pulse.graph.FailurePolicy;
import ai.pulse.model.exceptions.ConfigurationException;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public class ExecutorConfigTest {

    @Test
    public void defaults() {
        var config = new ExecutorConfig();

        Assert.assertEquals(4, config.getParallelism());
        Assert.assertEquals(FailurePolicy.ABORT, config.getFailurePolicy());
        Assert.assertEquals(AutoInsertMode.INSERT_DEFAULT, config.getAutoInsert());
        Assert.assertFalse(config.isFast());
        Assert.assertTrue(config.getCache().isEnabled());
        Assert.assertNull(config.getCache().getDirectory());
        Assert.assertEquals(10, config.getJobs().getMaxAttempts());
        Assert.assertEquals(Duration.ofSeconds(2), config.getJobs().getRetryDelay());
        Assert.assertEquals(Duration.ofSeconds(2), config.getJobs().getPollInterval());
        Assert.assertEquals(Duration.ofSeconds(180), config.getJobs().getTimeout());
    }

    @Test
    public void loadYaml() {
        var config = ExecutorConfig.load(resource("config/executor.yaml"));

        Assert.assertEquals(2, config.getParallelism());
        Assert.assertEquals(FailurePolicy.BEST_EFFORT, config.getFailurePolicy());
        Assert.assertEquals(AutoInsertMode.FAIL, config.getAutoInsert());
        Assert.assertTrue(config.isFast());
        Assert.assertFalse(config.getCache().isEnabled());
        Assert.assertEquals("/tmp/pulse-cache", config.getCache().getDirectory());
        Assert.assertEquals(5, config.getJobs().getMaxAttempts());
        Assert.assertEquals(Duration.ofMillis(500), config.getJobs().getRetryDelay());
        Assert.assertEquals(Duration.ofSeconds(1), config.getJobs().getPollInterval());
        Assert.assertEquals(Duration.ofMinutes(1), config.getJobs().getTimeout());
    }

    @Test
    public void missingSectionGivesDefaults() {
        var config = ExecutorConfig.load(stream("other:\n  key: value\n"));

        Assert.assertEquals(4, config.getParallelism());
    }

    @Test
    public void unknownKey() {
        Assert.assertThrows(ConfigurationException.class, () -> ExecutorConfig.load(resource("config/invalid.yaml")));
    }

    @Test
    public void invalidValues() {
        Assert.assertThrows(ConfigurationException.class,
            () -> ExecutorConfig.load(stream("executor:\n  parallelism: 0\n")));
        Assert.assertThrows(ConfigurationException.class,
            () -> ExecutorConfig.load(stream("executor:\n  failure-policy: RETRY\n")));
    }

    private static InputStream resource(String name) {
        var in = ExecutorConfigTest.class.getClassLoader().getResourceAsStream(name);
        Assert.assertNotNull(name, in);
        return in;
    }

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
