package ai.pulse.model.workflow;

import ai.pulse.model.Dependency;
import ai.pulse.model.Step;
import ai.pulse.model.analysis.Sentiment;
import ai.pulse.model.analysis.ThemeAllocation;
import ai.pulse.model.analysis.ThemeGeneration;
import ai.pulse.model.exceptions.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;

public class WorkflowFileLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void loadYaml() throws Exception {
        var workflow = WorkflowFileLoader.load(resource("workflows/pipeline.yaml"));

        Assert.assertEquals(List.of("The delivery was late", "Great support team"),
            workflow.source("comments").orElseThrow().items());
        assertThat(workflow.steps().stream().map(Step::id).toList(),
            contains("theme_generation", "theme_allocation", "sentiment", "slow_sentiment"));

        Assert.assertEquals(new ThemeGeneration(1, 3, null, true),
            workflow.step("theme_generation").orElseThrow().analysis());
        var allocation = workflow.step("theme_allocation").orElseThrow();
        Assert.assertEquals(new ThemeAllocation(null, false, 0.4, null), allocation.analysis());
        Assert.assertEquals(Dependency.texts("comments"), allocation.dependencies().get(0));
        Assert.assertEquals(new Sentiment(null), workflow.step("sentiment").orElseThrow().analysis());
        Assert.assertEquals(new Sentiment(false), workflow.step("slow_sentiment").orElseThrow().analysis());
    }

    @Test
    public void loadJsonMatchesBuilder() throws Exception {
        var loaded = WorkflowFileLoader.load(resource("workflows/pipeline.json"));
        var built = new WorkflowBuilder()
            .themeGeneration(new ThemeGeneration(1, 1, null, true), StepWiring.defaults())
            .sentiment(new Sentiment(false), StepWiring.defaults())
            .build();

        Assert.assertEquals(built.steps(), loaded.steps());
    }

    @Test
    public void unknownStepKind() {
        var e = Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"summarize\": {}}]}"));
        assertThat(e.getMessage(), containsString("summarize"));
    }

    @Test
    public void unknownOption() {
        var e = Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"sentiment\": {\"themes\": [\"a\"]}}]}"));
        assertThat(e.getMessage(), containsString("themes"));
    }

    @Test
    public void invalidValues() {
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"theme_generation\": {\"min_themes\": 5, \"max_themes\": 2}}]}"));
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"theme_allocation\": {\"threshold\": \"high\"}}]}"));
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"cluster\": {\"k\": 0}}]}"));
    }

    @Test
    public void malformedSteps() {
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [{\"sentiment\": {}, \"cluster\": {}}]}"));
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": [\"sentiment\"]}"));
        Assert.assertThrows(ConfigurationException.class,
            () -> parse("{\"pipeline\": {\"sentiment\": {}}}"));
    }

    @Test
    public void unsupportedExtension() throws Exception {
        var file = folder.newFile("pipeline.toml").toPath();
        Files.writeString(file, "pipeline = []");

        Assert.assertThrows(ConfigurationException.class, () -> WorkflowFileLoader.load(file));
    }

    @Test
    public void nullOptionsMeanDefaults() throws Exception {
        var file = folder.newFile("pipeline.yml").toPath();
        Files.writeString(file, "pipeline:\n  - cluster:\n");

        var workflow = WorkflowFileLoader.load(file);

        Assert.assertEquals(ai.pulse.model.analysis.Cluster.defaults(),
            workflow.step("cluster").orElseThrow().analysis());
    }

    private static void parse(String json) throws Exception {
        WorkflowFileLoader.parse(new ObjectMapper().readTree(json));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(WorkflowFileLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
