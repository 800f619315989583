package ai.pulse.model.analysis;

import ai.pulse.model.StepContext;
import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.remote.AnalysisTransport;
import ai.pulse.model.remote.JobStatusResponse;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class AnalysisTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void optionsMaterializeDefaultsInSortedOrder() {
        var options = ThemeGeneration.defaults().options(true);

        assertThat(new ArrayList<>(options.keySet()), contains("context", "fast", "max_themes", "min_themes"));
        Assert.assertEquals(2, options.get("min_themes"));
        Assert.assertEquals(50, options.get("max_themes"));
        Assert.assertEquals(true, options.get("fast"));
        Assert.assertEquals(false, new Sentiment(false).options(true).get("fast"));
    }

    @Test
    public void invalidOptions() {
        Assert.assertThrows(ConfigurationException.class, () -> new ThemeGeneration(0, 3, null, null));
        Assert.assertThrows(ConfigurationException.class, () -> new ThemeAllocation(null, true, 1.5, null));
        Assert.assertThrows(ConfigurationException.class, () -> new ThemeAllocation(List.of(), true, 0.5, null));
        Assert.assertThrows(ConfigurationException.class, () -> new ThemeExtraction(List.of(), null, null));
        Assert.assertThrows(ConfigurationException.class, () -> new Cluster(0, null));
    }

    @Test
    public void generationSamplesDeterministically() {
        var texts = IntStream.range(0, 500).mapToObj(i -> "text " + i).toList();

        var first = ThemeGeneration.sample(texts, ThemeGeneration.FAST_SAMPLE_SIZE);
        var second = ThemeGeneration.sample(texts, ThemeGeneration.FAST_SAMPLE_SIZE);

        Assert.assertEquals(ThemeGeneration.FAST_SAMPLE_SIZE, first.size());
        Assert.assertEquals(first, second);
        Assert.assertSame(texts, ThemeGeneration.sample(texts, ThemeGeneration.SAMPLE_SIZE));
    }

    @Test
    public void generationSubmitsSampledTexts() {
        var transport = new RecordingTransport(json("{\"themes\": [\"T1\"]}"));
        var texts = IntStream.range(0, 300).mapToObj(i -> "text " + i).toList();
        var ctx = new Ctx(array(texts), null, transport);

        new ThemeGeneration(2, 5, null, true).submit(ctx);

        Assert.assertEquals(StepKind.THEME_GENERATION, transport.kind);
        Assert.assertEquals(ThemeGeneration.FAST_SAMPLE_SIZE, transport.inputs.get("inputs").size());
    }

    @Test
    public void singleLabelAssignment() {
        var similarity = json("[[0.9, 0.1], [0.2, 0.7], [0.3, 0.4]]");

        var assignments = ThemeAllocation.assign(similarity, 2, true, 0.5);

        Assert.assertEquals(json("[0, 1, -1]"), assignments);
    }

    @Test
    public void multiLabelAssignment() {
        var similarity = json("[[0.9, 0.6], [0.2, 0.7], [0.3, 0.4]]");

        var assignments = ThemeAllocation.assign(similarity, 2, false, 0.5);

        Assert.assertEquals(json("[[0, 1], [1], []]"), assignments);
    }

    @Test
    public void allocationUsesThemeObjects() {
        var themes = (ArrayNode) json("""
            [{"shortLabel": "Price", "representatives": ["too", "expensive"]},
             {"shortLabel": "Staff", "representatives": ["kind", "people"]}]""");
        var transport = new RecordingTransport(json("{\"similarity\": [[0.8, 0.1], [0.1, 0.9]]}"));
        var ctx = new Ctx(array(List.of("costly", "nice staff")), themes, transport);
        var allocation = ThemeAllocation.defaults();

        var response = (SubmitResponse.Completed) allocation.submit(ctx);
        var result = allocation.toResult(response.payload(), ctx);

        Assert.assertEquals(json("[\"too expensive\", \"kind people\"]"), transport.inputs.get("set_b"));
        Assert.assertEquals(json("[\"Price\", \"Staff\"]"), result.payload().get("themes"));
        Assert.assertEquals(json("[0, 1]"), result.items());
    }

    @Test
    public void nestedSentimentKeepsShape() {
        var transport = new RecordingTransport(json("{\"sentiments\": [\"pos\", \"neg\", \"neu\"]}"));
        var ctx = new Ctx((ArrayNode) json("[[\"a\", \"b\"], [\"c\"]]"), null, transport);
        var sentiment = Sentiment.defaults();

        var response = (SubmitResponse.Completed) sentiment.submit(ctx);
        StepResult result = sentiment.toResult(response.payload(), ctx);

        Assert.assertEquals(json("[\"a\", \"b\", \"c\"]"), transport.inputs.get("inputs"));
        Assert.assertEquals(json("[[\"pos\", \"neg\"], [\"neu\"]]"), result.items());
    }

    @Test
    public void extractionRecordsThemes() {
        var transport = new RecordingTransport(json("{\"extractions\": [[[\"late\"]]]}"));
        var ctx = new Ctx(array(List.of("late delivery")), null, transport);
        var extraction = new ThemeExtraction(List.of("Delivery"), "2024-01", false);

        var response = (SubmitResponse.Completed) extraction.submit(ctx);
        var result = extraction.toResult(response.payload(), ctx);

        Assert.assertEquals(json("[\"Delivery\"]"), result.payload().get("themes"));
        Assert.assertEquals(json("[[[\"late\"]]]"), result.items());
        Assert.assertFalse(extraction.needsThemes());
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    private static ArrayNode array(List<String> items) {
        return AnalysisSupport.array(items);
    }

    private record Ctx(ArrayNode texts, ArrayNode themesNode, AnalysisTransport transport) implements StepContext {
        @Override
        public String stepId() {
            return "step";
        }

        @Override
        public Optional<ArrayNode> themes() {
            return Optional.ofNullable(themesNode);
        }

        @Override
        public boolean fastDefault() {
            return false;
        }

        @Override
        public Optional<StepResult> dependencyResult(String name) {
            return Optional.empty();
        }
    }

    private static final class RecordingTransport implements AnalysisTransport {
        private final JsonNode answer;
        private StepKind kind;
        private Map<String, JsonNode> inputs;

        RecordingTransport(JsonNode answer) {
            this.answer = answer;
        }

        @Override
        public SubmitResponse submit(StepKind kind, Map<String, Object> options, Map<String, JsonNode> inputs) {
            this.kind = kind;
            this.inputs = inputs;
            return SubmitResponse.completed(answer);
        }

        @Override
        public JobStatusResponse pollStatus(String jobId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public JsonNode fetchResult(String resultLocation) {
            throw new UnsupportedOperationException();
        }
    }
}
