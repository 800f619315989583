package ai.pulse.model.workflow;

import ai.pulse.model.StepKind;
import ai.pulse.model.Workflow;
import ai.pulse.model.analysis.Analysis;
import ai.pulse.model.analysis.Cluster;
import ai.pulse.model.analysis.Sentiment;
import ai.pulse.model.analysis.ThemeAllocation;
import ai.pulse.model.analysis.ThemeExtraction;
import ai.pulse.model.analysis.ThemeGeneration;
import ai.pulse.model.exceptions.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a workflow declared in a JSON or YAML file:
 *
 * <pre>
 * sources:
 *   comments: ["first", "second"]
 * pipeline:
 *   - theme_generation: {min_themes: 2, max_themes: 5}
 *   - theme_allocation: {inputs: comments, threshold: 0.4}
 *   - sentiment: {fast: true}
 * </pre>
 *
 * Each pipeline entry maps one step kind to its options, in declaration order.
 */
public final class WorkflowFileLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static final String NAME = "name";
    private static final String SOURCE = "source";
    private static final String INPUTS = "inputs";
    private static final String THEMES_FROM = "themes_from";

    private static final Map<StepKind, Set<String>> OPTIONS = Map.of(
        StepKind.THEME_GENERATION, Set.of("min_themes", "max_themes", "context", "fast"),
        StepKind.THEME_ALLOCATION, Set.of("themes", "single_label", "threshold", "fast"),
        StepKind.THEME_EXTRACTION, Set.of("themes", "version", "fast"),
        StepKind.SENTIMENT, Set.of("fast"),
        StepKind.CLUSTER, Set.of("k", "fast"));

    private WorkflowFileLoader() {}

    public static Workflow load(Path file) {
        var fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (fileName.endsWith(".yml") || fileName.endsWith(".yaml")) {
            mapper = YAML;
        } else if (fileName.endsWith(".json")) {
            mapper = JSON;
        } else {
            throw new ConfigurationException("Unsupported config type: " + file);
        }

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot parse workflow file %s: %s".formatted(file, e.getMessage()), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read workflow file %s: %s".formatted(file, e.getMessage()), e);
        }
        return parse(root);
    }

    public static Workflow parse(@Nullable JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = JsonNodeFactory.instance.objectNode();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Workflow definition must be a mapping, got " + root.getNodeType());
        }

        var builder = new WorkflowBuilder();

        var sources = root.path("sources");
        if (!sources.isMissingNode() && !sources.isNull()) {
            if (!sources.isObject()) {
                throw new ConfigurationException("'sources' must map source names to lists of texts");
            }
            for (Iterator<Map.Entry<String, JsonNode>> it = sources.fields(); it.hasNext(); ) {
                var entry = it.next();
                builder.source(entry.getKey(), strings(entry.getValue(), "source " + entry.getKey()));
            }
        }

        var pipeline = root.path("pipeline");
        if (pipeline.isMissingNode() || pipeline.isNull()) {
            return builder.build();
        }
        if (!pipeline.isArray()) {
            throw new ConfigurationException("'pipeline' must be a list of steps");
        }
        for (var step : pipeline) {
            if (!step.isObject() || step.size() != 1) {
                throw new ConfigurationException("Invalid pipeline step: " + step);
            }
            var entry = step.fields().next();
            var kind = StepKind.fromId(entry.getKey());
            var params = entry.getValue() == null || entry.getValue().isNull()
                ? JsonNodeFactory.instance.objectNode()
                : entry.getValue();
            if (!params.isObject()) {
                throw new ConfigurationException("Options of %s must be a mapping, got %s".formatted(kind.id(), params));
            }
            checkKeys(kind, params);
            builder.step(analysis(kind, params), wiring(kind, params));
        }
        return builder.build();
    }

    private static void checkKeys(StepKind kind, JsonNode params) {
        var allowed = new HashSet<>(OPTIONS.get(kind));
        allowed.add(NAME);
        allowed.add(SOURCE);
        allowed.add(INPUTS);
        if (kind.themesProvider() != null) {
            allowed.add(THEMES_FROM);
        }
        for (Iterator<String> it = params.fieldNames(); it.hasNext(); ) {
            var key = it.next();
            if (!allowed.contains(key)) {
                throw new ConfigurationException("Unknown option '%s' for %s".formatted(key, kind.id()));
            }
        }
        if (params.has(SOURCE) && params.has(INPUTS)) {
            throw new ConfigurationException("Step %s declares both '%s' and '%s'".formatted(kind.id(), SOURCE, INPUTS));
        }
    }

    private static Analysis analysis(StepKind kind, JsonNode p) {
        var fast = optBoolean(p, "fast");
        return switch (kind) {
            case THEME_GENERATION -> new ThemeGeneration(
                intValue(p, "min_themes", ThemeGeneration.DEFAULT_MIN_THEMES),
                intValue(p, "max_themes", ThemeGeneration.DEFAULT_MAX_THEMES),
                optString(p, "context"),
                fast);
            case THEME_ALLOCATION -> new ThemeAllocation(
                optStrings(p, "themes"),
                booleanValue(p, "single_label", true),
                doubleValue(p, "threshold", ThemeAllocation.DEFAULT_THRESHOLD),
                fast);
            case THEME_EXTRACTION -> new ThemeExtraction(
                optStrings(p, "themes"),
                optString(p, "version"),
                fast);
            case SENTIMENT -> new Sentiment(fast);
            case CLUSTER -> new Cluster(intValue(p, "k", Cluster.DEFAULT_K), fast);
        };
    }

    private static StepWiring wiring(StepKind kind, JsonNode p) {
        var input = p.has(SOURCE) ? optString(p, SOURCE) : optString(p, INPUTS);
        return new StepWiring(optString(p, NAME), input, optString(p, THEMES_FROM));
    }

    private static int intValue(JsonNode p, String key, int defaultValue) {
        var node = p.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw invalid(key, "an integer", node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode p, String key, double defaultValue) {
        var node = p.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            throw invalid(key, "a number", node);
        }
        return node.doubleValue();
    }

    private static boolean booleanValue(JsonNode p, String key, boolean defaultValue) {
        var value = optBoolean(p, key);
        return value != null ? value : defaultValue;
    }

    @Nullable
    private static Boolean optBoolean(JsonNode p, String key) {
        var node = p.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            throw invalid(key, "a boolean", node);
        }
        return node.booleanValue();
    }

    @Nullable
    private static String optString(JsonNode p, String key) {
        var node = p.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw invalid(key, "a string", node);
        }
        return node.textValue();
    }

    @Nullable
    private static List<String> optStrings(JsonNode p, String key) {
        var node = p.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        return strings(node, "option '" + key + "'");
    }

    private static List<String> strings(JsonNode node, String what) {
        if (!node.isArray()) {
            throw new ConfigurationException("%s must be a list of strings, got %s".formatted(what, node));
        }
        var out = new ArrayList<String>(node.size());
        for (var item : node) {
            if (!item.isTextual()) {
                throw new ConfigurationException("%s must be a list of strings, got item %s".formatted(what, item));
            }
            out.add(item.textValue());
        }
        return out;
    }

    private static ConfigurationException invalid(String key, String expected, JsonNode actual) {
        return new ConfigurationException("Option '%s' must be %s, got %s".formatted(key, expected, actual));
    }
}
