package ai.pulse.model.analysis;

import ai.pulse.model.exceptions.ConfigurationException;
import ai.pulse.model.exceptions.RemoteFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

enum AnalysisSupport {
    ;

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static ArrayNode array(Collection<String> items) {
        var node = NODES.arrayNode(items.size());
        items.forEach(node::add);
        return node;
    }

    static Map<String, Object> options(Object... keysAndValues) {
        var options = new TreeMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            options.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(options);
    }

    @Nullable
    static List<String> themesCopy(@Nullable List<String> themes, String kind) {
        if (themes == null) {
            return null;
        }
        if (themes.isEmpty()) {
            throw new ConfigurationException("Static themes of %s must not be empty".formatted(kind));
        }
        return List.copyOf(themes);
    }

    /**
     * Labels and similarity texts of a themes list. A theme is either a plain string or an object with
     * {@code shortLabel} (or {@code label}) and {@code representatives}.
     */
    static List<ThemeText> themeTexts(JsonNode themes) {
        var out = new ArrayList<ThemeText>(themes.size());
        for (var theme : themes) {
            if (theme.isTextual()) {
                out.add(new ThemeText(theme.asText(), theme.asText()));
                continue;
            }
            var label = theme.hasNonNull("shortLabel") ? theme.get("shortLabel").asText()
                : theme.path("label").asText(theme.toString());
            var representatives = theme.get("representatives");
            if (representatives != null && representatives.isArray() && !representatives.isEmpty()) {
                var parts = new ArrayList<String>(representatives.size());
                representatives.forEach(r -> parts.add(r.asText()));
                out.add(new ThemeText(label, String.join(" ", parts)));
            } else {
                out.add(new ThemeText(label, label));
            }
        }
        return out;
    }

    static JsonNode requireArray(JsonNode payload, String field, String kind) {
        var node = payload.isArray() ? payload : payload.get(field);
        if (node == null || !node.isArray()) {
            throw new RemoteFailureException("Response of %s has no '%s' list".formatted(kind, field), null);
        }
        return node;
    }

    record ThemeText(String label, String text) {}
}
