package ai.pulse.model.analysis;

import ai.pulse.model.exceptions.RemoteFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Iterator;

/**
 * Flattening of arbitrarily nested lists and rebuilding of the same nesting from flat answers.
 */
public enum NestedItems {
    ;

    public static boolean isNested(JsonNode items) {
        for (var item : items) {
            if (item.isArray()) {
                return true;
            }
        }
        return false;
    }

    public static ArrayNode flatten(JsonNode items) {
        var out = AnalysisSupport.NODES.arrayNode();
        collect(items, out);
        return out;
    }

    /**
     * Lays out {@code flat} values with the nesting of {@code template}. Both must hold the same number
     * of leaves.
     */
    public static ArrayNode reshape(JsonNode template, JsonNode flat) {
        var leaves = flat.elements();
        var out = rebuild(template, leaves);
        if (leaves.hasNext()) {
            throw new RemoteFailureException("Got more answers than inputs: %d answers for %d inputs"
                .formatted(flat.size(), flatten(template).size()), null);
        }
        return out;
    }

    private static void collect(JsonNode node, ArrayNode out) {
        for (var item : node) {
            if (item.isArray()) {
                collect(item, out);
            } else {
                out.add(item);
            }
        }
    }

    private static ArrayNode rebuild(JsonNode template, Iterator<JsonNode> leaves) {
        var out = AnalysisSupport.NODES.arrayNode(template.size());
        for (var item : template) {
            if (item.isArray()) {
                out.add(rebuild(item, leaves));
            } else if (leaves.hasNext()) {
                out.add(leaves.next());
            } else {
                throw new RemoteFailureException("Got fewer answers than inputs", null);
            }
        }
        return out;
    }
}
