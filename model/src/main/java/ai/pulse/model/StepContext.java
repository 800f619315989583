package ai.pulse.model;

import ai.pulse.model.remote.AnalysisTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a step sees while it runs: its resolved inputs and the remote API.
 */
public interface StepContext {

    String stepId();

    /**
     * Resolved texts input. Items are usually strings but may be nested lists when the input is
     * another step's output.
     */
    ArrayNode texts();

    /**
     * Resolved themes input, empty when the step is not wired to a themes provider.
     */
    Optional<ArrayNode> themes();

    boolean fastDefault();

    AnalysisTransport transport();

    /**
     * Result of a dependency of this step, by the dependency's name.
     */
    Optional<StepResult> dependencyResult(String name);

    default List<String> textList() {
        var out = new ArrayList<String>(texts().size());
        for (JsonNode item : texts()) {
            out.add(item.isTextual() ? item.asText() : item.toString());
        }
        return out;
    }
}
