package ai.pulse.cache;

import ai.pulse.model.Dependency;
import ai.pulse.model.StepKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes step fingerprints. A fingerprint depends on the step kind, its normalized options and the
 * content of each resolved input, tagged with the input role. Step ids, input names and object
 * identities take no part in it, so two steps reading equal data with equal options share one entry.
 */
public final class Fingerprinter {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Fingerprinter() {}

    public static Fingerprint fingerprint(StepKind kind, Map<String, Object> options,
                                          Map<Dependency.Role, JsonNode> inputs)
    {
        var roles = new TreeMap<String, JsonNode>();
        inputs.forEach((role, content) -> roles.put(role.name().toLowerCase(Locale.ROOT), content));

        var inputDigests = new ArrayList<Map<String, String>>(roles.size());
        roles.forEach((role, content) -> {
            var digest = new LinkedHashMap<String, String>();
            digest.put("role", role);
            digest.put("sha256", contentHash(content));
            inputDigests.add(digest);
        });

        var descriptor = new LinkedHashMap<String, Object>();
        descriptor.put("kind", kind.id());
        descriptor.put("options", new TreeMap<>(options));
        descriptor.put("inputs", inputDigests);
        return new Fingerprint(sha256(canonical(descriptor)));
    }

    /**
     * Digest of the canonical JSON form of {@code content}: object keys sorted at every level, no
     * insignificant whitespace.
     */
    public static String contentHash(JsonNode content) {
        return sha256(canonical(CANONICAL.convertValue(content, Object.class)));
    }

    @VisibleForTesting
    static byte[] canonical(Object value) {
        try {
            return CANONICAL.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode fingerprint input: " + e.getMessage(), e);
        }
    }

    private static String sha256(byte[] bytes) {
        return Hashing.sha256().hashBytes(bytes).toString();
    }
}
