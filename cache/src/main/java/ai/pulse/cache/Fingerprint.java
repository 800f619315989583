package ai.pulse.cache;

import java.util.Objects;

/**
 * Hex SHA-256 digest identifying a step invocation by content.
 */
public record Fingerprint(String value) {

    public Fingerprint {
        Objects.requireNonNull(value);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Empty fingerprint");
        }
    }

    public String shortValue() {
        return value.length() > 12 ? value.substring(0, 12) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
