package ai.pulse.model;

import ai.pulse.model.exceptions.ConfigurationException;

import java.util.List;

public record Source(String name, List<String> items) {

    public Source {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Source name must not be empty");
        }
        if (items == null) {
            throw new ConfigurationException("Source '%s' has no items".formatted(name));
        }
        try {
            items = List.copyOf(items);
        } catch (NullPointerException e) {
            throw new ConfigurationException("Source '%s' contains null items".formatted(name), e);
        }
    }
}
