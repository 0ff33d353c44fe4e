package io.agentflow.runtime.model;

import java.util.Map;
import java.util.Objects;

/**
 * A named language model declaration ({@code model main = anthropic/claude-sonnet} or the long
 * form with properties).
 *
 * @param name       declared model name
 * @param identifier provider-qualified model identifier, or {@code null} for the long form
 * @param properties long-form properties, values as written
 */
public record ModelDefinition(String name, String identifier, Map<String, String> properties) {

    public ModelDefinition {
        Objects.requireNonNull(name, "name must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    /** The identifier, falling back to the {@code name} property of a long-form declaration. */
    public String resolvedIdentifier() {
        if (identifier != null) {
            return identifier;
        }
        String provider = properties.get("provider");
        String model = properties.get("name");
        if (provider != null && model != null) {
            return provider + "/" + model;
        }
        return model;
    }
}
