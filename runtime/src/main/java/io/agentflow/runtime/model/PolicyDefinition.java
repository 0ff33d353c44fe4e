package io.agentflow.runtime.model;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A named policy. Retry defaults carry {@code times} and {@code backoff}, timeout defaults carry
 * {@code seconds}; free-form {@code policy} blocks keep their properties as written.
 */
public record PolicyDefinition(String name, Kind kind, Map<String, String> properties) {

    /** Policy category. */
    public enum Kind {
        RETRY,
        TIMEOUT,
        GENERIC
    }

    public PolicyDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    /** Registry key, e.g. {@code retry default}. Retry and timeout policies may share a name. */
    public String key() {
        return key(kind, name);
    }

    public static String key(Kind kind, String name) {
        return kind.name().toLowerCase(Locale.ROOT) + " " + name;
    }
}
