package io.agentflow.runtime.model;

import java.util.Map;
import java.util.Objects;

/**
 * A tool an agent can call.
 *
 * @param name       declared tool name
 * @param type       {@code mcp}, {@code builtin} or a long-form {@code type} property
 * @param target     server URL for MCP tools, module reference for built-in ones
 * @param properties remaining properties; authentication is stored under {@code auth.type} and
 *                   {@code auth.value}, nested blocks are flattened with dotted keys
 */
public record ToolDefinition(String name, String type, String target, Map<String, String> properties) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
