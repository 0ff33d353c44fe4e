package io.agentflow.compiler.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or a value that is
 * malformed or out of range. The message names the offending file or key.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
