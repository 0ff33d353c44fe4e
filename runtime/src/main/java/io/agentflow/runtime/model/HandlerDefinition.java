package io.agentflow.runtime.model;

import java.util.Objects;

/**
 * An event handler registration.
 *
 * @param timing {@code on} or {@code after}
 * @param event  {@code start}, {@code input}, {@code output}, {@code tool-call} or {@code tool-result}
 */
public record HandlerDefinition(String timing, String event) {

    public HandlerDefinition {
        Objects.requireNonNull(timing, "timing must not be null");
        Objects.requireNonNull(event, "event must not be null");
    }

    /** Registry key, e.g. {@code on input}. */
    public String key() {
        return timing + " " + event;
    }
}
