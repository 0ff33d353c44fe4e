package io.agentflow.compiler.semantic;

import java.util.List;
import java.util.Set;

/** Names the language predefines. */
public final class Builtins {

    /** Variables visible everywhere. */
    public static final List<String> GLOBAL_VARIABLES =
            List.of("input_prompt", "conversation", "current_agent", "session_id", "turn_count");

    /** Variables predefined inside every event handler. */
    public static final List<String> HANDLER_VARIABLES =
            List.of("input", "output", "message", "tool_call", "tool_result");

    public static final List<String> GUARDRAILS = List.of("pii", "jailbreak");

    public static final List<String> EVENTS = List.of("start", "input", "output", "tool-call", "tool-result");

    /** Events whose handlers may use {@code mask}, {@code block} and {@code warn}. */
    public static final Set<String> GUARDED_EVENTS = Set.of("input", "output", "tool-call", "tool-result");

    /** Events whose handlers may use {@code retry with}. */
    public static final Set<String> RETRYABLE_EVENTS = Set.of("output", "tool-result");

    public static final Set<String> PRIMITIVE_TYPES = Set.of("string", "int", "float", "bool", "boolean", "any");

    private Builtins() {}

    public static boolean isGuardrail(String name) {
        return GUARDRAILS.contains(name);
    }
}
