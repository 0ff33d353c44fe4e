package io.agentflow.compiler.ast;

import io.agentflow.compiler.source.SourceSpan;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level declarations of a compilation unit.
 *
 * <p>
 * Thread-safe and immutable. Property maps keep declaration order.
 */
public sealed interface Declaration {

    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    /** One method per declaration variant. */
    interface Visitor<R> {

        R visitImport(ImportStmt declaration);

        R visitModel(ModelDef declaration);

        R visitTool(ToolDef declaration);

        R visitSchema(SchemaDef declaration);

        R visitPrompt(PromptDef declaration);

        R visitAgent(AgentDef declaration);

        R visitFlow(FlowDef declaration);

        R visitHandler(HandlerDef declaration);

        R visitPolicy(PolicyDef declaration);

        R visitRetryPolicy(RetryPolicyDef declaration);

        R visitTimeoutPolicy(TimeoutPolicyDef declaration);
    }

    private static Map<String, String> frozen(Map<String, String> properties) {
        return properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * {@code import ./path} or {@code import name from source}.
     *
     * @param path   local path for local imports, {@code null} otherwise
     * @param name   imported name for external imports, {@code null} otherwise
     * @param source source reference for external imports, {@code null} otherwise
     */
    record ImportStmt(String path, String name, String source, SourceSpan span) implements Declaration {
        public ImportStmt {
            if ((path == null) == (name == null)) {
                throw new IllegalArgumentException("import is either local (path) or external (name from source)");
            }
        }

        public boolean isLocal() {
            return path != null;
        }

        /** The import as written, e.g. {@code ./shared.af} or {@code base from agentflow}. */
        public String reference() {
            return isLocal() ? path : name + " from " + source;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /** {@code identifier} is {@code null} for the long form. */
    record ModelDef(String name, String identifier, Map<String, String> properties, SourceSpan span)
            implements Declaration {
        public ModelDef {
            Objects.requireNonNull(name, "name must not be null");
            properties = frozen(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitModel(this);
        }
    }

    record ToolDef(String name, String type, String target, Map<String, String> properties, SourceSpan span)
            implements Declaration {
        public ToolDef {
            Objects.requireNonNull(name, "name must not be null");
            properties = frozen(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTool(this);
        }
    }

    record SchemaDef(String name, List<Field> fields, SourceSpan span) implements Declaration {
        public SchemaDef {
            Objects.requireNonNull(name, "name must not be null");
            fields = List.copyOf(fields);
        }

        /**
         * One {@code name: type} line.
         *
         * @param type base type name, a primitive or another schema
         */
        public record Field(String name, Reference type, boolean list, boolean optional, SourceSpan span) {
            public Field {
                Objects.requireNonNull(name, "name must not be null");
                Objects.requireNonNull(type, "type must not be null");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSchema(this);
        }
    }

    /**
     * A prompt template. Modifiers that were not written are {@code null}.
     *
     * @param model      {@code using model} reference
     * @param schema     {@code expecting} schema, without any {@code []} suffix
     * @param inherit    {@code inherit $var} variable
     * @param escalation {@code escalate if} clause
     */
    record PromptDef(
            String name,
            String body,
            Reference model,
            Reference schema,
            boolean expectsList,
            Reference inherit,
            Escalation escalation,
            SourceSpan span)
            implements Declaration {
        public PromptDef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        /** {@code escalate if <operator> <value>}. */
        public record Escalation(String operator, String value, SourceSpan span) {
            public Escalation {
                Objects.requireNonNull(operator, "operator must not be null");
                Objects.requireNonNull(value, "value must not be null");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrompt(this);
        }
    }

    /**
     * An agent. Absent single-valued properties are {@code null}; absent lists are empty.
     *
     * @param timeoutPolicy  timeout given as a policy name
     * @param timeout        timeout given as a literal duration
     * @param produces       variable that receives the agent's output
     */
    record AgentDef(
            String name,
            Reference instruction,
            Reference prompt,
            Reference model,
            List<Reference> tools,
            List<Reference> delegates,
            List<Reference> uses,
            Reference retryPolicy,
            Reference timeoutPolicy,
            Duration timeout,
            Reference produces,
            String description,
            SourceSpan span)
            implements Declaration {

        /** Name of an agent declared without one ({@code agent:}). */
        public static final String DEFAULT_NAME = "default";

        public AgentDef {
            Objects.requireNonNull(name, "name must not be null");
            tools = List.copyOf(tools);
            delegates = List.copyOf(delegates);
            uses = List.copyOf(uses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAgent(this);
        }
    }

    record FlowDef(String name, List<Reference> parameters, List<Statement> body, SourceSpan span)
            implements Declaration {
        public FlowDef {
            Objects.requireNonNull(name, "name must not be null");
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlow(this);
        }
    }

    /**
     * {@code on|after <event> do ... end}.
     *
     * @param timing {@code on} or {@code after}
     * @param event  event name as written, e.g. {@code tool-call}
     */
    record HandlerDef(String timing, Reference event, List<Statement> body, SourceSpan span) implements Declaration {
        public HandlerDef {
            Objects.requireNonNull(timing, "timing must not be null");
            Objects.requireNonNull(event, "event must not be null");
            body = List.copyOf(body);
        }

        /** Registry key, e.g. {@code on input}. */
        public String key() {
            return timing + " " + event.name();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHandler(this);
        }
    }

    /** Free-form {@code policy name:} block. */
    record PolicyDef(String name, Map<String, String> properties, SourceSpan span) implements Declaration {
        public PolicyDef {
            Objects.requireNonNull(name, "name must not be null");
            properties = frozen(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPolicy(this);
        }
    }

    /** {@code retry name = N times[, strategy backoff]}; {@code backoff} may be {@code null}. */
    record RetryPolicyDef(String name, long times, String backoff, SourceSpan span) implements Declaration {
        public RetryPolicyDef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRetryPolicy(this);
        }
    }

    /** {@code timeout name = <duration>}. */
    record TimeoutPolicyDef(String name, Duration duration, SourceSpan span) implements Declaration {
        public TimeoutPolicyDef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(duration, "duration must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTimeoutPolicy(this);
        }
    }

    /**
     * A written duration such as {@code 30 seconds} or {@code 2 minutes}.
     *
     * @param amount number as written
     * @param unit   unit as written
     */
    record Duration(String amount, String unit, SourceSpan span) {

        private static final Map<String, Long> UNIT_SECONDS = Map.ofEntries(
                Map.entry("s", 1L),
                Map.entry("sec", 1L),
                Map.entry("second", 1L),
                Map.entry("seconds", 1L),
                Map.entry("m", 60L),
                Map.entry("min", 60L),
                Map.entry("minute", 60L),
                Map.entry("minutes", 60L),
                Map.entry("h", 3600L),
                Map.entry("hour", 3600L),
                Map.entry("hours", 3600L));

        public Duration {
            Objects.requireNonNull(amount, "amount must not be null");
            Objects.requireNonNull(unit, "unit must not be null");
        }

        public boolean isKnownUnit() {
            return UNIT_SECONDS.containsKey(unit);
        }

        /**
         * The duration in whole seconds, rounded half up.
         *
         * @throws IllegalStateException if the unit is not a known time unit
         */
        public long seconds() {
            Long factor = UNIT_SECONDS.get(unit);
            if (factor == null) {
                throw new IllegalStateException("Unknown time unit: '" + unit + "'");
            }
            return new BigDecimal(amount)
                    .multiply(BigDecimal.valueOf(factor))
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        }
    }
}
