package io.agentflow.compiler.ast;

import io.agentflow.compiler.source.SourceSpan;
import java.util.Objects;

/**
 * A name written in the source together with where it was written. Used wherever a declaration
 * or statement refers to another definition or a variable.
 *
 * @param name the name without any {@code $} prefix
 * @param span location of the name, or {@code null} for synthesised references
 */
public record Reference(String name, SourceSpan span) {

    public Reference {
        Objects.requireNonNull(name, "name must not be null");
    }
}
