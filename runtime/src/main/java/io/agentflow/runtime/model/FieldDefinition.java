package io.agentflow.runtime.model;

import java.util.Objects;

/**
 * One field of a {@link SchemaDefinition}.
 *
 * @param name     field name
 * @param type     base type: {@code string}, {@code int}, {@code float}, {@code bool} or another schema
 * @param list     {@code true} for {@code list[type]}
 * @param optional {@code true} for {@code type?}
 */
public record FieldDefinition(String name, String type, boolean list, boolean optional) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
