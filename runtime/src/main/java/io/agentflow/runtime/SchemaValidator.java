package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.agentflow.runtime.error.SchemaViolationException;
import io.agentflow.runtime.error.UnknownDefinitionException;
import io.agentflow.runtime.model.FieldDefinition;
import io.agentflow.runtime.model.SchemaDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates agent output against the DSL schemas of a workflow. Each {@link SchemaDefinition} is
 * translated once into a JSON Schema (draft 2020-12) and compiled with the networknt validator.
 *
 * <p>
 * Thread-safe: compiled schemas are cached in a concurrent map.
 */
public final class SchemaValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Map<String, SchemaDefinition> schemas;
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    public SchemaValidator(Map<String, SchemaDefinition> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    /**
     * Validates a value.
     *
     * @param schemaName the schema to validate against
     * @param list       {@code true} if the value must be a list of schema instances
     * @throws SchemaViolationException    if the value does not conform
     * @throws UnknownDefinitionException if the schema is not declared
     */
    public void validate(String schemaName, boolean list, JsonNode value) {
        JsonSchema schema = compiled.computeIfAbsent(
                schemaName + (list ? "[]" : ""), key -> SCHEMA_FACTORY.getSchema(toJsonSchema(schemaName, list)));
        Set<ValidationMessage> errors = schema.validate(value);
        if (!errors.isEmpty()) {
            List<String> violations = new ArrayList<>();
            for (ValidationMessage error : errors) {
                violations.add(error.getMessage());
            }
            violations.sort(null);
            throw new SchemaViolationException(schemaName, violations);
        }
    }

    /** Translates a DSL schema into JSON Schema. Nested schema references are inlined. */
    public JsonNode toJsonSchema(String schemaName, boolean list) {
        ObjectNode root = objectSchema(schemaName, new HashSet<>());
        if (!list) {
            return root;
        }
        ObjectNode array = NODES.objectNode();
        array.put("type", "array");
        array.set("items", root);
        return array;
    }

    private ObjectNode objectSchema(String schemaName, Set<String> visiting) {
        SchemaDefinition definition = schemas.get(schemaName);
        if (definition == null) {
            throw new UnknownDefinitionException("schema", schemaName);
        }
        if (!visiting.add(schemaName)) {
            ObjectNode any = NODES.objectNode();
            any.put("type", "object");
            return any;
        }
        ObjectNode node = NODES.objectNode();
        node.put("type", "object");
        ObjectNode properties = node.putObject("properties");
        ArrayNode required = NODES.arrayNode();
        for (FieldDefinition field : definition.fields()) {
            ObjectNode fieldSchema = fieldSchema(field.type(), visiting);
            if (field.list()) {
                ObjectNode array = NODES.objectNode();
                array.put("type", "array");
                array.set("items", fieldSchema);
                fieldSchema = array;
            }
            properties.set(field.name(), fieldSchema);
            if (!field.optional()) {
                required.add(field.name());
            }
        }
        if (!required.isEmpty()) {
            node.set("required", required);
        }
        visiting.remove(schemaName);
        return node;
    }

    private ObjectNode fieldSchema(String type, Set<String> visiting) {
        ObjectNode node = NODES.objectNode();
        switch (type) {
            case "string" -> node.put("type", "string");
            case "int" -> node.put("type", "integer");
            case "float" -> node.put("type", "number");
            case "bool", "boolean" -> node.put("type", "boolean");
            case "any" -> {
                return node;
            }
            default -> {
                return objectSchema(type, visiting);
            }
        }
        return node;
    }
}
