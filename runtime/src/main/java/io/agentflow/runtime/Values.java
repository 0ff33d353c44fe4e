package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Value operations used by generated workflow code. Every DSL value is a Jackson {@link JsonNode};
 * {@code null} arguments are treated as JSON null.
 *
 * <p>
 * Thread-safe: stateless utility class. Operations never mutate their arguments.
 */
public final class Values {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    /** The JSON null value. */
    public static final JsonNode NULL = NullNode.getInstance();

    private Values() {}

    // ── Construction ──

    public static JsonNode text(String value) {
        return value == null ? NULL : NODES.textNode(value);
    }

    public static JsonNode number(long value) {
        return NODES.numberNode(value);
    }

    public static JsonNode number(double value) {
        return NODES.numberNode(value);
    }

    public static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    public static JsonNode list(JsonNode... items) {
        ArrayNode array = NODES.arrayNode();
        for (JsonNode item : items) {
            array.add(orNull(item));
        }
        return array;
    }

    /**
     * Builds an object from alternating key/value arguments.
     *
     * @param keysAndValues {@code String} keys each followed by a {@link JsonNode} value
     * @throws IllegalArgumentException on an odd argument count or a non-string key
     */
    public static JsonNode object(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("object() requires key/value pairs, got " + keysAndValues.length);
        }
        ObjectNode object = NODES.objectNode();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (!(keysAndValues[i] instanceof String key)) {
                throw new IllegalArgumentException("object key must be a string: " + keysAndValues[i]);
            }
            object.set(key, orNull((JsonNode) keysAndValues[i + 1]));
        }
        return object;
    }

    // ── Predicates ──

    /**
     * Truthiness: null, missing, {@code false}, {@code ""}, zero, and empty lists or objects are
     * falsy; everything else is truthy.
     */
    public static boolean truthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isNumber()) {
            return node.decimalValue().signum() != 0;
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    /** Exact equality; numbers compare by value regardless of representation. */
    public static boolean eq(JsonNode left, JsonNode right) {
        JsonNode a = orNull(left);
        JsonNode b = orNull(right);
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    /**
     * Normalized equality ({@code ~}): compares the display text of both values ignoring case,
     * punctuation and whitespace differences, so {@code "Done."} matches {@code "DONE"}.
     */
    public static boolean normalizedEquals(JsonNode left, JsonNode right) {
        return normalize(display(left)).equals(normalize(display(right)));
    }

    private static String normalize(String text) {
        String lettersOnly = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ");
        return lettersOnly.trim().replaceAll("\\s+", " ");
    }

    /**
     * {@code contains}: substring for text, element membership for lists, key presence for
     * objects.
     */
    public static boolean contains(JsonNode container, JsonNode item) {
        JsonNode haystack = orNull(container);
        if (haystack.isTextual()) {
            return haystack.asText().contains(display(item));
        }
        if (haystack.isArray()) {
            for (JsonNode element : haystack) {
                if (eq(element, item)) {
                    return true;
                }
            }
            return false;
        }
        if (haystack.isObject()) {
            return haystack.has(display(item));
        }
        return false;
    }

    /**
     * Orders two numbers or two strings.
     *
     * @throws IllegalArgumentException if the values are not both numbers or both strings
     */
    public static int compare(JsonNode left, JsonNode right) {
        JsonNode a = orNull(left);
        JsonNode b = orNull(right);
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isTextual() && b.isTextual()) {
            return a.asText().compareTo(b.asText());
        }
        throw new IllegalArgumentException("Cannot compare " + a.getNodeType() + " with " + b.getNodeType());
    }

    // ── Arithmetic ──

    /**
     * {@code +}: numeric sum, list concatenation (a non-list operand is appended as one element)
     * or text concatenation.
     */
    public static JsonNode add(JsonNode left, JsonNode right) {
        JsonNode a = orNull(left);
        JsonNode b = orNull(right);
        if (a.isNumber() && b.isNumber()) {
            return numeric(a.decimalValue().add(b.decimalValue()));
        }
        if (a.isArray() || b.isArray()) {
            ArrayNode result = NODES.arrayNode();
            appendAll(result, a);
            appendAll(result, b);
            return result;
        }
        if (a.isTextual() || b.isTextual()) {
            return text(display(a) + display(b));
        }
        throw new IllegalArgumentException("Cannot add " + a.getNodeType() + " and " + b.getNodeType());
    }

    public static JsonNode subtract(JsonNode left, JsonNode right) {
        return numeric(requireNumber(left, "-").subtract(requireNumber(right, "-")));
    }

    public static JsonNode multiply(JsonNode left, JsonNode right) {
        return numeric(requireNumber(left, "*").multiply(requireNumber(right, "*")));
    }

    /** {@code /}: always a floating point result. */
    public static JsonNode divide(JsonNode left, JsonNode right) {
        BigDecimal divisor = requireNumber(right, "/");
        if (divisor.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return number(requireNumber(left, "/").doubleValue() / divisor.doubleValue());
    }

    public static JsonNode negate(JsonNode value) {
        return numeric(requireNumber(value, "-").negate());
    }

    private static BigDecimal requireNumber(JsonNode node, String operator) {
        JsonNode value = orNull(node);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Operator '" + operator + "' requires numbers, got " + value.getNodeType());
        }
        return value.decimalValue();
    }

    private static JsonNode numeric(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.compareTo(LONG_MIN) >= 0 && stripped.compareTo(LONG_MAX) <= 0) {
            return NODES.numberNode(stripped.longValueExact());
        }
        return NODES.numberNode(value.doubleValue());
    }

    private static void appendAll(ArrayNode target, JsonNode value) {
        if (value.isArray()) {
            target.addAll((ArrayNode) value);
        } else if (!value.isNull()) {
            target.add(value);
        }
    }

    // ── Structure ──

    /** Follows a property path; any missing step yields JSON null. */
    public static JsonNode path(JsonNode root, String... properties) {
        JsonNode current = orNull(root);
        for (String property : properties) {
            JsonNode next = current.get(property);
            if (next == null) {
                return NULL;
            }
            current = next;
        }
        return current;
    }

    /**
     * Returns a copy of {@code root} with {@code value} stored at the property path, creating
     * intermediate objects as needed. A non-object root is replaced by an object.
     */
    public static JsonNode withPath(JsonNode root, JsonNode value, String... properties) {
        if (properties.length == 0) {
            return orNull(value);
        }
        ObjectNode copy = root != null && root.isObject() ? ((ObjectNode) root).deepCopy() : NODES.objectNode();
        ObjectNode current = copy;
        for (int i = 0; i < properties.length - 1; i++) {
            JsonNode child = current.get(properties[i]);
            if (child == null || !child.isObject()) {
                child = NODES.objectNode();
                current.set(properties[i], child);
            }
            current = (ObjectNode) child;
        }
        current.set(properties[properties.length - 1], orNull(value));
        return copy;
    }

    /** {@code push}: returns a copy of the list with the value appended; null starts a new list. */
    public static JsonNode append(JsonNode list, JsonNode value) {
        ArrayNode result = NODES.arrayNode();
        JsonNode existing = orNull(list);
        if (existing.isArray()) {
            result.addAll((ArrayNode) existing);
        } else if (!existing.isNull()) {
            result.add(existing);
        }
        result.add(orNull(value));
        return result;
    }

    /** Elements to iterate in a {@code for} loop: list elements, object values, or the value itself. */
    public static List<JsonNode> iterate(JsonNode value) {
        JsonNode node = orNull(value);
        List<JsonNode> items = new ArrayList<>();
        if (node.isNull()) {
            return items;
        }
        if (node.isContainerNode()) {
            Iterator<JsonNode> elements = node.elements();
            elements.forEachRemaining(items::add);
        } else {
            items.add(node);
        }
        return items;
    }

    /** {@code filter <list> where <condition>}: keeps the elements the predicate accepts. */
    public static JsonNode filter(JsonNode list, Predicate<JsonNode> predicate) {
        ArrayNode result = NODES.arrayNode();
        for (JsonNode item : iterate(list)) {
            if (predicate.test(item)) {
                result.add(item);
            }
        }
        return result;
    }

    /** Display text: raw text for strings, JSON for everything else, empty for null. */
    public static String display(JsonNode value) {
        JsonNode node = orNull(value);
        if (node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    private static JsonNode orNull(JsonNode node) {
        return node == null || node.isMissingNode() ? NULL : node;
    }
}
