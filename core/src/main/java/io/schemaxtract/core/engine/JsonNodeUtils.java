package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared JSON node utility methods for reading the loosely typed host graph.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /** Returns {@code true} for {@code null}, {@code NullNode} and {@code MissingNode}. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Determines if a node is truthy in the host script's semantics.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → falsy</li>
     * <li>{@code BooleanNode(false)} → falsy</li>
     * <li>numeric zero and NaN → falsy</li>
     * <li>{@code TextNode("")} → falsy (empty string)</li>
     * <li>Any other value, including empty objects and arrays → truthy</li>
     * </ul>
     *
     * @param node the node to check
     * @return true if the node is truthy
     */
    public static boolean isTruthy(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            return value != 0.0 && !Double.isNaN(value);
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        return true;
    }

    /**
     * Renders a node as text: scalars via {@link JsonNode#asText()}, containers
     * as compact JSON, absent nodes as {@code null}.
     */
    public static String textOrNull(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    /**
     * Reads an integer from a numeric node or a numeric string. Returns
     * {@code null} for anything else, including numbers outside the int range.
     */
    public static Integer intOrNull(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Reads a boolean flag, {@code null} when absent, otherwise host truthiness. */
    public static Boolean booleanOrNull(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        return isTruthy(node);
    }
}
