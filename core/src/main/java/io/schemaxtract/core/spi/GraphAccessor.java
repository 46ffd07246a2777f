package io.schemaxtract.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Capability SPI for reading the host's source graph. Implementations know how
 * the host's reactivity framework represents reactive cells in the snapshot and
 * how to obtain a cell's current value; the core engine never depends on a
 * particular framework.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe. {@link #unwrap} should
 * not throw; the engine nevertheless treats any exception escaping it as
 * "absent".
 */
public interface GraphAccessor {

    /**
     * Returns {@code true} if the node is a reactive cell wrapper.
     *
     * @param node any node, may be null
     */
    boolean isCell(JsonNode node);

    /**
     * Returns the current value of a reactive cell, or the node unchanged if it
     * is not a cell. A null input, or a cell without a readable value, yields
     * {@link com.fasterxml.jackson.databind.node.MissingNode}.
     *
     * @param node any node, may be null
     * @return the unwrapped value, never null
     */
    JsonNode unwrap(JsonNode node);

    /**
     * Reads a property of a (possibly wrapped) object and unwraps it. Non-object
     * parents yield {@link MissingNode}.
     */
    default JsonNode child(JsonNode node, String key) {
        JsonNode container = unwrap(node);
        if (container == null || !container.isObject()) {
            return MissingNode.getInstance();
        }
        return unwrap(container.get(key));
    }
}
