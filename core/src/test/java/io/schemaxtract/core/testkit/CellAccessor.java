package io.schemaxtract.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.schemaxtract.core.spi.GraphAccessor;

/**
 * Test accessor: a cell is an object whose only property is {@code $value}.
 * A cell holding the text {@code "$boom"} makes {@link #unwrap} throw, to
 * exercise the engine's handling of misbehaving accessors.
 */
public final class CellAccessor implements GraphAccessor {

    public static final String CELL_KEY = "$value";
    public static final String EXPLODING = "$boom";

    @Override
    public boolean isCell(JsonNode node) {
        return node != null && node.isObject() && node.size() == 1 && node.has(CELL_KEY);
    }

    @Override
    public JsonNode unwrap(JsonNode node) {
        if (!isCell(node)) {
            return node != null ? node : MissingNode.getInstance();
        }
        JsonNode value = node.get(CELL_KEY);
        if (value.isTextual() && EXPLODING.equals(value.asText())) {
            throw new IllegalStateException("cell read failed");
        }
        return unwrap(value);
    }
}
