package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.schemaxtract.core.spi.GraphAccessor;

/**
 * {@link GraphAccessor} for snapshots that contain no reactive cells: every
 * node is its own value. Used when the host adapter already unwrapped the
 * model while serializing it.
 */
public final class DirectGraphAccessor implements GraphAccessor {

    public static final DirectGraphAccessor INSTANCE = new DirectGraphAccessor();

    private DirectGraphAccessor() {}

    @Override
    public boolean isCell(JsonNode node) {
        return false;
    }

    @Override
    public JsonNode unwrap(JsonNode node) {
        return node != null ? node : MissingNode.getInstance();
    }
}
