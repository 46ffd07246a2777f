package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaxtract.core.spi.GraphAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cell-aware reads over the source graph. Every read goes through the
 * configured {@link GraphAccessor}; a failing accessor yields
 * {@link MissingNode}, which all callers treat as "absent".
 *
 * <p>
 * Fallback reads ({@link #first}, {@link #firstText}) follow the host script's
 * {@code a || b} semantics: the first truthy candidate wins.
 *
 * <p>
 * Thread-safe if the accessor is.
 */
public final class GraphReader {

    private static final Logger LOG = LoggerFactory.getLogger(GraphReader.class);

    private final GraphAccessor accessor;

    public GraphReader(GraphAccessor accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
    }

    /** Returns the node's current value; never null, never throws. */
    public JsonNode value(JsonNode node) {
        if (node == null) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode value = accessor.unwrap(node);
            return value != null ? value : MissingNode.getInstance();
        } catch (RuntimeException e) {
            LOG.debug("Cell unwrap failed, treating value as absent: {}", e.toString());
            return MissingNode.getInstance();
        }
    }

    /** Reads and unwraps a property of an object node; absent for non-objects. */
    public JsonNode child(JsonNode parent, String key) {
        JsonNode container = value(parent);
        if (!container.isObject()) {
            return MissingNode.getInstance();
        }
        return value(container.get(key));
    }

    /** Returns the first truthy property among {@code keys}, or the last one read. */
    public JsonNode first(JsonNode parent, String... keys) {
        JsonNode result = MissingNode.getInstance();
        for (String key : keys) {
            result = child(parent, key);
            if (JsonNodeUtils.isTruthy(result)) {
                return result;
            }
        }
        return result;
    }

    public String text(JsonNode parent, String key) {
        return JsonNodeUtils.textOrNull(child(parent, key));
    }

    public String firstText(JsonNode parent, String... keys) {
        return JsonNodeUtils.textOrNull(first(parent, keys));
    }

    public Integer integer(JsonNode parent, String key) {
        return JsonNodeUtils.intOrNull(child(parent, key));
    }

    public Boolean flag(JsonNode parent, String key) {
        return JsonNodeUtils.booleanOrNull(child(parent, key));
    }

    public boolean truthy(JsonNode parent, String key) {
        return JsonNodeUtils.isTruthy(child(parent, key));
    }

    /** Returns {@code true} if the node's value is neither absent nor JSON null. */
    public boolean isPresent(JsonNode node) {
        return !JsonNodeUtils.isAbsent(value(node));
    }

    /**
     * Unwraps a node and returns its elements, each unwrapped, when it is a list.
     * Anything else yields an empty list.
     */
    public List<JsonNode> elements(JsonNode node) {
        JsonNode list = value(node);
        if (!list.isArray()) {
            return List.of();
        }
        List<JsonNode> result = new ArrayList<>(list.size());
        for (JsonNode element : list) {
            result.add(value(element));
        }
        return result;
    }

    /** Shorthand for {@code elements(child(parent, key))}. */
    public List<JsonNode> elements(JsonNode parent, String key) {
        return elements(child(parent, key));
    }

    /**
     * Returns the properties of an object node in source order, values
     * unwrapped. Anything else yields an empty list.
     */
    public List<Map.Entry<String, JsonNode>> properties(JsonNode node) {
        JsonNode object = value(node);
        if (!object.isObject()) {
            return List.of();
        }
        List<Map.Entry<String, JsonNode>> result = new ArrayList<>(object.size());
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.add(Map.entry(field.getKey(), value(field.getValue())));
        }
        return result;
    }

    /**
     * Returns a detached deep copy of a node with every reactive cell unwrapped.
     * Levels below the guard's ceiling are replaced by JSON null, so cyclic
     * input still terminates.
     *
     * @param node  node to copy, may be null
     * @param guard depth ceiling for the copy
     * @return the copy; {@link MissingNode} when the node is absent
     */
    public JsonNode detach(JsonNode node, DepthGuard guard) {
        return detach(node, guard, 0);
    }

    private JsonNode detach(JsonNode node, DepthGuard guard, int depth) {
        JsonNode value = value(node);
        if (value.isMissingNode()) {
            return value;
        }
        if (!guard.permits(depth)) {
            return NullNode.getInstance();
        }
        if (value.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            for (Map.Entry<String, JsonNode> property : properties(value)) {
                JsonNode child = detach(property.getValue(), guard, depth + 1);
                if (!child.isMissingNode()) {
                    copy.set(property.getKey(), child);
                }
            }
            return copy;
        }
        if (value.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(value.size());
            for (JsonNode element : value) {
                JsonNode child = detach(element, guard, depth + 1);
                copy.add(child.isMissingNode() ? NullNode.getInstance() : child);
            }
            return copy;
        }
        return value.deepCopy();
    }
}
