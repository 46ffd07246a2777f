package io.schemaxtract.knockout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.schemaxtract.core.spi.GraphAccessor;

/**
 * {@link GraphAccessor} for snapshots serialized from a Knockout view model.
 *
 * <p>
 * The page-side serializer writes every observable (and computed) as a
 * single-property object {@code {"@observable": <current value>}}. Observables
 * holding other observables serialize as nested wrappers; {@link #unwrap}
 * peels all of them. A wrapper whose value was not serializable carries no
 * value and reads as absent.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class KnockoutGraphAccessor implements GraphAccessor {

    /** Property name of the observable wrapper written by the page-side serializer. */
    public static final String CELL_KEY = "@observable";

    private static final int MAX_NESTED_CELLS = 16;

    public static final KnockoutGraphAccessor INSTANCE = new KnockoutGraphAccessor();

    private KnockoutGraphAccessor() {}

    @Override
    public boolean isCell(JsonNode node) {
        return node != null && node.isObject() && node.size() == 1 && node.has(CELL_KEY);
    }

    @Override
    public JsonNode unwrap(JsonNode node) {
        JsonNode current = node;
        int peeled = 0;
        while (isCell(current)) {
            if (peeled++ == MAX_NESTED_CELLS) {
                return MissingNode.getInstance();
            }
            current = current.get(CELL_KEY);
        }
        return current != null ? current : MissingNode.getInstance();
    }
}
