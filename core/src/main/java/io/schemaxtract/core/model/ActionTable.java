package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The action root container of a {@link SourceGraph}. Rules live in two
 * independently maintained places in the host model: a per-path map of rich
 * form actions and the older flat validation/visibility action lists.
 *
 * <p>
 * Any component may be {@code null} (absent). Nodes may still be wrapped in
 * reactive cells; they are unwrapped through the engine's
 * {@link io.schemaxtract.core.spi.GraphAccessor}.
 *
 * @param formActions       map of binding path to list of form actions
 * @param validationActions legacy list of validation actions
 * @param visibilityActions legacy list of visibility actions
 */
public record ActionTable(JsonNode formActions, JsonNode validationActions, JsonNode visibilityActions) {

    /** An action table with every component absent. */
    public static final ActionTable EMPTY = new ActionTable(null, null, null);
}
