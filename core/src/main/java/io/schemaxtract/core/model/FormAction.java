package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * A rich form action, decoded into one of the known variants. Properties the
 * decoder does not recognize are kept verbatim in {@link #extensions()} so new
 * upstream properties survive extraction.
 */
public sealed interface FormAction permits ValidationAction, VisibilityAction, GenericAction {

    String ACTION_TYPE_VALIDATION = "Validation";
    String ACTION_TYPE_VISIBILITY = "Visibility";

    String actionId();

    /** The host's {@code ActionType} tag, or null when the action declares none. */
    String actionType();

    String name();

    /** Normalized condition, or null when the action has no expression group. */
    RuleExpression expression();

    /**
     * Unrecognized properties with reactive cells unwrapped. Each call returns
     * a fresh deep copy, so changing it never affects the action.
     */
    Map<String, JsonNode> extensions();
}
