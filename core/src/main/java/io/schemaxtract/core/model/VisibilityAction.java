package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Form action of type {@code Visibility}. The host addresses the affected
 * element either by field node id or by form hierarchy id.
 */
public record VisibilityAction(
        String actionId,
        String name,
        String fieldNodeId,
        String affectedFormHierarchyId,
        String componentType,
        RuleExpression expression,
        Map<String, JsonNode> extensions)
        implements FormAction {

    public VisibilityAction {
        extensions = ActionExtensions.copyOf(extensions);
    }

    @Override
    public Map<String, JsonNode> extensions() {
        return ActionExtensions.copyOf(extensions);
    }

    @Override
    public String actionType() {
        return ACTION_TYPE_VISIBILITY;
    }

    /** The field node id when present, otherwise the form hierarchy id. */
    public String targetField() {
        return fieldNodeId != null && !fieldNodeId.isEmpty() ? fieldNodeId : affectedFormHierarchyId;
    }
}
