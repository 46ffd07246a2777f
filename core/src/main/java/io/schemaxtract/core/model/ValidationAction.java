package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** Form action of type {@code Validation}. */
public record ValidationAction(
        String actionId,
        String name,
        String targetField,
        String errorMessage,
        Integer points,
        RuleExpression expression,
        Map<String, JsonNode> extensions)
        implements FormAction {

    public ValidationAction {
        extensions = ActionExtensions.copyOf(extensions);
    }

    @Override
    public Map<String, JsonNode> extensions() {
        return ActionExtensions.copyOf(extensions);
    }

    @Override
    public String actionType() {
        return ACTION_TYPE_VALIDATION;
    }
}
