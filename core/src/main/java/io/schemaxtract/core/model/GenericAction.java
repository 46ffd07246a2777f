package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** Form action of any other (or missing) type. */
public record GenericAction(
        String actionId, String actionType, String name, RuleExpression expression, Map<String, JsonNode> extensions)
        implements FormAction {

    public GenericAction {
        extensions = ActionExtensions.copyOf(extensions);
    }

    @Override
    public Map<String, JsonNode> extensions() {
        return ActionExtensions.copyOf(extensions);
    }
}
