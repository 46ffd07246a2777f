package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Copy helpers for {@link FormAction#extensions()}; JSON nodes are mutable, so values never leave shared. */
final class ActionExtensions {

    private ActionExtensions() {}

    /** Unmodifiable deep copy, preserving property order. Null becomes empty. */
    static Map<String, JsonNode> copyOf(Map<String, JsonNode> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return Map.of();
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        extensions.forEach((key, value) -> copy.put(key, value != null ? value.deepCopy() : null));
        return Collections.unmodifiableMap(copy);
    }
}
