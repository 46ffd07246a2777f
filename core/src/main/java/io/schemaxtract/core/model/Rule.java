package io.schemaxtract.core.model;

import java.util.Objects;

/**
 * A rule extracted from the legacy validation/visibility action lists.
 * Validation-only and visibility-only components are null for the other kind.
 *
 * @param kind          validation or visibility
 * @param id            action id
 * @param name          action name (validation only)
 * @param targetField   affected binding-path entry id, or field node / form hierarchy id
 * @param errorMessage  error message (validation only)
 * @param points        point value (validation only)
 * @param componentType component type (visibility only)
 * @param expression    normalized condition, or null
 */
public record Rule(
        RuleKind kind,
        String id,
        String name,
        String targetField,
        String errorMessage,
        Integer points,
        String componentType,
        RuleExpression expression) {

    public Rule {
        Objects.requireNonNull(kind, "rule kind must not be null");
    }
}
