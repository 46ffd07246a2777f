package io.schemaxtract.core.model;

/**
 * One selectable value of a {@link ResourceGroup}.
 *
 * @param id    element identifier
 * @param value stored value
 * @param text  display text (falls back to {@code value})
 * @param order sort order within the group (0 when undeclared)
 */
public record ResourceElement(String id, String value, String text, int order) {}
