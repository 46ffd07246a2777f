package io.schemaxtract.core.model;

/**
 * Left side of a {@link Comparison}, taken from the first term of the left term
 * group only.
 *
 * @param fieldId referenced binding-path entry id, or null
 * @param path    path from the parent list, or null
 * @param literal literal value, or null
 */
public record LeftTerm(String fieldId, String path, String literal) {}
