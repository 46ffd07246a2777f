package io.schemaxtract.core.model;

/**
 * Layout-sourced constraints of a field. Scalar bounds are kept as their
 * textual rendering because the host stores them as strings or numbers
 * interchangeably.
 *
 * @param minLength    minimum text length, or null
 * @param maxLength    maximum text length, or null
 * @param min          minimum value, or null
 * @param max          maximum value, or null
 * @param pattern      validation pattern, or null
 * @param mask         input mask, or null
 * @param defaultValue default value, or null
 * @param minOccurs    1 when the control is required, otherwise 0
 * @param maxOccurs    -1 for multi-valued fields, otherwise 1
 * @param nillable     whether the field has a "no data" node
 */
public record FieldConstraints(
        Integer minLength,
        Integer maxLength,
        String min,
        String max,
        String pattern,
        String mask,
        String defaultValue,
        int minOccurs,
        int maxOccurs,
        boolean nillable) {

    /** Marker value of {@link #maxOccurs()} for unbounded (multi-valued) fields. */
    public static final int UNBOUNDED = -1;

    public boolean isMultiValued() {
        return maxOccurs == UNBOUNDED;
    }
}
