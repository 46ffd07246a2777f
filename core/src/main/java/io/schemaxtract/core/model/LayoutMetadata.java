package io.schemaxtract.core.model;

/**
 * Presentation hints copied from the layout control of a field.
 *
 * @param repeating    the control's repeating flag, or null
 * @param collection   the control's collection flag, or null
 * @param displayOrder display order, or null
 * @param columnSpan   column span, or null
 */
public record LayoutMetadata(Boolean repeating, Boolean collection, Integer displayOrder, Integer columnSpan) {}
