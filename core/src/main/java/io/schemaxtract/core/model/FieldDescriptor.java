package io.schemaxtract.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical metadata of one form field, reconciled from the field dictionary
 * and the layout tree.
 *
 * @param id              binding-path entry identifier, unique within a result
 * @param key             dictionary key, or null for layout-only fields
 * @param label           display label
 * @param controlType     control type (layout value wins over dictionary type)
 * @param bindingPath     data binding path, null until resolved from a layout
 * @param layoutPath      position in the layout tree, only for layout-only fields
 * @param required        the control's required flag, or null if unknown
 * @param constraints     layout-sourced constraints, or null for dictionary-only fields
 * @param resourceGroupId bound enumeration id, or null
 * @param possibleValues  enumeration elements resolved for selectable fields
 * @param metadata        layout presentation hints, or null
 * @param origin          dictionary placement, or null for layout-only fields
 */
public record FieldDescriptor(
        String id,
        String key,
        String label,
        String controlType,
        String bindingPath,
        String layoutPath,
        Boolean required,
        FieldConstraints constraints,
        String resourceGroupId,
        List<ResourceElement> possibleValues,
        LayoutMetadata metadata,
        DictionaryOrigin origin) {

    public FieldDescriptor {
        Objects.requireNonNull(id, "field id must not be null");
        possibleValues = possibleValues != null ? List.copyOf(possibleValues) : List.of();
    }

    public boolean hasBindingPath() {
        return bindingPath != null;
    }

    /** Returns {@code true} if the layout classified this field as multi-valued. */
    public boolean isMultiValued() {
        return constraints != null && constraints.isMultiValued();
    }
}
