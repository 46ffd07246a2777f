package io.schemaxtract.core.engine;

import io.schemaxtract.core.model.DictionaryOrigin;
import io.schemaxtract.core.model.FieldConstraints;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.LayoutMetadata;
import io.schemaxtract.core.model.ResourceElement;
import java.util.List;

/** Mutable field under reconciliation; becomes a {@link FieldDescriptor} once both sources are merged. */
final class FieldDraft {

    final String id;
    String key;
    String label;
    String controlType;
    String bindingPath;
    String layoutPath;
    Boolean required;
    FieldConstraints constraints;
    String resourceGroupId;
    List<ResourceElement> possibleValues = List.of();
    LayoutMetadata metadata;
    DictionaryOrigin origin;

    FieldDraft(String id) {
        this.id = id;
    }

    FieldDescriptor build() {
        return new FieldDescriptor(
                id,
                key,
                label,
                controlType,
                bindingPath,
                layoutPath,
                required,
                constraints,
                resourceGroupId,
                possibleValues,
                metadata,
                origin);
    }
}
