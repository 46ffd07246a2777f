package io.schemaxtract.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered enumeration a field may bind to.
 *
 * @param id       group identifier (the key it was registered under)
 * @param name     group name, the key when the host declares none
 * @param elements elements in source order
 */
public record ResourceGroup(String id, String name, List<ResourceElement> elements) {

    public ResourceGroup {
        Objects.requireNonNull(id, "resource group id must not be null");
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    /** Number of elements; the only element data that enters the structural fingerprint. */
    public int elementCount() {
        return elements.size();
    }
}
