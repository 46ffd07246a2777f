package io.schemaxtract.core.engine;

import io.schemaxtract.core.model.ResourceGroup;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup structure over the two-level resource table, built by
 * {@link EnumerationResolver#index}.
 *
 * <p>
 * {@link #groups()} lists the registered enumerations (entries that carry an
 * element list). {@link #lookup} is wider: it matches any object entry at the
 * top level first, then scans the nested containers in source order and
 * returns the first match.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class ResourceIndex {

    private static final ResourceIndex EMPTY = new ResourceIndex(List.of(), Map.of(), List.of());

    private final List<ResourceGroup> groups;
    private final Map<String, ResourceGroup> topLevel;
    private final List<Map<String, ResourceGroup>> containers;

    ResourceIndex(
            List<ResourceGroup> groups,
            Map<String, ResourceGroup> topLevel,
            List<Map<String, ResourceGroup>> containers) {
        this.groups = List.copyOf(groups);
        this.topLevel = Collections.unmodifiableMap(new LinkedHashMap<>(topLevel));
        this.containers = containers.stream()
                .map(c -> Collections.unmodifiableMap(new LinkedHashMap<>(c)))
                .toList();
    }

    /** An index over an absent resource table. */
    public static ResourceIndex empty() {
        return EMPTY;
    }

    /** Registered enumerations in source order. */
    public List<ResourceGroup> groups() {
        return groups;
    }

    /**
     * Resolves a resource id: direct top-level match first, otherwise the first
     * nested container holding the id.
     *
     * @param id resource id, may be null
     * @return the matching group, empty when unknown
     */
    public Optional<ResourceGroup> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        ResourceGroup direct = topLevel.get(id);
        if (direct != null) {
            return Optional.of(direct);
        }
        for (Map<String, ResourceGroup> container : containers) {
            ResourceGroup nested = container.get(id);
            if (nested != null) {
                return Optional.of(nested);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return groups.isEmpty() && topLevel.isEmpty();
    }

    public int size() {
        return groups.size();
    }
}
