package io.schemaxtract.core.engine;

import io.schemaxtract.core.model.FieldDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call working set of {@link FieldReconciler}: drafts keyed by field id
 * plus the resource index used for enumeration lookups. Not thread-safe; one
 * instance per extraction.
 */
final class FieldSet {

    private final Map<String, FieldDraft> drafts = new LinkedHashMap<>();
    private final ResourceIndex resources;
    private final List<String> conflicts = new ArrayList<>();
    private int truncatedBranches;

    FieldSet(ResourceIndex resources) {
        this.resources = Objects.requireNonNull(resources, "resources must not be null");
    }

    ResourceIndex resources() {
        return resources;
    }

    FieldDraft get(String id) {
        return drafts.get(id);
    }

    /** Adds a fresh draft, replacing any earlier draft with the same id. */
    FieldDraft replace(String id) {
        FieldDraft draft = new FieldDraft(id);
        drafts.put(id, draft);
        return draft;
    }

    void recordTruncation() {
        truncatedBranches++;
    }

    int truncatedBranches() {
        return truncatedBranches;
    }

    void recordConflict(String detail) {
        conflicts.add(detail);
    }

    /** Layout conflicts found so far, in discovery order. */
    List<String> conflicts() {
        return List.copyOf(conflicts);
    }

    int size() {
        return drafts.size();
    }

    List<FieldDescriptor> build() {
        return drafts.values().stream().map(FieldDraft::build).toList();
    }
}
