package io.schemaxtract.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one extraction run. Immutable and created fresh per call; nothing
 * in it references nodes of the source graph.
 *
 * @param formHierarchyCollectionId host form identifier, or null
 * @param reportingStandardId       host reporting standard identifier, or null
 * @param fields                    reconciled fields, in discovery order
 * @param resourceGroups            indexed enumerations, in source order
 * @param rules                     legacy validation and visibility rules
 * @param formActions               decoded form actions per binding path, or null when the host has none
 * @param repeaters                 repeaters found in the layout tree
 * @param operators                 operator profile, or null when there were no form actions
 * @param stats                     summary counts
 * @param diagnostics               notes about degraded stages
 */
public record ExtractionResult(
        String formHierarchyCollectionId,
        String reportingStandardId,
        List<FieldDescriptor> fields,
        List<ResourceGroup> resourceGroups,
        List<Rule> rules,
        Map<String, List<FormAction>> formActions,
        List<Repeater> repeaters,
        OperatorProfile operators,
        ExtractionStats stats,
        List<ExtractionDiagnostic> diagnostics) {

    public ExtractionResult {
        fields = fields != null ? List.copyOf(fields) : List.of();
        resourceGroups = resourceGroups != null ? List.copyOf(resourceGroups) : List.of();
        rules = rules != null ? List.copyOf(rules) : List.of();
        formActions = formActions != null ? copyActions(formActions) : null;
        repeaters = repeaters != null ? List.copyOf(repeaters) : List.of();
        stats = stats != null ? stats : ExtractionStats.EMPTY;
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    /** Looks up a field by id. */
    public Optional<FieldDescriptor> field(String id) {
        return fields.stream().filter(f -> f.id().equals(id)).findFirst();
    }

    /** Looks up a resource group by id. */
    public Optional<ResourceGroup> resourceGroup(String id) {
        return resourceGroups.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    /**
     * Returns {@code true} if a stage met malformed input or failed. Missing
     * optional data alone does not count.
     */
    public boolean isDegraded() {
        return diagnostics.stream().anyMatch(d -> d.kind() != ExtractionDiagnostic.Kind.MISSING_DATA);
    }

    private static Map<String, List<FormAction>> copyActions(Map<String, List<FormAction>> source) {
        Map<String, List<FormAction>> copy = new LinkedHashMap<>();
        source.forEach((path, actions) -> copy.put(path, List.copyOf(actions)));
        return Collections.unmodifiableMap(copy);
    }
}
