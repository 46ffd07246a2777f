package io.schemaxtract.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only view of the host's form model, supplied wholesale by the host
 * integration layer. The engine never mutates any node reachable from here.
 *
 * <p>
 * Four root containers: the layout collection (a single layout object or a
 * list of layouts), the field dictionary (a list), the resource table (the
 * two-level enumeration lookup) and the {@link ActionTable}. Each may be
 * {@code null} when the host does not expose it.
 *
 * @param layouts                   layout collection root
 * @param fieldDictionary           field dictionary root
 * @param resourceTable             resource (enumeration) table root
 * @param actions                   action root container, never null
 * @param formHierarchyCollectionId host form identifier, may be null
 * @param reportingStandardId       host reporting standard identifier, may be null
 */
public record SourceGraph(
        JsonNode layouts,
        JsonNode fieldDictionary,
        JsonNode resourceTable,
        ActionTable actions,
        String formHierarchyCollectionId,
        String reportingStandardId) {

    public SourceGraph {
        actions = actions != null ? actions : ActionTable.EMPTY;
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for source graphs assembled piece by piece by a host adapter. */
    public static final class Builder {

        private JsonNode layouts;
        private JsonNode fieldDictionary;
        private JsonNode resourceTable;
        private JsonNode formActions;
        private JsonNode validationActions;
        private JsonNode visibilityActions;
        private String formHierarchyCollectionId;
        private String reportingStandardId;

        private Builder() {}

        public Builder layouts(JsonNode layouts) {
            this.layouts = layouts;
            return this;
        }

        public Builder fieldDictionary(JsonNode fieldDictionary) {
            this.fieldDictionary = fieldDictionary;
            return this;
        }

        public Builder resourceTable(JsonNode resourceTable) {
            this.resourceTable = resourceTable;
            return this;
        }

        public Builder formActions(JsonNode formActions) {
            this.formActions = formActions;
            return this;
        }

        public Builder validationActions(JsonNode validationActions) {
            this.validationActions = validationActions;
            return this;
        }

        public Builder visibilityActions(JsonNode visibilityActions) {
            this.visibilityActions = visibilityActions;
            return this;
        }

        public Builder formHierarchyCollectionId(String formHierarchyCollectionId) {
            this.formHierarchyCollectionId = formHierarchyCollectionId;
            return this;
        }

        public Builder reportingStandardId(String reportingStandardId) {
            this.reportingStandardId = reportingStandardId;
            return this;
        }

        public SourceGraph build() {
            return new SourceGraph(
                    layouts,
                    fieldDictionary,
                    resourceTable,
                    new ActionTable(formActions, validationActions, visibilityActions),
                    formHierarchyCollectionId,
                    reportingStandardId);
        }
    }
}
