package io.schemaxtract.core.model;

/** Stages of a single extraction run, in execution order. */
public enum ExtractionStage {
    /** Establishing the root containers of the source graph. */
    SOURCE,
    RESOURCE_GROUPS,
    FIELDS,
    LEGACY_RULES,
    FORM_ACTIONS,
    REPEATERS,
    OPERATORS,
    STATISTICS
}
