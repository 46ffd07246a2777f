package io.schemaxtract.core.model;

import java.util.Objects;

/**
 * Internal note recorded when a stage degraded.
 *
 * @param stage  the stage concerned
 * @param kind   what went wrong
 * @param detail human-readable description
 */
public record ExtractionDiagnostic(ExtractionStage stage, Kind kind, String detail) {

    /** Diagnostic categories. */
    public enum Kind {
        /** An optional source piece is absent; output degraded to empty or null. */
        MISSING_DATA,
        /** A root container is present but has an unexpected shape. */
        MALFORMED_INPUT,
        /** The stage failed unexpectedly; its slot was filled with an empty value. */
        STAGE_FAILURE
    }

    public ExtractionDiagnostic {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
