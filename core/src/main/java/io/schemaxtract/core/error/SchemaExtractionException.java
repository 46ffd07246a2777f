package io.schemaxtract.core.error;

import io.schemaxtract.core.model.ExtractionStage;

/**
 * Abstract base for all schema-xtract exceptions. Never thrown directly; use
 * {@link FatalExtractionException}, {@link MalformedInputException} or
 * {@link ExtractionConfigException}.
 */
public abstract class SchemaExtractionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ExtractionStage stage;

    protected SchemaExtractionException(String message, ExtractionStage stage) {
        super(message);
        this.stage = stage;
    }

    protected SchemaExtractionException(String message, Throwable cause, ExtractionStage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** The stage that raised the error, or {@code null} if it is not stage-specific. */
    public ExtractionStage stage() {
        return stage;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
