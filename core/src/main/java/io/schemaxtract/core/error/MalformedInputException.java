package io.schemaxtract.core.error;

import io.schemaxtract.core.model.ExtractionStage;

/**
 * Thrown inside a stage when a root container is present but does not have the
 * expected shape (e.g. a field dictionary that is not a list). Caught by the
 * orchestrator, which degrades the stage output and records a diagnostic.
 */
public final class MalformedInputException extends SchemaExtractionException {

    private static final long serialVersionUID = 1L;

    public MalformedInputException(String message, ExtractionStage stage) {
        super(message, stage);
    }
}
