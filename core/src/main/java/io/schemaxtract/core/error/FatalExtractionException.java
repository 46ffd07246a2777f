package io.schemaxtract.core.error;

import io.schemaxtract.core.model.ExtractionStage;

/**
 * Thrown by {@code ExtractionEngine.extract()} when no root container of the
 * source graph can be established. Every other failure degrades a single stage
 * and is reported as a diagnostic instead.
 */
public final class FatalExtractionException extends SchemaExtractionException {

    private static final long serialVersionUID = 1L;

    public FatalExtractionException(String message) {
        super(message, ExtractionStage.SOURCE);
    }

    public FatalExtractionException(String message, Throwable cause) {
        super(message, cause, ExtractionStage.SOURCE);
    }
}
