package io.schemaxtract.core.error;

/** Thrown when an extraction configuration document is unreadable or holds invalid values. */
public final class ExtractionConfigException extends SchemaExtractionException {

    private static final long serialVersionUID = 1L;

    public ExtractionConfigException(String message) {
        super(message, null);
    }

    public ExtractionConfigException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
