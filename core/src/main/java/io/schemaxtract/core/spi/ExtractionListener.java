package io.schemaxtract.core.spi;

import io.schemaxtract.core.model.ExtractionDiagnostic;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.ExtractionStats;

/**
 * SPI for observability hooks around extraction runs.
 *
 * <p>
 * Hosts bridge these events to their own telemetry. Exceptions thrown by a
 * listener are caught and logged by the engine; they never affect the
 * extraction result.
 */
public interface ExtractionListener {

    /**
     * Called when a stage degraded because of malformed input or an unexpected
     * failure.
     *
     * @param event contains stage, diagnostic kind and detail
     */
    void onStageFailed(StageFailedEvent event);

    /**
     * Called once per successful {@code extract} call, after the result is
     * assembled.
     *
     * @param event contains stats, diagnostic count and duration
     */
    void onExtractionCompleted(ExtractionCompletedEvent event);

    /** No-op listener. */
    ExtractionListener NONE = new ExtractionListener() {
        @Override
        public void onStageFailed(StageFailedEvent event) {}

        @Override
        public void onExtractionCompleted(ExtractionCompletedEvent event) {}
    };

    // --- Event records ---

    /** Event emitted when a stage degrades. */
    record StageFailedEvent(ExtractionStage stage, ExtractionDiagnostic.Kind kind, String detail) {}

    /** Event emitted when an extraction completes. */
    record ExtractionCompletedEvent(ExtractionStats stats, int diagnosticCount, long durationMs) {}
}
