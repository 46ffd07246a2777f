package io.schemaxtract.knockout;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemaxtract.core.engine.GraphReader;
import io.schemaxtract.core.engine.JsonNodeUtils;
import io.schemaxtract.core.error.FatalExtractionException;
import io.schemaxtract.core.model.SourceGraph;
import io.schemaxtract.core.spi.GraphAccessor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the root containers of a form composer page inside a page snapshot
 * and assembles them into a {@link SourceGraph}.
 *
 * <p>
 * Expected snapshot layout (every value may be an observable wrapper):
 *
 * <pre>
 * {
 *   "imagetrend": {
 *     "formComposer": { agencyLayouts, formFieldDictionary, agencyResources,
 *                       formHierarchyCollectionId, reportingStandardId },
 *     "logicEngine":  { indexedValidationActions, indexedVisibilityActions }
 *   },
 *   "composer": { "vmObservable": { Resources, FormActions }, ... }
 * }
 * </pre>
 *
 * Lookup rules:
 * <ul>
 * <li>the form composer is {@code imagetrend.formComposer}, falling back to the
 * bound {@code composer} view model;</li>
 * <li>the resource table is {@code vmObservable.Resources}, falling back to
 * {@code formComposer.agencyResources};</li>
 * <li>rich form actions come only from {@code vmObservable.FormActions};</li>
 * <li>legacy actions come from the logic engine.</li>
 * </ul>
 *
 * Containers are passed on still wrapped below their root; the engine must be
 * built with the same {@link GraphAccessor}.
 */
public final class ComposerSnapshotReader {

    private static final Logger LOG = LoggerFactory.getLogger(ComposerSnapshotReader.class);

    private final GraphReader reader;

    /** Creates a reader for Knockout-serialized snapshots. */
    public ComposerSnapshotReader() {
        this(KnockoutGraphAccessor.INSTANCE);
    }

    public ComposerSnapshotReader(GraphAccessor accessor) {
        this.reader = new GraphReader(Objects.requireNonNull(accessor, "accessor must not be null"));
    }

    /**
     * Builds a source graph from a page snapshot.
     *
     * @param snapshot the serialized page state
     * @return the source graph; containers the page does not expose are {@code null}
     * @throws FatalExtractionException if the snapshot is not an object, or the
     *                                  page exposes neither a form composer nor a
     *                                  composer view model
     */
    public SourceGraph read(JsonNode snapshot) {
        JsonNode root = reader.value(snapshot);
        if (!root.isObject()) {
            throw new FatalExtractionException("Page snapshot must be an object, got: " + root.getNodeType());
        }

        JsonNode platform = reader.child(root, "imagetrend");
        JsonNode composer = reader.child(root, "composer");
        JsonNode vmObservable = reader.child(composer, "vmObservable");
        JsonNode formComposer = reader.child(platform, "formComposer");
        if (!JsonNodeUtils.isTruthy(formComposer)) {
            formComposer = composer;
        }
        if (!JsonNodeUtils.isTruthy(formComposer)) {
            throw new FatalExtractionException("Page snapshot exposes no form composer");
        }
        JsonNode logicEngine = reader.child(platform, "logicEngine");

        JsonNode resources = reader.child(vmObservable, "Resources");
        if (!JsonNodeUtils.isTruthy(resources)) {
            resources = reader.child(formComposer, "agencyResources");
        }

        SourceGraph graph = SourceGraph.builder()
                .layouts(orNull(reader.child(formComposer, "agencyLayouts")))
                .fieldDictionary(orNull(reader.child(formComposer, "formFieldDictionary")))
                .resourceTable(orNull(resources))
                .formActions(orNull(reader.child(vmObservable, "FormActions")))
                .validationActions(orNull(reader.child(logicEngine, "indexedValidationActions")))
                .visibilityActions(orNull(reader.child(logicEngine, "indexedVisibilityActions")))
                .formHierarchyCollectionId(reader.text(formComposer, "formHierarchyCollectionId"))
                .reportingStandardId(reader.text(formComposer, "reportingStandardId"))
                .build();

        LOG.debug(
                "snapshot.read formId={} layouts={} dictionary={} resources={} formActions={} legacy={}",
                graph.formHierarchyCollectionId(),
                graph.layouts() != null,
                graph.fieldDictionary() != null,
                graph.resourceTable() != null,
                graph.actions().formActions() != null,
                graph.actions().validationActions() != null || graph.actions().visibilityActions() != null);
        return graph;
    }

    private static JsonNode orNull(JsonNode node) {
        return JsonNodeUtils.isAbsent(node) ? null : node;
    }
}
