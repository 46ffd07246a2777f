package io.schemaxtract.core.engine;

import io.schemaxtract.core.error.FatalExtractionException;
import io.schemaxtract.core.error.MalformedInputException;
import io.schemaxtract.core.model.ActionTable;
import io.schemaxtract.core.model.ExtractionDiagnostic;
import io.schemaxtract.core.model.ExtractionResult;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.ExtractionStats;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.FormAction;
import io.schemaxtract.core.model.OperatorProfile;
import io.schemaxtract.core.model.Repeater;
import io.schemaxtract.core.model.ResourceGroup;
import io.schemaxtract.core.model.Rule;
import io.schemaxtract.core.model.RuleKind;
import io.schemaxtract.core.model.SourceGraph;
import io.schemaxtract.core.model.ValidationAction;
import io.schemaxtract.core.spi.ExtractionListener;
import io.schemaxtract.core.spi.GraphAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the extraction engine. Sequences enumeration indexing, field
 * reconciliation, rule normalization (legacy and rich), repeater discovery,
 * operator analysis and statistics into one {@link ExtractionResult}.
 *
 * <p>
 * Stages are isolated: a stage that meets malformed input or fails
 * unexpectedly leaves an empty (or null) slot, records an
 * {@link ExtractionDiagnostic}, logs a WARN line and notifies the
 * {@link ExtractionListener}; the remaining stages still run. Only a graph in
 * which no root container can be established at all raises
 * {@link FatalExtractionException}.
 *
 * <p>
 * Thread-safe: the engine is immutable and each call keeps its own state. A
 * call is synchronous and reads the source graph without mutating it.
 */
public final class ExtractionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionEngine.class);

    /** MDC key carrying the host form id for the duration of a call. */
    static final String MDC_FORM_ID = "formId";

    private final GraphReader reader;
    private final ExtractionListener listener;
    private final EnumerationResolver enumerationResolver;
    private final FieldReconciler fieldReconciler;
    private final RuleNormalizer ruleNormalizer;
    private final OperatorAnalyzer operatorAnalyzer;

    /** Creates an engine for cell-free snapshots with the default configuration. */
    public ExtractionEngine() {
        this(DirectGraphAccessor.INSTANCE, ExtractionConfig.DEFAULT, ExtractionListener.NONE);
    }

    /**
     * Creates an engine reading through the given accessor, with the default
     * configuration.
     *
     * @param accessor host-specific graph accessor
     */
    public ExtractionEngine(GraphAccessor accessor) {
        this(accessor, ExtractionConfig.DEFAULT, ExtractionListener.NONE);
    }

    /**
     * Creates an engine with all options.
     *
     * @param accessor host-specific graph accessor
     * @param config   traversal limits and control type settings
     * @param listener observability hook, {@code null} for none
     */
    public ExtractionEngine(GraphAccessor accessor, ExtractionConfig config, ExtractionListener listener) {
        this.reader = new GraphReader(Objects.requireNonNull(accessor, "accessor must not be null"));
        this.listener = listener != null ? listener : ExtractionListener.NONE;
        this.enumerationResolver = new EnumerationResolver(reader);
        this.fieldReconciler = new FieldReconciler(reader, config);
        this.ruleNormalizer = new RuleNormalizer(reader, config);
        this.operatorAnalyzer = new OperatorAnalyzer();
    }

    /**
     * Extracts the schema of the given source graph.
     *
     * @param graph the host's source graph
     * @return a freshly built, independently owned result
     * @throws FatalExtractionException if the graph is null or none of its
     *                                  root containers is present
     */
    public ExtractionResult extract(SourceGraph graph) {
        if (graph == null) {
            throw new FatalExtractionException("Source graph must not be null");
        }
        if (graph.formHierarchyCollectionId() != null) {
            MDC.put(MDC_FORM_ID, graph.formHierarchyCollectionId());
        }
        try {
            return extractInternal(graph);
        } finally {
            MDC.remove(MDC_FORM_ID);
        }
    }

    private ExtractionResult extractInternal(SourceGraph graph) {
        long startNanos = System.nanoTime();
        Run run = new Run();
        establishRoots(graph, run);

        ResourceIndex resources = run.stage(
                ExtractionStage.RESOURCE_GROUPS,
                () -> enumerationResolver.index(graph.resourceTable()),
                ResourceIndex.empty());

        FieldSet fieldSet = new FieldSet(resources);
        run.step(ExtractionStage.FIELDS, () -> fieldReconciler.seedFromDictionary(fieldSet, graph.fieldDictionary()));
        run.step(ExtractionStage.FIELDS, () -> fieldReconciler.mergeLayouts(fieldSet, graph.layouts()));
        fieldSet.conflicts()
                .forEach(conflict -> run.degrade(
                        ExtractionStage.FIELDS, ExtractionDiagnostic.Kind.MALFORMED_INPUT, conflict));
        List<FieldDescriptor> fields = run.stage(ExtractionStage.FIELDS, fieldSet::build, List.of());

        ActionTable actions = graph.actions();
        List<Rule> rules = new ArrayList<>();
        rules.addAll(run.stage(
                ExtractionStage.LEGACY_RULES,
                () -> ruleNormalizer.legacyRules(actions.validationActions(), RuleKind.VALIDATION),
                List.of()));
        rules.addAll(run.stage(
                ExtractionStage.LEGACY_RULES,
                () -> ruleNormalizer.legacyRules(actions.visibilityActions(), RuleKind.VISIBILITY),
                List.of()));

        Map<String, List<FormAction>> formActions = run.stage(
                ExtractionStage.FORM_ACTIONS, () -> ruleNormalizer.extractFormActions(actions.formActions()), null);
        List<Repeater> repeaters =
                run.stage(ExtractionStage.REPEATERS, () -> ruleNormalizer.discoverRepeaters(graph.layouts()), List.of());
        OperatorProfile operators =
                run.stage(ExtractionStage.OPERATORS, () -> operatorAnalyzer.analyze(formActions), null);

        List<ResourceGroup> groups = resources.groups();
        ExtractionStats stats = run.stage(
                ExtractionStage.STATISTICS,
                () -> tally(fields, groups, rules, formActions, repeaters, operators),
                ExtractionStats.EMPTY);

        ExtractionResult result = new ExtractionResult(
                graph.formHierarchyCollectionId(),
                graph.reportingStandardId(),
                fields,
                groups,
                rules,
                formActions,
                repeaters,
                operators,
                stats,
                run.diagnostics);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info(
                "extraction.completed fields={} fields_with_binding_path={} resource_groups={} rules={} "
                        + "form_actions={} repeaters={} diagnostics={} duration_ms={}",
                stats.fieldCount(),
                stats.fieldsWithBindingPath(),
                stats.resourceGroupCount(),
                stats.ruleCount(),
                stats.formActionCount(),
                stats.repeaterCount(),
                run.diagnostics.size(),
                durationMs);
        notifyCompleted(stats, run.diagnostics.size(), durationMs);
        return result;
    }

    /**
     * Checks which root containers are present. Absent ones become
     * {@code MISSING_DATA} diagnostics; if all four are absent the extraction
     * cannot start.
     */
    private void establishRoots(SourceGraph graph, Run run) {
        boolean layouts = reader.isPresent(graph.layouts());
        boolean dictionary = reader.isPresent(graph.fieldDictionary());
        boolean resources = reader.isPresent(graph.resourceTable());
        ActionTable actions = graph.actions();
        boolean actionTable = reader.isPresent(actions.formActions())
                || reader.isPresent(actions.validationActions())
                || reader.isPresent(actions.visibilityActions());

        if (!layouts && !dictionary && !resources && !actionTable) {
            throw new FatalExtractionException(
                    "No root container could be established: layouts, field dictionary, resource table and "
                            + "action table are all absent");
        }
        missing(run, layouts, ExtractionStage.FIELDS, "layout collection");
        missing(run, dictionary, ExtractionStage.FIELDS, "field dictionary");
        missing(run, resources, ExtractionStage.RESOURCE_GROUPS, "resource table");
        missing(run, actionTable, ExtractionStage.FORM_ACTIONS, "action table");
    }

    private static void missing(Run run, boolean present, ExtractionStage stage, String container) {
        if (!present) {
            run.diagnostics.add(new ExtractionDiagnostic(
                    stage, ExtractionDiagnostic.Kind.MISSING_DATA, container + " is absent"));
            LOG.debug("Root container absent: {}", container);
        }
    }

    private static ExtractionStats tally(
            List<FieldDescriptor> fields,
            List<ResourceGroup> groups,
            List<Rule> rules,
            Map<String, List<FormAction>> formActions,
            List<Repeater> repeaters,
            OperatorProfile operators) {
        int formActionCount = 0;
        int validationRuleCount = 0;
        if (formActions != null) {
            for (List<FormAction> pathActions : formActions.values()) {
                formActionCount += pathActions.size();
                validationRuleCount += (int) pathActions.stream()
                        .filter(ValidationAction.class::isInstance)
                        .count();
            }
        }
        return new ExtractionStats(
                fields.size(),
                groups.size(),
                rules.size(),
                repeaters.size(),
                (int) fields.stream().filter(FieldDescriptor::hasBindingPath).count(),
                formActionCount,
                validationRuleCount,
                operators != null ? operators.comparison().size() : 0);
    }

    private void notifyStageFailed(ExtractionDiagnostic diagnostic) {
        try {
            listener.onStageFailed(new ExtractionListener.StageFailedEvent(
                    diagnostic.stage(), diagnostic.kind(), diagnostic.detail()));
        } catch (Exception e) {
            LOG.warn("ExtractionListener.onStageFailed failed", e);
        }
    }

    private void notifyCompleted(ExtractionStats stats, int diagnosticCount, long durationMs) {
        try {
            listener.onExtractionCompleted(
                    new ExtractionListener.ExtractionCompletedEvent(stats, diagnosticCount, durationMs));
        } catch (Exception e) {
            LOG.warn("ExtractionListener.onExtractionCompleted failed", e);
        }
    }

    /** Per-call state: the diagnostics collected so far. */
    private final class Run {

        private final List<ExtractionDiagnostic> diagnostics = new ArrayList<>();

        <T> T stage(ExtractionStage stage, Supplier<T> body, T fallback) {
            try {
                return body.get();
            } catch (MalformedInputException e) {
                degrade(stage, ExtractionDiagnostic.Kind.MALFORMED_INPUT, e.getMessage());
                LOG.warn("Stage {} degraded, malformed input: {}", stage, e.getMessage());
                return fallback;
            } catch (RuntimeException e) {
                degrade(stage, ExtractionDiagnostic.Kind.STAGE_FAILURE, e.toString());
                LOG.warn("Stage {} failed, continuing with empty output", stage, e);
                return fallback;
            }
        }

        void step(ExtractionStage stage, Runnable body) {
            stage(
                    stage,
                    () -> {
                        body.run();
                        return null;
                    },
                    null);
        }

        private void degrade(ExtractionStage stage, ExtractionDiagnostic.Kind kind, String detail) {
            ExtractionDiagnostic diagnostic = new ExtractionDiagnostic(stage, kind, detail);
            diagnostics.add(diagnostic);
            notifyStageFailed(diagnostic);
        }
    }
}
