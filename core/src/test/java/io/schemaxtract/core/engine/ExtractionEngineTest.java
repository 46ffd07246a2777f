package io.schemaxtract.core.engine;

import static io.schemaxtract.core.testkit.SourceGraphs.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaxtract.core.error.FatalExtractionException;
import io.schemaxtract.core.model.ExtractionDiagnostic;
import io.schemaxtract.core.model.ExtractionResult;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.ExtractionStats;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.GenericAction;
import io.schemaxtract.core.model.ResourceElement;
import io.schemaxtract.core.model.ResourceGroup;
import io.schemaxtract.core.model.RuleKind;
import io.schemaxtract.core.model.SourceGraph;
import io.schemaxtract.core.model.ValidationAction;
import io.schemaxtract.core.model.VisibilityAction;
import io.schemaxtract.core.spi.ExtractionListener;
import io.schemaxtract.core.testkit.CellAccessor;
import io.schemaxtract.core.testkit.SourceGraphs;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

@DisplayName("ExtractionEngine")
class ExtractionEngineTest {

    private final ExtractionEngine engine = new ExtractionEngine();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;

    @BeforeEach
    void attachAppender() {
        engineLogger = (Logger) LoggerFactory.getLogger(ExtractionEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> logs(Level level, String fragment) {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == level)
                .filter(e -> e.getFormattedMessage().contains(fragment))
                .toList();
    }

    @Test
    @DisplayName("Single select field resolves its enumeration from a direct resource group")
    void singleSelectScenario() {
        ExtractionResult result = engine.extract(SourceGraphs.fixture("fixtures/single-select.yaml"));

        assertThat(result.fields()).singleElement().satisfies(field -> {
            assertThat(field.id()).isEqualTo("F1");
            assertThat(field.resourceGroupId()).isEqualTo("F1");
            assertThat(field.possibleValues())
                    .containsExactly(new ResourceElement("1", "Y", "Y", 0), new ResourceElement("2", "N", "N", 1));
        });
        assertThat(result.resourceGroups()).extracting(ResourceGroup::id).containsExactly("F1");
        assertThat(result.isDegraded()).isFalse();
    }

    @Nested
    @DisplayName("Complete form")
    class CompleteForm {

        private final ExtractionResult result =
                engine.extract(SourceGraphs.fixture("fixtures/incident-form.yaml"));

        @Test
        @DisplayName("Fields from dictionary and layout are reconciled")
        void fields() {
            assertThat(result.fields())
                    .extracting(FieldDescriptor::id)
                    .containsExactly("F-GENDER", "F-NAME", "F-MEDS", "F-SMOKER", "F-DOSE");

            FieldDescriptor gender = result.field("F-GENDER").orElseThrow();
            assertThat(gender.label()).isEqualTo("Patient Gender");
            assertThat(gender.bindingPath()).isEqualTo("patient.gender");
            assertThat(gender.possibleValues()).extracting(ResourceElement::text).containsExactly("Male (M)", "Female");

            FieldDescriptor name = result.field("F-NAME").orElseThrow();
            assertThat(name.required()).isTrue();
            assertThat(name.constraints().minOccurs()).isEqualTo(1);
            assertThat(name.constraints().maxOccurs()).isEqualTo(1);
            assertThat(name.constraints().maxLength()).isEqualTo(60);
            assertThat(name.metadata().displayOrder()).isEqualTo(1);

            assertThat(result.field("F-MEDS").orElseThrow().isMultiValued()).isTrue();
            assertThat(result.field("F-SMOKER").orElseThrow().resourceGroupId()).isEqualTo("YESNO");
            assertThat(result.field("F-DOSE").orElseThrow().layoutPath())
                    .isEqualTo("Form[0]/Panel[Patient]/MedsRepeater/Dose");
        }

        @Test
        @DisplayName("Resource groups keep source order and the first element's group name")
        void resourceGroups() {
            assertThat(result.resourceGroups()).extracting(ResourceGroup::id).containsExactly("F-GENDER", "YESNO");
            assertThat(result.resourceGroup("F-GENDER").orElseThrow().name()).isEqualTo("Gender");
        }

        @Test
        @DisplayName("Legacy rules, form actions, repeaters and operators are extracted")
        void rulesAndActions() {
            assertThat(result.rules()).extracting(r -> r.kind()).containsExactly(RuleKind.VALIDATION, RuleKind.VISIBILITY);
            assertThat(result.rules().get(1).targetField()).isEqualTo("FH-9");

            assertThat(result.formActions()).containsOnlyKeys("patient.name", "patient.gender");
            assertThat(result.formActions().get("patient.name").get(0)).isInstanceOfSatisfying(
                    ValidationAction.class, v -> {
                        assertThat(v.extensions()).containsOnlyKeys("Severity");
                        assertThat(v.expression().comparisons().get(0).leftTerm().fieldId()).isEqualTo("F-NAME");
                        assertThat(v.expression().childGroups()).hasSize(1);
                    });
            assertThat(result.formActions().get("patient.gender"))
                    .hasExactlyElementsOfTypes(VisibilityAction.class, GenericAction.class);

            assertThat(result.repeaters()).singleElement().satisfies(r -> {
                assertThat(r.id()).isEqualTo("R1");
                assertThat(r.path()).isEqualTo("/Main/Patient/MedsRepeater");
                assertThat(r.childBindings()).containsExactly("F-MEDS", "F-DOSE");
            });

            assertThat(result.operators().comparison()).containsExactly(5, 9);
            assertThat(result.operators().bool()).containsExactly(1, 2);
            assertThat(result.operators().calculation()).containsExactly(3, 4);
        }

        @Test
        @DisplayName("Statistics tally the result")
        void stats() {
            assertThat(result.stats()).isEqualTo(new ExtractionStats(5, 2, 2, 1, 5, 3, 1, 2));
            assertThat(result.formHierarchyCollectionId()).isEqualTo("FHC-100");
            assertThat(result.reportingStandardId()).isEqualTo("NEMSIS-3.5");
            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("Malformed form actions degrade that stage only")
        void malformedStageIsIsolated() {
            SourceGraph graph = SourceGraph.builder()
                    .fieldDictionary(json("[{\"bpID\": \"F1\"}]"))
                    .formActions(json("[\"not\", \"a map\"]"))
                    .build();

            ExtractionResult result = engine.extract(graph);

            assertThat(result.fields()).extracting(FieldDescriptor::id).containsExactly("F1");
            assertThat(result.formActions()).isNull();
            assertThat(result.operators()).isNull();
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.diagnostics())
                    .filteredOn(d -> d.kind() == ExtractionDiagnostic.Kind.MALFORMED_INPUT)
                    .singleElement()
                    .extracting(ExtractionDiagnostic::stage)
                    .isEqualTo(ExtractionStage.FORM_ACTIONS);
            assertThat(logs(Level.WARN, "Stage FORM_ACTIONS degraded")).hasSize(1);
        }

        @Test
        @DisplayName("Unexpected failure inside a stage → STAGE_FAILURE, later stages still run")
        void unexpectedFailureIsIsolated() {
            ObjectNode explodingTable = new ObjectNode(JsonNodeFactory.instance) {
                @Override
                public Iterator<Map.Entry<String, JsonNode>> fields() {
                    throw new IllegalStateException("table iteration failed");
                }
            };
            SourceGraph graph = SourceGraph.builder()
                    .resourceTable(explodingTable)
                    .fieldDictionary(json("[{\"bpID\": \"F1\", \"type\": \"SingleSelect\"}]"))
                    .build();

            ExtractionResult result = engine.extract(graph);

            assertThat(result.resourceGroups()).isEmpty();
            assertThat(result.fields()).hasSize(1);
            assertThat(result.diagnostics())
                    .anySatisfy(d -> {
                        assertThat(d.stage()).isEqualTo(ExtractionStage.RESOURCE_GROUPS);
                        assertThat(d.kind()).isEqualTo(ExtractionDiagnostic.Kind.STAGE_FAILURE);
                        assertThat(d.detail()).contains("table iteration failed");
                    });
            assertThat(logs(Level.WARN, "Stage RESOURCE_GROUPS failed")).hasSize(1);
        }

        @Test
        @DisplayName("Conflicting layout binding paths → MALFORMED_INPUT on the field stage, field still extracted")
        void bindingPathConflictIsDiagnosed() {
            SourceGraph graph = SourceGraph.builder()
                    .layouts(json("""
                            [{"Panels": [{"Controls": [{"BindingPathEntryID": "F1", "BindingPath": "/b"}]}]},
                             {"Panels": [{"Controls": [{"BindingPathEntryID": "F1", "BindingPath": "/a"}]}]}]
                            """))
                    .build();

            ExtractionResult result = engine.extract(graph);

            assertThat(result.field("F1")).get().extracting(FieldDescriptor::bindingPath).isEqualTo("/a");
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.diagnostics())
                    .filteredOn(d -> d.kind() == ExtractionDiagnostic.Kind.MALFORMED_INPUT)
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.stage()).isEqualTo(ExtractionStage.FIELDS);
                        assertThat(d.detail()).contains("'/a'", "'/b'");
                    });
        }

        @Test
        @DisplayName("Absent root containers are noted as missing data, not degradation")
        void missingContainers() {
            ExtractionResult result = engine.extract(
                    SourceGraph.builder().fieldDictionary(json("[{\"bpID\": \"F1\"}]")).build());

            assertThat(result.isDegraded()).isFalse();
            assertThat(result.diagnostics())
                    .extracting(ExtractionDiagnostic::kind)
                    .containsOnly(ExtractionDiagnostic.Kind.MISSING_DATA)
                    .hasSize(3);
            assertThat(result.formActions()).isNull();
            assertThat(result.operators()).isNull();
            assertThat(result.rules()).isEmpty();
            assertThat(result.repeaters()).isEmpty();
        }

        @Test
        @DisplayName("Null graph or no root container at all → FatalExtractionException")
        void fatalWhenNothingToRead() {
            assertThatThrownBy(() -> engine.extract(null)).isInstanceOf(FatalExtractionException.class);
            assertThatThrownBy(() -> engine.extract(SourceGraph.builder().layouts(json("null")).build()))
                    .isInstanceOf(FatalExtractionException.class)
                    .hasMessageContaining("No root container");
        }

        @Test
        @DisplayName("Cells are unwrapped through the configured accessor; unreadable cells count as absent")
        void cellsThroughAccessor() {
            ExtractionEngine cellEngine = new ExtractionEngine(new CellAccessor());
            SourceGraph graph = SourceGraph.builder()
                    .fieldDictionary(json("""
                            {"$value": [{"bpID": {"$value": "F1"}, "key": {"$value": "$boom"}}]}
                            """))
                    .build();

            ExtractionResult result = cellEngine.extract(graph);

            assertThat(result.fields()).singleElement().satisfies(f -> {
                assertThat(f.id()).isEqualTo("F1");
                assertThat(f.label()).isNull();
            });
            assertThat(result.isDegraded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("One INFO completion line per extraction with counts")
        void completionLogLine() {
            engine.extract(SourceGraphs.fixture("fixtures/incident-form.yaml"));

            List<ILoggingEvent> completed = logs(Level.INFO, "extraction.completed");
            assertThat(completed).hasSize(1);
            assertThat(completed.get(0).getFormattedMessage())
                    .contains("fields=5")
                    .contains("resource_groups=2")
                    .contains("rules=2")
                    .contains("form_actions=3")
                    .contains("diagnostics=0");
        }

        @Test
        @DisplayName("Listener sees stage failures and completion, with the form id in the MDC")
        void listenerEvents() {
            CapturingListener listener = new CapturingListener();
            ExtractionEngine observed =
                    new ExtractionEngine(DirectGraphAccessor.INSTANCE, ExtractionConfig.DEFAULT, listener);
            SourceGraph graph = SourceGraph.builder()
                    .formHierarchyCollectionId("FORM-7")
                    .fieldDictionary(json("{\"not\": \"a list\"}"))
                    .layouts(json("[]"))
                    .build();

            observed.extract(graph);

            assertThat(listener.failed).singleElement().satisfies(event -> {
                assertThat(event.stage()).isEqualTo(ExtractionStage.FIELDS);
                assertThat(event.kind()).isEqualTo(ExtractionDiagnostic.Kind.MALFORMED_INPUT);
            });
            assertThat(listener.completed).singleElement().satisfies(event -> {
                assertThat(event.stats().fieldCount()).isZero();
                assertThat(event.diagnosticCount()).isEqualTo(3);
                assertThat(event.durationMs()).isNotNegative();
            });
            assertThat(listener.formIdSeen).isEqualTo("FORM-7");
            assertThat(MDC.get("formId")).isNull();
        }

        @Test
        @DisplayName("Throwing listener is logged and does not affect the result")
        void throwingListener() {
            ExtractionListener throwing = new ExtractionListener() {
                @Override
                public void onStageFailed(StageFailedEvent event) {
                    throw new IllegalStateException("listener down");
                }

                @Override
                public void onExtractionCompleted(ExtractionCompletedEvent event) {
                    throw new IllegalStateException("listener down");
                }
            };
            ExtractionEngine observed =
                    new ExtractionEngine(DirectGraphAccessor.INSTANCE, ExtractionConfig.DEFAULT, throwing);

            ExtractionResult result = observed.extract(SourceGraph.builder()
                    .fieldDictionary(json("[{\"bpID\": \"F1\"}]"))
                    .formActions(json("42"))
                    .build());

            assertThat(result.fields()).hasSize(1);
            assertThat(logs(Level.WARN, "ExtractionListener.onStageFailed failed")).hasSize(1);
            assertThat(logs(Level.WARN, "ExtractionListener.onExtractionCompleted failed")).hasSize(1);
        }
    }

    private static final class CapturingListener implements ExtractionListener {

        private final List<StageFailedEvent> failed = new ArrayList<>();
        private final List<ExtractionCompletedEvent> completed = new ArrayList<>();
        private String formIdSeen;

        @Override
        public void onStageFailed(StageFailedEvent event) {
            failed.add(event);
        }

        @Override
        public void onExtractionCompleted(ExtractionCompletedEvent event) {
            completed.add(event);
            formIdSeen = MDC.get("formId");
        }
    }
}
