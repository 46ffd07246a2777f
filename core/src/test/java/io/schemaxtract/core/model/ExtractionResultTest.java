package io.schemaxtract.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExtractionResult")
class ExtractionResultTest {

    private static FieldDescriptor field(String id) {
        return new FieldDescriptor(id, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("Null collections become empty, null form actions stay null")
    void nullCollections() {
        ExtractionResult result = new ExtractionResult(null, null, null, null, null, null, null, null, null, null);

        assertThat(result.fields()).isEmpty();
        assertThat(result.rules()).isEmpty();
        assertThat(result.formActions()).isNull();
        assertThat(result.operators()).isNull();
        assertThat(result.stats()).isEqualTo(ExtractionStats.EMPTY);
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Result is detached from the lists it was built from")
    void defensiveCopies() {
        List<FieldDescriptor> fields = new ArrayList<>(List.of(field("a")));
        Map<String, List<FormAction>> actions = new LinkedHashMap<>();
        actions.put("p", new ArrayList<>(List.of(new GenericAction("A", null, null, null, Map.of()))));

        ExtractionResult result = new ExtractionResult(null, null, fields, null, null, actions, null, null, null, null);
        fields.add(field("b"));
        actions.get("p").clear();

        assertThat(result.fields()).hasSize(1);
        assertThat(result.formActions().get("p")).hasSize(1);
        assertThatThrownBy(() -> result.formActions().put("q", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Missing data alone is not degradation")
    void degradation() {
        ExtractionDiagnostic missing =
                new ExtractionDiagnostic(ExtractionStage.FIELDS, ExtractionDiagnostic.Kind.MISSING_DATA, "absent");
        ExtractionDiagnostic malformed = new ExtractionDiagnostic(
                ExtractionStage.FORM_ACTIONS, ExtractionDiagnostic.Kind.MALFORMED_INPUT, "not a map");

        assertThat(new ExtractionResult(null, null, null, null, null, null, null, null, null, List.of(missing))
                        .isDegraded())
                .isFalse();
        assertThat(new ExtractionResult(null, null, null, null, null, null, null, null, null, List.of(missing, malformed))
                        .isDegraded())
                .isTrue();
    }

    @Test
    @DisplayName("Lookups by id")
    void lookups() {
        ResourceGroup group = new ResourceGroup("G", "G", List.of());
        ExtractionResult result = new ExtractionResult(
                null, null, List.of(field("a"), field("b")), List.of(group), null, null, null, null, null, null);

        assertThat(result.field("b")).get().extracting(FieldDescriptor::id).isEqualTo("b");
        assertThat(result.field("z")).isEmpty();
        assertThat(result.resourceGroup("G")).contains(group);
    }

    @Test
    @DisplayName("Visibility target prefers the field node id, action extensions are read-only")
    void visibilityTarget() {
        Map<String, JsonNode> extensions = new HashMap<>();
        extensions.put("Severity", TextNode.valueOf("High"));
        VisibilityAction byNode = new VisibilityAction("A", null, "N-1", "FH-1", null, null, extensions);
        VisibilityAction byHierarchy = new VisibilityAction("B", null, "", "FH-2", null, null, null);

        assertThat(byNode.targetField()).isEqualTo("N-1");
        assertThat(byHierarchy.targetField()).isEqualTo("FH-2");
        assertThat(byHierarchy.extensions()).isEmpty();
        assertThatThrownBy(() -> byNode.extensions().put("x", TextNode.valueOf("y")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Action extensions are detached from the caller's nodes and from each other")
    void extensionValuesDetached() {
        ObjectNode meta = JsonNodeFactory.instance.objectNode().put("owner", "qa");
        ValidationAction action = new ValidationAction("A", null, "F1", null, null, null, Map.of("Meta", meta));

        meta.put("owner", "changed");
        ((ObjectNode) action.extensions().get("Meta")).put("owner", "mutated");

        assertThat(action.extensions().get("Meta").get("owner").asText()).isEqualTo("qa");
    }
}
