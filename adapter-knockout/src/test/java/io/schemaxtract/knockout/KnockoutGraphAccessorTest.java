package io.schemaxtract.knockout;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KnockoutGraphAccessor")
class KnockoutGraphAccessorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final KnockoutGraphAccessor accessor = KnockoutGraphAccessor.INSTANCE;

    @Test
    @DisplayName("Only a single-property @observable object is a cell")
    void cellShape() throws Exception {
        assertThat(accessor.isCell(JSON.readTree("{\"@observable\": 1}"))).isTrue();
        assertThat(accessor.isCell(JSON.readTree("{\"@observable\": 1, \"other\": 2}"))).isFalse();
        assertThat(accessor.isCell(JSON.readTree("{\"value\": 1}"))).isFalse();
        assertThat(accessor.isCell(JSON.readTree("[1]"))).isFalse();
        assertThat(accessor.isCell(null)).isFalse();
    }

    @Test
    @DisplayName("Nested observables are peeled, plain values pass through")
    void unwrapsNested() throws Exception {
        JsonNode nested = JSON.readTree("{\"@observable\": {\"@observable\": [1, 2]}}");
        JsonNode plain = JSON.readTree("{\"Name\": \"x\"}");

        assertThat(accessor.unwrap(nested)).isEqualTo(JSON.readTree("[1, 2]"));
        assertThat(accessor.unwrap(plain)).isSameAs(plain);
        assertThat(accessor.unwrap(JSON.readTree("{\"@observable\": null}")).isNull()).isTrue();
    }

    @Test
    @DisplayName("null input and self-wrapping cells read as absent")
    void absentValues() {
        ObjectNode selfWrapping = JsonNodeFactory.instance.objectNode();
        selfWrapping.set(KnockoutGraphAccessor.CELL_KEY, selfWrapping);

        assertThat(accessor.unwrap(null).isMissingNode()).isTrue();
        assertThat(accessor.unwrap(selfWrapping).isMissingNode()).isTrue();
    }

    @Test
    @DisplayName("child() reads through a wrapped parent")
    void childThroughWrappedParent() throws Exception {
        JsonNode parent = JSON.readTree("{\"@observable\": {\"Name\": {\"@observable\": \"Gender\"}}}");

        assertThat(accessor.child(parent, "Name").asText()).isEqualTo("Gender");
        assertThat(accessor.child(parent, "Missing").isMissingNode()).isTrue();
    }
}
