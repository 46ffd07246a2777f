package io.schemaxtract.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemaxtract.core.model.ExtractionStage;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract runtime root, three concrete types. */
class ExceptionHierarchyTest {

    @Test
    void schemaExtractionExceptionIsAbstractAndRoot() {
        assertThat(SchemaExtractionException.class).isAbstract();
        assertThat(SchemaExtractionException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void fatalExtractionExceptionCarriesSourceStageAndCause() {
        var cause = new IllegalStateException("graph gone");
        var ex = new FatalExtractionException("cannot read graph", cause);

        assertThat(ex).isInstanceOf(SchemaExtractionException.class);
        assertThat(ex.stage()).isEqualTo(ExtractionStage.SOURCE);
        assertThat(ex.detail()).isEqualTo("cannot read graph");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void malformedInputExceptionCarriesItsStage() {
        var ex = new MalformedInputException("not a list", ExtractionStage.FIELDS);

        assertThat(ex).isInstanceOf(SchemaExtractionException.class);
        assertThat(ex.stage()).isEqualTo(ExtractionStage.FIELDS);
        assertThat(ex.getMessage()).isEqualTo("not a list");
    }

    @Test
    void configExceptionHasNoStage() {
        var ex = new ExtractionConfigException("bad depth");

        assertThat(ex).isInstanceOf(SchemaExtractionException.class);
        assertThat(ex.stage()).isNull();
        assertThat(ex.getCause()).isNull();
    }
}
