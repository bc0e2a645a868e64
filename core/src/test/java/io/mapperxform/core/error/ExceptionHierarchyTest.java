package io.mapperxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Two-tier structure of the load-time exceptions and their common fields. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void mapperExceptionIsAbstractAndRoot() {
        assertThat(MapperException.class).isAbstract();
        assertThat(MapperException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void mapperLoadExceptionIsAbstract() {
        assertThat(MapperLoadException.class).isAbstract();
        assertThat(MapperLoadException.class.getSuperclass()).isEqualTo(MapperException.class);
    }

    // --- Concrete types ---

    @Test
    void mapSpecParseExceptionCarriesDocumentAndSource() {
        var ex = new MapSpecParseException("bad yaml", "orders", "/path/to/orders.yaml");

        assertThat(ex).isInstanceOf(MapperLoadException.class);
        assertThat(ex.documentId()).isEqualTo("orders");
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.source()).isEqualTo("/path/to/orders.yaml");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void schemaValidationExceptionKeepsCause() {
        var cause = new IllegalStateException("unresolvable $ref");
        var ex = new SchemaValidationException("invalid schema", cause, "orders", null);

        assertThat(ex).isInstanceOf(MapperLoadException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.source()).isNull();
        assertThat(ex.getMessage()).isEqualTo("invalid schema");
    }

    @Test
    void documentIdMayBeUnknown() {
        var ex = new MapSpecParseException("Mapper document must be a JSON/YAML object", null, "in.yaml");

        assertThat(ex.documentId()).isNull();
        assertThat(ex.source()).isEqualTo("in.yaml");
    }

    @Test
    void concreteTypesAreFinal() {
        assertThat(MapSpecParseException.class).isFinal();
        assertThat(SchemaValidationException.class).isFinal();
    }
}
