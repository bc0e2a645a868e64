package io.mapperxform.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mapperxform.core.model.SchemaOverlay;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaOverlayApplierTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    private static SchemaOverlay overlay(String text) throws Exception {
        return new SchemaOverlay(json(text));
    }

    @Test
    void noOverlaysReturnsSameInstance() throws Exception {
        JsonNode base = json("{\"type\":\"object\"}");

        assertThat(SchemaOverlayApplier.apply(base, List.of())).isSameAs(base);
        assertThat(SchemaOverlayApplier.apply(base, null)).isSameAs(base);
    }

    @Test
    void plainOverlayIsMergedAtRoot() throws Exception {
        JsonNode base = json("""
                {"type":"object","properties":{"a":{"type":"string"}},"required":["a"]}
                """);
        SchemaOverlay extension = overlay("""
                {"$id":"mapper://overlay/b","metadata":{"description":"adds b"},
                 "properties":{"b":{"type":"integer"}},"required":["b"]}
                """);

        JsonNode result = SchemaOverlayApplier.apply(base, List.of(extension));

        assertThat(result.path("properties").has("a")).isTrue();
        assertThat(result.path("properties").path("b").path("type").asText()).isEqualTo("integer");
        assertThat(result.path("required")).extracting(JsonNode::asText).containsExactly("a", "b");
        assertThat(result.has("$id")).isFalse();
        assertThat(result.has("metadata")).isFalse();
        assertThat(base.path("properties").has("b")).as("base schema must not be mutated").isFalse();
    }

    @Test
    void conditionalOverlayIsAddedAtSchemaPath() throws Exception {
        JsonNode base = json("""
                {"type":"object","properties":{
                  "attributes":{"type":"object","properties":{"type":{"type":"integer"}}}}}
                """);
        SchemaOverlay http = overlay("""
                {"$id":"mapper://overlay/http","metadata":{"schemaPath":"$.attributes"},
                 "if":{"properties":{"type":{"const":6}}},
                 "then":{"properties":{"headers":{"type":"object"}}}}
                """);

        JsonNode result = SchemaOverlayApplier.apply(base, List.of(http));

        JsonNode allOf = result.path("properties").path("attributes").path("allOf");
        assertThat(allOf).hasSize(1);
        assertThat(allOf.get(0).path("then").path("properties").has("headers")).isTrue();
        assertThat(SchemaPathResolver.handleExistsInSchema("$.attributes.headers", result)).isTrue();
    }

    @Test
    void conditionalOverlaysWithSameDiscriminatorAreMerged() throws Exception {
        JsonNode base = json("{\"type\":\"object\",\"properties\":{\"type\":{\"type\":\"integer\"}}}");
        SchemaOverlay first = overlay("""
                {"if":{"properties":{"type":{"const":6}}},"then":{"properties":{"headers":{"type":"object"}}}}
                """);
        SchemaOverlay second = overlay("""
                {"if":{"properties":{"type":{"const":6}}},"then":{"properties":{"body":{"type":"string"}}}}
                """);
        SchemaOverlay other = overlay("""
                {"if":{"properties":{"type":{"const":7}}},"then":{"properties":{"script":{"type":"string"}}}}
                """);

        JsonNode result = SchemaOverlayApplier.apply(base, List.of(first, second, other));

        JsonNode allOf = result.path("allOf");
        assertThat(allOf).hasSize(2);
        assertThat(allOf.get(0).path("then").path("properties").has("headers")).isTrue();
        assertThat(allOf.get(0).path("then").path("properties").has("body")).isTrue();
        assertThat(allOf.get(1).path("then").path("properties").has("script")).isTrue();
    }

    @Test
    void missingSchemaPathLeavesSchemaUnchanged() throws Exception {
        JsonNode base = json("{\"type\":\"object\",\"properties\":{}}");
        SchemaOverlay misplaced = overlay("""
                {"metadata":{"schemaPath":"$.nowhere"},"properties":{"x":{"type":"string"}}}
                """);

        JsonNode result = SchemaOverlayApplier.apply(base, List.of(misplaced));

        assertThat(result).isEqualTo(base);
    }

    @Test
    void discriminatorKeyUsesFirstConstProperty() throws Exception {
        assertThat(SchemaOverlayApplier.discriminatorKey(
                        json("{\"properties\":{\"kind\":{\"type\":\"string\"},\"type\":{\"const\":6}}}")))
                .isEqualTo("type=6");
        assertThat(SchemaOverlayApplier.discriminatorKey(json("{\"properties\":{}}"))).isNull();
        assertThat(SchemaOverlayApplier.discriminatorKey(null)).isNull();
    }
}
