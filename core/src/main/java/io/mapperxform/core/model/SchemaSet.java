package io.mapperxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Source and target schema references plus their embedded JSON Schemas.
 *
 * @param source       source schema reference: {@code none}, {@code custom} or a file path
 * @param target       target schema reference: {@code none}, {@code custom} or a file path
 * @param sourceSchema embedded source JSON Schema, may be null
 * @param targetSchema embedded target JSON Schema, may be null
 */
public record SchemaSet(String source, String target, JsonNode sourceSchema, JsonNode targetSchema) {

    /** Both references set to {@code none}, no embedded schemas. */
    public static final SchemaSet NONE = new SchemaSet("none", "none", null, null);

    public SchemaSet {
        source = source == null ? "none" : source;
        target = target == null ? "none" : target;
    }

    /** Custom (embedded) schemas on both sides. */
    public static SchemaSet embedded(JsonNode sourceSchema, JsonNode targetSchema) {
        return new SchemaSet("custom", "custom", sourceSchema, targetSchema);
    }
}
