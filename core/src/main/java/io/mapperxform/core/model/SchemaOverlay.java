package io.mapperxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A JSON Schema fragment stored in the mapper document that extends a base schema without
 * modifying it. Either a conditional extension ({@code if}/{@code then}, keyed by a discriminator
 * such as {@code type=6}) or a plain extension merged directly into the schema at
 * {@code metadata.schemaPath}.
 *
 * @param schema the raw overlay object, including {@code $id} and {@code metadata}
 */
public record SchemaOverlay(JsonNode schema) {

    public SchemaOverlay {
        Objects.requireNonNull(schema, "schema must not be null");
    }

    /** Overlay id ({@code $id}), or {@code null}. */
    public String id() {
        JsonNode id = schema.get("$id");
        return id != null && id.isTextual() ? id.asText() : null;
    }

    /** Schema path the overlay applies at; {@code $} (root) when not declared. */
    public String schemaPath() {
        JsonNode path = schema.path("metadata").get("schemaPath");
        return path != null && path.isTextual() && !path.asText().isEmpty() ? path.asText() : "$";
    }

    /** Human-readable target path from the overlay metadata, or {@code null}. */
    public String targetPath() {
        JsonNode path = schema.path("metadata").get("targetPath");
        return path != null && path.isTextual() ? path.asText() : null;
    }

    /** Returns {@code true} if the overlay has an {@code if} or a {@code then} clause. */
    public boolean isConditional() {
        return schema.has("if") || schema.has("then");
    }
}
