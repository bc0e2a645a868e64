package io.mapperxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive metadata of a mapper document. Only {@code name} is required; the rest is passed
 * through to the compiled IR.
 */
public record MapperMetadata(
        String name,
        String description,
        String version,
        String author,
        List<String> tags,
        String source,
        String target,
        String createdAt,
        String updatedAt) {

    public MapperMetadata {
        Objects.requireNonNull(name, "name must not be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Metadata carrying only a name. */
    public static MapperMetadata named(String name) {
        return new MapperMetadata(name, null, null, null, null, null, null, null, null);
    }
}
