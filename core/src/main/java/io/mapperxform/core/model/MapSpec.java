package io.mapperxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The mapping graph document: functoid nodes, the edges between them and the schema terminals,
 * plus the schemas and overlays the edge handles refer to.
 *
 * <p>Immutable. Owned by the editor that produced it; the compiler only reads it.
 */
public record MapSpec(
        String version,
        MapperMetadata metadata,
        SchemaSet schemas,
        SchemaOverlays schemaOverlays,
        List<MapNode> nodes,
        List<MapEdge> edges) {

    /** Document format version written by current editors. */
    public static final String CURRENT_VERSION = "1.0";

    public MapSpec {
        Objects.requireNonNull(metadata, "metadata must not be null");
        version = version == null ? CURRENT_VERSION : version;
        schemas = schemas == null ? SchemaSet.NONE : schemas;
        schemaOverlays = schemaOverlays == null ? SchemaOverlays.NONE : schemaOverlays;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /** Returns a shallow copy of this document with the edge list replaced. */
    public MapSpec withEdges(List<MapEdge> newEdges) {
        return new MapSpec(version, metadata, schemas, schemaOverlays, nodes, newEdges);
    }
}
