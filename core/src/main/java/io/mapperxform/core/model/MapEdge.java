package io.mapperxform.core.model;

/**
 * Directed connection between two endpoints. An endpoint is either a node id or one of the
 * {@link Endpoints} sentinels; handles name the schema field (for sentinels) or the input/output
 * port (for functoids, e.g. {@code input-1}).
 */
public record MapEdge(String id, String source, String sourceHandle, String target, String targetHandle) {

    /** Returns {@code true} if this edge starts at the source schema. */
    public boolean fromSourceSchema() {
        return Endpoints.SOURCE_SCHEMA.equals(source);
    }

    /** Returns {@code true} if this edge ends at the target schema. */
    public boolean toTargetSchema() {
        return Endpoints.TARGET_SCHEMA.equals(target);
    }
}
