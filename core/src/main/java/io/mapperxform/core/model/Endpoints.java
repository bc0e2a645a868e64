package io.mapperxform.core.model;

/**
 * Sentinel endpoint ids. Edges whose {@code source} or {@code target} is one of these constants
 * attach to a schema field rather than to a functoid node; the field is named by the edge handle.
 */
public final class Endpoints {

    /** Source schema terminal. */
    public static final String SOURCE_SCHEMA = "source-schema";

    /** Target schema terminal. */
    public static final String TARGET_SCHEMA = "target-schema";

    private Endpoints() {}

    /** Returns {@code true} if the id is one of the two schema sentinels. */
    public static boolean isSchemaSentinel(String endpointId) {
        return SOURCE_SCHEMA.equals(endpointId) || TARGET_SCHEMA.equals(endpointId);
    }
}
