package io.mapperxform.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import io.mapperxform.core.model.Endpoints;
import io.mapperxform.core.model.MapEdge;
import io.mapperxform.core.model.MapNode;
import io.mapperxform.core.model.MapSpec;
import io.mapperxform.core.schema.SchemaOverlayApplier;
import io.mapperxform.core.schema.SchemaPathResolver;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes edges the compiler cannot use: edges whose source or target is neither a node nor a
 * schema sentinel, and schema edges whose handle does not resolve in the (overlaid) schema. The
 * editor keeps stale edges around after a node is deleted or a schema changes; dropping them here
 * lets the rest of the document compile.
 *
 * <p>Every dropped edge is logged at WARN. Thread-safe: stateless.
 */
public final class GraphSanitizer {

    private static final Logger LOG = LoggerFactory.getLogger(GraphSanitizer.class);

    /** Sanitizes against the schemas embedded in the document. */
    public SanitizeResult sanitize(MapSpec spec) {
        return sanitize(spec, spec.schemas().sourceSchema(), spec.schemas().targetSchema());
    }

    /**
     * Sanitizes against explicit schemas. A schema side that is {@code null} skips handle checks
     * for that side.
     *
     * @param spec         document to clean
     * @param sourceSchema source JSON Schema before overlays, may be null
     * @param targetSchema target JSON Schema before overlays, may be null
     * @return the result; {@link SanitizeResult#spec()} is {@code spec} itself when no edge was
     *     dropped, otherwise a copy with only the edge list replaced
     */
    public SanitizeResult sanitize(MapSpec spec, JsonNode sourceSchema, JsonNode targetSchema) {
        Set<String> endpoints = new HashSet<>();
        for (MapNode node : spec.nodes()) {
            if (node.id() != null) {
                endpoints.add(node.id());
            }
        }
        endpoints.add(Endpoints.SOURCE_SCHEMA);
        endpoints.add(Endpoints.TARGET_SCHEMA);

        JsonNode overlaidSource = isSchema(sourceSchema)
                ? SchemaOverlayApplier.apply(sourceSchema, spec.schemaOverlays().source())
                : null;
        JsonNode overlaidTarget = isSchema(targetSchema)
                ? SchemaOverlayApplier.apply(targetSchema, spec.schemaOverlays().target())
                : null;

        List<MapEdge> kept = new ArrayList<>(spec.edges().size());
        List<String> removed = new ArrayList<>();
        for (MapEdge edge : spec.edges()) {
            String reason = rejectionReason(edge, endpoints, overlaidSource, overlaidTarget);
            if (reason == null) {
                kept.add(edge);
            } else {
                LOG.warn("Removing orphaned edge: {} ({})", edge.id(), reason);
                removed.add(String.valueOf(edge.id()));
            }
        }

        if (removed.isEmpty()) {
            return new SanitizeResult(spec, List.of());
        }
        return new SanitizeResult(spec.withEdges(kept), removed);
    }

    private static String rejectionReason(
            MapEdge edge, Set<String> endpoints, JsonNode sourceSchema, JsonNode targetSchema) {
        if (!endpoints.contains(edge.source()) || !endpoints.contains(edge.target())) {
            return "node not found: source=" + edge.source() + ", target=" + edge.target();
        }
        if (edge.fromSourceSchema()
                && hasHandle(edge.sourceHandle())
                && sourceSchema != null
                && !SchemaPathResolver.handleExistsInSchema(edge.sourceHandle(), sourceSchema)) {
            return "source handle not found: " + edge.sourceHandle();
        }
        if (edge.toTargetSchema()
                && hasHandle(edge.targetHandle())
                && targetSchema != null
                && !SchemaPathResolver.handleExistsInSchema(edge.targetHandle(), targetSchema)) {
            return "target handle not found: " + edge.targetHandle();
        }
        return null;
    }

    private static boolean hasHandle(String handle) {
        return handle != null && !handle.isEmpty();
    }

    private static boolean isSchema(JsonNode schema) {
        return schema != null && schema.isObject();
    }
}
