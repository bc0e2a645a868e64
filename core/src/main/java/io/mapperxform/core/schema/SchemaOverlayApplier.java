package io.mapperxform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mapperxform.core.model.SchemaOverlay;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link SchemaOverlay}s to a base JSON Schema, producing the schema the editor shows
 * and the sanitizer validates handles against.
 *
 * <p>Overlays are grouped by {@code metadata.schemaPath} and applied at that path, in the order
 * the paths first appear. At a given path:
 *
 * <ul>
 * <li>a plain overlay (no {@code if}, no {@code then}) is deep-merged into the schema;
 * <li>a conditional overlay is keyed by its discriminator ({@code field=const} from the first
 * {@code if} property declaring a {@code const}); an existing {@code allOf} conditional with the
 * same key has its {@code then} deep-merged, otherwise the overlay is added as a new conditional.
 * </ul>
 *
 * <p>Inputs are never mutated. Thread-safe: stateless.
 */
public final class SchemaOverlayApplier {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaOverlayApplier.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String ROOT_PATH = "$";

    private SchemaOverlayApplier() {}

    /**
     * Applies overlays at their declared schema paths.
     *
     * @param schema   base schema, may be null
     * @param overlays overlays, may be null or empty
     * @return the base schema itself when there is nothing to apply, otherwise a new schema
     */
    public static JsonNode apply(JsonNode schema, List<SchemaOverlay> overlays) {
        if (schema == null || !schema.isObject() || overlays == null || overlays.isEmpty()) {
            return schema;
        }

        Map<String, List<SchemaOverlay>> byPath = new LinkedHashMap<>();
        for (SchemaOverlay overlay : overlays) {
            byPath.computeIfAbsent(overlay.schemaPath(), k -> new ArrayList<>()).add(overlay);
        }
        LOG.debug("Applying {} schema overlays at paths {}", overlays.size(), byPath.keySet());

        ObjectNode result = ((ObjectNode) schema).deepCopy();
        for (Map.Entry<String, List<SchemaOverlay>> entry : byPath.entrySet()) {
            String path = entry.getKey();
            if (ROOT_PATH.equals(path)) {
                result = applyHere(result, entry.getValue());
            } else {
                result = applyAtPath(result, path, entry.getValue());
            }
        }
        return result;
    }

    private static ObjectNode applyAtPath(ObjectNode schema, String path, List<SchemaOverlay> overlays) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.replaceFirst("^\\$\\.?", "").split("\\.")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty()) {
            return applyHere(schema, overlays);
        }

        ObjectNode target = schema;
        for (String segment : segments) {
            JsonNode next = target.path("properties").get(segment);
            if (next == null || !next.isObject()) {
                LOG.warn("Schema overlay path '{}' not found: missing property '{}'", path, segment);
                return schema;
            }
            target = (ObjectNode) next;
        }

        // schema is already a private copy, so the property node can be replaced in place
        ObjectNode merged = applyHere(target, overlays);
        ObjectNode parent = schema;
        for (int i = 0; i < segments.size() - 1; i++) {
            parent = (ObjectNode) parent.get("properties").get(segments.get(i));
        }
        ((ObjectNode) parent.get("properties")).set(segments.get(segments.size() - 1), merged);
        return schema;
    }

    private static ObjectNode applyHere(ObjectNode schema, List<SchemaOverlay> overlays) {
        Map<String, ObjectNode> conditionals = new LinkedHashMap<>();
        List<ObjectNode> plain = new ArrayList<>();

        JsonNode existingAllOf = schema.get("allOf");
        if (existingAllOf != null && existingAllOf.isArray()) {
            for (JsonNode item : existingAllOf) {
                if (!item.isObject()) {
                    continue;
                }
                String key = item.has("if") && item.has("then") ? discriminatorKey(item.get("if")) : null;
                if (key != null) {
                    conditionals.put(key, ((ObjectNode) item).deepCopy());
                } else {
                    plain.add(((ObjectNode) item).deepCopy());
                }
            }
        }

        for (SchemaOverlay overlay : overlays) {
            if (!overlay.schema().isObject()) {
                LOG.warn("Skipping schema overlay {}: not a JSON object", overlay.id());
                continue;
            }
            ObjectNode body = ((ObjectNode) overlay.schema()).deepCopy();
            if (!overlay.isConditional()) {
                body.remove("metadata");
                body.remove("$id");
                plain.add(body);
                continue;
            }

            String key = discriminatorKey(body.path("if"));
            if (key == null) {
                LOG.warn("Skipping schema overlay {}: no recognizable discriminator", overlay.id());
                continue;
            }

            ObjectNode existing = conditionals.get(key);
            if (existing != null) {
                JsonNode existingThen = existing.path("then");
                JsonNode overlayThen = body.path("then");
                existing.set(
                        "then",
                        deepMerge(
                                existingThen.isObject() ? (ObjectNode) existingThen : NODES.objectNode(),
                                overlayThen.isObject() ? (ObjectNode) overlayThen : NODES.objectNode()));
            } else {
                ObjectNode conditional = NODES.objectNode();
                conditional.set("if", body.get("if"));
                conditional.set("then", body.has("then") ? body.get("then") : NODES.objectNode());
                if (body.has("else")) {
                    conditional.set("else", body.get("else"));
                }
                conditionals.put(key, conditional);
            }
        }

        ObjectNode result = schema.deepCopy();
        result.remove("allOf");
        for (ObjectNode extension : plain) {
            result = deepMerge(result, extension);
        }
        if (!conditionals.isEmpty()) {
            ArrayNode allOf = result.putArray("allOf");
            conditionals.values().forEach(allOf::add);
        }
        return result;
    }

    /** {@code field=const} of the first {@code if} property declaring a {@code const}. */
    static String discriminatorKey(JsonNode ifClause) {
        JsonNode properties = ifClause == null ? null : ifClause.get("properties");
        if (properties == null || !properties.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode constant = field.getValue().get("const");
            if (constant != null) {
                return field.getKey() + "=" + constant.asText();
            }
        }
        return null;
    }

    /**
     * Merges {@code source} into a copy of {@code target}: properties recursively, {@code required}
     * as a union, {@code items} replaced, any other key copied only if the target lacks it.
     */
    static ObjectNode deepMerge(ObjectNode target, ObjectNode source) {
        ObjectNode result = target.deepCopy();

        JsonNode sourceProperties = source.get("properties");
        if (sourceProperties != null && sourceProperties.isObject()) {
            JsonNode targetProperties = target.get("properties");
            result.set(
                    "properties",
                    mergeProperties(
                            targetProperties != null && targetProperties.isObject()
                                    ? (ObjectNode) targetProperties
                                    : NODES.objectNode(),
                            (ObjectNode) sourceProperties));
        }

        JsonNode sourceRequired = source.get("required");
        if (sourceRequired != null && sourceRequired.isArray()) {
            Set<String> required = new LinkedHashSet<>();
            target.path("required").forEach(r -> required.add(r.asText()));
            sourceRequired.forEach(r -> required.add(r.asText()));
            ArrayNode union = result.putArray("required");
            required.forEach(union::add);
        }

        if (source.has("items")) {
            result.set("items", source.get("items").deepCopy());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if ("properties".equals(key) || "required".equals(key) || "items".equals(key)) {
                continue;
            }
            if (!result.has(key)) {
                result.set(key, field.getValue().deepCopy());
            }
        }
        return result;
    }

    private static ObjectNode mergeProperties(ObjectNode target, ObjectNode source) {
        ObjectNode result = target.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = result.get(field.getKey());
            JsonNode incoming = field.getValue();
            if (existing != null && isObjectSchema(existing) && isObjectSchema(incoming)) {
                ObjectNode merged = ((ObjectNode) existing).deepCopy();
                merged.setAll(((ObjectNode) incoming).deepCopy());
                merged.set(
                        "properties",
                        mergeProperties(
                                existing.path("properties").isObject()
                                        ? (ObjectNode) existing.get("properties")
                                        : NODES.objectNode(),
                                incoming.path("properties").isObject()
                                        ? (ObjectNode) incoming.get("properties")
                                        : NODES.objectNode()));
                result.set(field.getKey(), merged);
            } else {
                result.set(field.getKey(), incoming.deepCopy());
            }
        }
        return result;
    }

    private static boolean isObjectSchema(JsonNode schema) {
        return schema.isObject() && "object".equals(schema.path("type").asText());
    }
}
