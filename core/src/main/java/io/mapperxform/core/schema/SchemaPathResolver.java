package io.mapperxform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Checks whether an editor handle ({@code $.customer.name}, {@code $.items[].sku},
 * {@code $.config.__SYNTH__[type=6] HTTP Task.headers}) resolves inside a JSON Schema.
 *
 * <p>Resolution walks {@code properties} segment by segment. When the current schema does not
 * declare the property directly, the branches of {@code allOf}, {@code anyOf} and {@code oneOf}
 * are searched in order; a branch contributes its own {@code properties} and those of its
 * {@code then} and {@code else} clauses (the shape produced by conditional schema overlays). A
 * segment suffixed with {@code []} descends into the matched schema's {@code items}.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class SchemaPathResolver {

    private static final String ROOT = "$.";
    private static final String ARRAY_MARKER = "[]";
    private static final List<String> BRANCH_KEYWORDS = List.of("allOf", "anyOf", "oneOf");

    private SchemaPathResolver() {}

    /**
     * Returns {@code true} if {@code handle} names a property declared in {@code schema}.
     *
     * @param handle editor handle starting with {@code $.}
     * @param schema JSON Schema with overlays already applied, may be null
     * @return {@code false} for a null, empty or root-less handle, or a null/missing schema
     */
    public static boolean handleExistsInSchema(String handle, JsonNode schema) {
        if (handle == null || handle.isEmpty() || !handle.startsWith(ROOT)) {
            return false;
        }
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return false;
        }

        JsonNode current = schema;
        for (String segment : SyntheticSegments.realSegments(handle.substring(ROOT.length()))) {
            boolean isArray = segment.contains(ARRAY_MARKER);
            String fieldName = segment.replace(ARRAY_MARKER, "");

            JsonNode match = findProperty(current, fieldName);
            if (match == null) {
                return false;
            }
            current = match;
            if (isArray && current.has("items")) {
                current = current.get("items");
            }
        }
        return true;
    }

    private static JsonNode findProperty(JsonNode schema, String fieldName) {
        JsonNode direct = schema.path("properties").get(fieldName);
        if (direct != null) {
            return direct;
        }
        for (String keyword : BRANCH_KEYWORDS) {
            JsonNode branches = schema.get(keyword);
            if (branches == null || !branches.isArray()) {
                continue;
            }
            for (JsonNode branch : branches) {
                JsonNode found = branchProperty(branch, fieldName);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static JsonNode branchProperty(JsonNode branch, String fieldName) {
        JsonNode own = branch.path("properties").get(fieldName);
        if (own != null) {
            return own;
        }
        JsonNode then = branch.path("then").path("properties").get(fieldName);
        if (then != null) {
            return then;
        }
        return branch.path("else").path("properties").get(fieldName);
    }
}
