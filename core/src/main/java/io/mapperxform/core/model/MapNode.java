package io.mapperxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A functoid node in the mapping graph.
 *
 * @param id     unique node id within the document
 * @param kind   operation kind, e.g. {@code Binary.Add} or {@code String.Template}
 * @param config operation configuration (never null; an empty object when absent)
 * @param label  optional user-facing label, may be null; carried through, not used for name hints
 */
public record MapNode(String id, String kind, JsonNode config, String label) {

    public MapNode {
        if (config == null || config.isNull() || config.isMissingNode()) {
            config = JsonNodeFactory.instance.objectNode();
        }
    }

    /** Convenience constructor for nodes without configuration or label. */
    public MapNode(String id, String kind) {
        this(id, kind, null, null);
    }

    /** Convenience constructor for nodes without a label. */
    public MapNode(String id, String kind, JsonNode config) {
        this(id, kind, config, null);
    }

    /**
     * Returns {@code true} if the node carries both an id and a kind. Nodes failing this check are
     * skipped by the compiler.
     */
    public boolean isValid() {
        return id != null && !id.isBlank() && kind != null && !kind.isBlank();
    }

    /** Returns the textual config value for {@code key}, or {@code null} if absent or null. */
    public String configText(String key) {
        JsonNode value = config.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
