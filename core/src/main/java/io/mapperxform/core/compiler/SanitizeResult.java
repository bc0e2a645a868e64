package io.mapperxform.core.compiler;

import io.mapperxform.core.model.MapSpec;
import java.util.List;

/**
 * Outcome of {@link GraphSanitizer#sanitize}.
 *
 * @param spec           the cleaned document; the very same instance as the input when nothing
 *                       was removed
 * @param removedEdgeIds ids of the dropped edges, in document order
 */
public record SanitizeResult(MapSpec spec, List<String> removedEdgeIds) {

    public SanitizeResult {
        removedEdgeIds = removedEdgeIds == null ? List.of() : List.copyOf(removedEdgeIds);
    }

    /** Returns {@code true} if at least one edge was dropped. */
    public boolean changed() {
        return !removedEdgeIds.isEmpty();
    }
}
