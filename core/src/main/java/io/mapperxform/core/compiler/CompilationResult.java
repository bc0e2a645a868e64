package io.mapperxform.core.compiler;

import io.mapperxform.core.ir.MapperIR;
import io.mapperxform.core.model.MapSpec;
import java.util.List;
import java.util.Objects;

/**
 * Everything one compilation produced.
 *
 * @param ir             the compiled mapper
 * @param sanitizedSpec  the document actually compiled; the input instance when no edge was removed
 * @param removedEdgeIds edges dropped by sanitation
 * @param unbuiltNodeIds nodes that could not be built (cycle, missing predecessor, invalid node);
 *                       references to them compiled to {@code null}
 */
public record CompilationResult(
        MapperIR ir, MapSpec sanitizedSpec, List<String> removedEdgeIds, List<String> unbuiltNodeIds) {

    public CompilationResult {
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(sanitizedSpec, "sanitizedSpec must not be null");
        removedEdgeIds = removedEdgeIds == null ? List.of() : List.copyOf(removedEdgeIds);
        unbuiltNodeIds = unbuiltNodeIds == null ? List.of() : List.copyOf(unbuiltNodeIds);
    }

    /** Returns {@code true} if every node was built. */
    public boolean isComplete() {
        return unbuiltNodeIds.isEmpty();
    }
}
