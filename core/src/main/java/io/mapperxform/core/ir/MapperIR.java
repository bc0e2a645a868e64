package io.mapperxform.core.ir;

import io.mapperxform.core.model.MapperMetadata;
import io.mapperxform.core.model.SchemaSet;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled mapper: the stable contract handed to code generators and to preview execution.
 *
 * <p>The canonical constructor rejects any {@link Expression.UnresolvedRef} reachable from a
 * mapping or shared expression, so an IR instance always has every placeholder resolved.
 *
 * @param version           IR format version
 * @param schemas           schema references passed through from the document
 * @param mappings          one assignment per edge into the target schema
 * @param sharedExpressions hoisted values in binding order; {@code null} when nothing was hoisted
 * @param metadata          document metadata passed through
 */
public record MapperIR(
        String version,
        SchemaSet schemas,
        List<FieldMapping> mappings,
        List<SharedExpression> sharedExpressions,
        MapperMetadata metadata) {

    /** Current IR format version. */
    public static final String VERSION = "1.0";

    public MapperIR {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        schemas = schemas == null ? SchemaSet.NONE : schemas;
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        sharedExpressions =
                sharedExpressions == null || sharedExpressions.isEmpty() ? null : List.copyOf(sharedExpressions);
        Set<Expression> checked = Collections.newSetFromMap(new IdentityHashMap<>());
        for (FieldMapping mapping : mappings) {
            requireResolved(mapping.expression(), "mapping '" + mapping.target() + "'", checked);
        }
        if (sharedExpressions != null) {
            for (SharedExpression shared : sharedExpressions) {
                requireResolved(shared.expression(), "shared expression '" + shared.varName() + "'", checked);
            }
        }
    }

    /** Hoisted values, empty when nothing was hoisted. */
    public List<SharedExpression> shared() {
        return sharedExpressions == null ? List.of() : sharedExpressions;
    }

    /** Finds the hoisted value computed by {@code nodeId}. */
    public Optional<SharedExpression> sharedFor(String nodeId) {
        return shared().stream().filter(s -> s.nodeId().equals(nodeId)).findFirst();
    }

    /** Finds the mapping for a target path. */
    public Optional<FieldMapping> mappingFor(String target) {
        return mappings.stream().filter(m -> m.target().equals(target)).findFirst();
    }

    /** Subtrees may be shared between mappings; {@code checked} holds instances already seen. */
    private static void requireResolved(Expression root, String where, Set<Expression> checked) {
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expression expr = stack.pop();
            if (!checked.add(expr)) {
                continue;
            }
            if (expr instanceof Expression.UnresolvedRef ref) {
                throw new IllegalArgumentException(
                        "Unresolved reference to node '" + ref.nodeId() + "' in " + where);
            }
            expr.children().forEach(stack::push);
        }
    }
}
