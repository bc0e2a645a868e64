package io.mapperxform.core.compiler;

import io.mapperxform.core.ir.Expression;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every {@link Expression.UnresolvedRef} with its final form:
 *
 * <ul>
 * <li>a {@link Expression.SharedRef} when the referenced node is shareable;
 * <li>the referenced node's own (rewritten) expression when it was built but is not shared;
 * <li>a {@code null} literal when the node was never built, logged at WARN.
 * </ul>
 *
 * <p>Rewritten node expressions are memoised, so a node inlined at several sites is rewritten
 * once. One instance serves one compilation; not thread-safe.
 */
final class SharedReferenceRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(SharedReferenceRewriter.class);

    private final Map<String, Expression> built;
    private final Set<String> shareable;
    private final Map<String, Expression> rewritten = new HashMap<>();

    SharedReferenceRewriter(Map<String, Expression> built, Set<String> shareable) {
        this.built = Objects.requireNonNull(built, "built must not be null");
        this.shareable = Objects.requireNonNull(shareable, "shareable must not be null");
    }

    /** Variable name a shared node is bound to: {@code $} plus the id with {@code -} as {@code _}. */
    static String varName(String nodeId) {
        return "$" + nodeId.replace('-', '_');
    }

    /** Expression a consumer of {@code nodeId} sees: a shared reference, the inlined body or null. */
    Expression reference(String nodeId) {
        if (shareable.contains(nodeId)) {
            return new Expression.SharedRef(nodeId, varName(nodeId));
        }
        if (!built.containsKey(nodeId)) {
            LOG.warn("Reference to node {} which could not be built, using null", nodeId);
            return Expression.nullLiteral();
        }
        return rewriteNode(nodeId);
    }

    /** Fully rewritten expression of a built node, or a null literal if it was not built. */
    Expression rewriteNode(String nodeId) {
        Expression cached = rewritten.get(nodeId);
        if (cached != null) {
            return cached;
        }
        Expression source = built.get(nodeId);
        if (source == null) {
            return Expression.nullLiteral();
        }
        // built nodes form a DAG, so the recursion terminates
        Expression result = rewrite(source);
        rewritten.put(nodeId, result);
        return result;
    }

    /** Rewrites an expression tree; leaves other than unresolved references are returned as-is. */
    Expression rewrite(Expression expr) {
        if (expr instanceof Expression.UnresolvedRef ref) {
            return reference(ref.nodeId());
        }
        if (expr instanceof Expression.Binary binary) {
            return Expression.binary(binary.operator(), rewrite(binary.left()), rewrite(binary.right()));
        }
        if (expr instanceof Expression.Unary unary) {
            return Expression.unary(unary.operator(), rewrite(unary.operand()));
        }
        if (expr instanceof Expression.Call call) {
            return Expression.call(call.function(), rewriteAll(call.args()), call.config());
        }
        if (expr instanceof Expression.Conditional conditional) {
            return Expression.conditional(
                    rewrite(conditional.condition()),
                    rewrite(conditional.then()),
                    rewrite(conditional.otherwise()));
        }
        if (expr instanceof Expression.ArrayLiteral array) {
            return new Expression.ArrayLiteral(rewriteAll(array.elements()));
        }
        if (expr instanceof Expression.ObjectLiteral object) {
            List<Expression.ObjectLiteral.Entry> entries = new ArrayList<>(object.entries().size());
            for (Expression.ObjectLiteral.Entry entry : object.entries()) {
                entries.add(new Expression.ObjectLiteral.Entry(entry.key(), rewrite(entry.value())));
            }
            return new Expression.ObjectLiteral(entries);
        }
        return expr;
    }

    private List<Expression> rewriteAll(List<Expression> exprs) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            result.add(rewrite(expr));
        }
        return result;
    }
}
