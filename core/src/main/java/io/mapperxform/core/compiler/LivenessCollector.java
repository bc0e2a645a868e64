package io.mapperxform.core.compiler;

import io.mapperxform.core.ir.Expression;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds the shared nodes still referenced after rewriting. Roots are the mapping expressions; a
 * shared node is live if a root references it, or if another live shared expression does.
 * Shareable nodes outside this set are dead and are not emitted.
 */
final class LivenessCollector {

    private LivenessCollector() {}

    /**
     * @param roots        rewritten mapping expressions
     * @param sharedBodies rewritten expression of a shared node by id
     * @return live shared node ids, in discovery order
     */
    static Set<String> collect(List<Expression> roots, Function<String, Expression> sharedBodies) {
        Set<String> live = new LinkedHashSet<>();
        // inlined bodies are the same instance at every use site, so each is walked once
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            Expression expr = stack.pop();
            if (!visited.add(expr)) {
                continue;
            }
            if (expr instanceof Expression.SharedRef ref) {
                if (live.add(ref.nodeId())) {
                    stack.push(sharedBodies.apply(ref.nodeId()));
                }
                continue;
            }
            expr.children().forEach(stack::push);
        }
        return live;
    }
}
