package io.mapperxform.core.compiler;

import io.mapperxform.core.ir.Expression;
import io.mapperxform.core.model.Endpoints;
import io.mapperxform.core.model.MapEdge;
import io.mapperxform.core.model.MapNode;
import io.mapperxform.core.model.MapSpec;
import io.mapperxform.core.registry.FunctoidRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which functoid outputs are hoisted into named shared expressions.
 *
 * <p>A node is shareable when all of the following hold: it is consumed by more than one edge,
 * its kind is pure, it was built, its expression costs at least 2, and none of its downstream
 * paths reaches a per-item (array) target position. Hoisting a value that feeds an array
 * element would evaluate it once for all items, so such nodes are always inlined.
 *
 * <p>Thread-safe: stateless apart from its configuration.
 */
public final class ShareabilityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ShareabilityAnalyzer.class);

    /** Expressions cheaper than this are never hoisted. */
    static final int MIN_SHARED_COST = 2;

    private final FunctoidRegistry registry;
    private final String arraySelector;

    public ShareabilityAnalyzer(FunctoidRegistry registry, String arraySelector) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (arraySelector == null || arraySelector.isEmpty()) {
            throw new IllegalArgumentException("arraySelector must not be null or empty");
        }
        this.arraySelector = arraySelector;
    }

    /**
     * Result of the analysis.
     *
     * @param refCounts   consuming edge count per node id, in node declaration order
     * @param arrayScoped ids of nodes reaching an array target position
     * @param shareable   ids of hoisted nodes, in node declaration order
     */
    public record Report(Map<String, Integer> refCounts, Set<String> arrayScoped, Set<String> shareable) {

        public Report {
            refCounts = Collections.unmodifiableMap(new LinkedHashMap<>(refCounts));
            arrayScoped = Collections.unmodifiableSet(new LinkedHashSet<>(arrayScoped));
            shareable = Collections.unmodifiableSet(new LinkedHashSet<>(shareable));
        }

        public int refCount(String nodeId) {
            return refCounts.getOrDefault(nodeId, 0);
        }

        public boolean isShareable(String nodeId) {
            return shareable.contains(nodeId);
        }
    }

    /**
     * Analyzes the built expressions of a document.
     *
     * @param spec  the (sanitized) document the expressions were built from
     * @param built output of {@link ExpressionBuilder#build}
     */
    public Report analyze(MapSpec spec, ExpressionBuilder.BuildResult built) {
        Map<String, MapNode> nodes = new LinkedHashMap<>();
        for (MapNode node : spec.nodes()) {
            if (node.isValid()) {
                nodes.putIfAbsent(node.id(), node);
            }
        }

        Map<String, Integer> refCounts = refCounts(nodes.keySet(), spec.edges());
        Set<String> arrayScoped = arrayScoped(nodes.keySet(), spec.edges());

        Set<String> shareable = new LinkedHashSet<>();
        for (MapNode node : nodes.values()) {
            String id = node.id();
            Expression expr = built.expressions().get(id);
            if (expr == null || refCounts.get(id) <= 1 || arrayScoped.contains(id)) {
                continue;
            }
            if (!registry.isPure(node.kind())) {
                LOG.debug("Not sharing node {}: kind {} is impure", id, node.kind());
                continue;
            }
            if (cost(expr) < MIN_SHARED_COST) {
                continue;
            }
            shareable.add(id);
        }
        LOG.debug("Shareable nodes: {} (array-scoped: {})", shareable, arrayScoped);
        return new Report(refCounts, arrayScoped, shareable);
    }

    /**
     * Counts, per node, the edges leaving it for another functoid or for the target schema. An
     * edge into the source schema is never a consumer.
     */
    static Map<String, Integer> refCounts(Set<String> nodeIds, List<MapEdge> edges) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String id : nodeIds) {
            counts.put(id, 0);
        }
        for (MapEdge edge : edges) {
            if (counts.containsKey(edge.source()) && !Endpoints.SOURCE_SCHEMA.equals(edge.target())) {
                counts.merge(edge.source(), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Nodes from which some chain of functoid edges reaches a target-schema edge whose handle
     * contains the array selector. Computed backwards from those edges, so every edge is
     * traversed at most once and cycles terminate.
     */
    Set<String> arrayScoped(Set<String> nodeIds, List<MapEdge> edges) {
        Map<String, List<String>> predecessors = new HashMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        Set<String> scoped = new HashSet<>();
        for (MapEdge edge : edges) {
            if (!nodeIds.contains(edge.source())) {
                continue;
            }
            if (edge.toTargetSchema()) {
                String handle = edge.targetHandle();
                if (handle != null && handle.contains(arraySelector) && scoped.add(edge.source())) {
                    worklist.add(edge.source());
                }
            } else if (nodeIds.contains(edge.target())) {
                predecessors.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
            }
        }
        while (!worklist.isEmpty()) {
            String id = worklist.poll();
            for (String predecessor : predecessors.getOrDefault(id, List.of())) {
                if (scoped.add(predecessor)) {
                    worklist.add(predecessor);
                }
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String id : nodeIds) {
            if (scoped.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    /**
     * Structural cost of an expression. Leaves cost 1; a conditional counts only its more
     * expensive branch.
     */
    public static int cost(Expression expr) {
        if (expr instanceof Expression.Binary || expr instanceof Expression.Unary) {
            return 2 + childCost(expr);
        }
        if (expr instanceof Expression.Call) {
            return 3 + childCost(expr);
        }
        if (expr instanceof Expression.Conditional conditional) {
            return 3
                    + cost(conditional.condition())
                    + Math.max(cost(conditional.then()), cost(conditional.otherwise()));
        }
        if (expr instanceof Expression.ArrayLiteral || expr instanceof Expression.ObjectLiteral) {
            return 2 + childCost(expr);
        }
        return 1;
    }

    private static int childCost(Expression expr) {
        int total = 0;
        for (Expression child : expr.children()) {
            total += cost(child);
        }
        return total;
    }
}
