package io.mapperxform.core.compiler;

import io.mapperxform.core.ir.Expression;
import io.mapperxform.core.ir.FieldMapping;
import io.mapperxform.core.ir.MapperIR;
import io.mapperxform.core.ir.SharedExpression;
import io.mapperxform.core.model.MapEdge;
import io.mapperxform.core.model.MapNode;
import io.mapperxform.core.model.MapSpec;
import io.mapperxform.core.registry.FunctoidRegistry;
import io.mapperxform.core.registry.OperationDefinition;
import io.mapperxform.core.schema.SyntheticSegments;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a mapping graph into a {@link MapperIR}.
 *
 * <p>Pipeline: {@link GraphSanitizer} → {@link ExpressionBuilder} → {@link ShareabilityAnalyzer}
 * → {@link SharedReferenceRewriter} → {@link LivenessCollector} → IR assembly.
 *
 * <p>The compiler is meant to run on every edit of a document that is often transiently
 * invalid, so it never throws for a structurally parseable document: orphaned edges are dropped,
 * unbuildable nodes become {@code null} and unknown kinds compile to {@code null}. What was
 * dropped is reported in the {@link CompilationResult} and logged.
 *
 * <p>Thread-safe: each call works on its own state; the registry and settings are immutable.
 */
public final class MapperCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MapperCompiler.class);

    private final FunctoidRegistry registry;
    private final CompilerSettings settings;
    private final GraphSanitizer sanitizer = new GraphSanitizer();
    private final ExpressionBuilder builder;
    private final ShareabilityAnalyzer analyzer;

    /** Compiler over the standard functoid catalogue with default settings. */
    public MapperCompiler() {
        this(FunctoidRegistry.standard(), CompilerSettings.DEFAULT);
    }

    public MapperCompiler(FunctoidRegistry registry, CompilerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.builder = new ExpressionBuilder(settings.inputOrdering());
        this.analyzer = new ShareabilityAnalyzer(registry, settings.arraySelector());
    }

    /** Compiles and returns only the IR. */
    public MapperIR lower(MapSpec spec) {
        return compile(spec).ir();
    }

    /**
     * Compiles a document.
     *
     * @param spec the document; not modified
     * @return the IR plus what sanitation and the build dropped
     */
    public CompilationResult compile(MapSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String name = spec.metadata().name();

        SanitizeResult sanitized = settings.sanitize() ? sanitizer.sanitize(spec) : new SanitizeResult(spec, List.of());
        MapSpec clean = sanitized.spec();

        ExpressionBuilder.BuildResult built = builder.build(clean);
        ShareabilityAnalyzer.Report report = analyzer.analyze(clean, built);
        SharedReferenceRewriter rewriter = new SharedReferenceRewriter(built.expressions(), report.shareable());

        List<FieldMapping> mappings = new ArrayList<>();
        for (MapEdge edge : clean.edges()) {
            if (!edge.toTargetSchema()) {
                continue;
            }
            Expression value = edge.fromSourceSchema()
                    ? Expression.field(SyntheticSegments.cleanPath(edge.sourceHandle()))
                    : rewriter.reference(edge.source());
            mappings.add(new FieldMapping(SyntheticSegments.cleanPath(edge.targetHandle()), value));
        }

        List<Expression> roots = new ArrayList<>(mappings.size());
        mappings.forEach(m -> roots.add(m.expression()));
        Set<String> live = LivenessCollector.collect(roots, rewriter::rewriteNode);

        Map<String, String> kinds = new HashMap<>();
        for (MapNode node : clean.nodes()) {
            if (node.isValid()) {
                kinds.putIfAbsent(node.id(), node.kind());
            }
        }

        List<SharedExpression> shared = new ArrayList<>();
        for (String nodeId : report.shareable()) {
            if (!live.contains(nodeId)) {
                LOG.debug("Dropping unreferenced shared node {}", nodeId);
                continue;
            }
            String hint = registry.find(kinds.get(nodeId))
                    .map(OperationDefinition::variableHint)
                    .orElse(null);
            shared.add(new SharedExpression(
                    nodeId,
                    SharedReferenceRewriter.varName(nodeId),
                    rewriter.rewriteNode(nodeId),
                    hint,
                    report.refCount(nodeId)));
        }

        MapperIR ir = new MapperIR(MapperIR.VERSION, clean.schemas(), mappings, shared, clean.metadata());
        LOG.info(
                "Compiled mapper '{}': {} mappings, {} shared expressions, {} edges removed, {} nodes unbuilt",
                name,
                mappings.size(),
                shared.size(),
                sanitized.removedEdgeIds().size(),
                built.unbuiltNodeIds().size());
        return new CompilationResult(ir, clean, sanitized.removedEdgeIds(), built.unbuiltNodeIds());
    }

    public FunctoidRegistry registry() {
        return registry;
    }

    public CompilerSettings settings() {
        return settings;
    }
}
