package io.mapperxform.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mapperxform.core.ir.BinaryOperator;
import io.mapperxform.core.ir.Expression;
import io.mapperxform.core.ir.FunctionName;
import io.mapperxform.core.ir.LiteralType;
import io.mapperxform.core.ir.UnaryOperator;
import io.mapperxform.core.model.MapEdge;
import io.mapperxform.core.model.MapNode;
import io.mapperxform.core.model.MapSpec;
import io.mapperxform.core.schema.SyntheticSegments;
import io.mapperxform.core.template.TemplateParams;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one {@link Expression} per functoid node, in dependency order.
 *
 * <p>Nodes are visited with a worklist (Kahn's algorithm): a node is ready once every edge into it
 * starts at the source schema or at an already built node. Nodes that never become ready (part of
 * a cycle, fed by a missing node, or fed from the target schema) stay unbuilt and are reported in
 * {@link BuildResult#unbuiltNodeIds()}.
 *
 * <p>Inputs coming from another functoid are emitted as {@link Expression.UnresolvedRef}
 * placeholders. Whether such an input is later inlined or hoisted is decided by
 * {@link ShareabilityAnalyzer} and applied by {@link SharedReferenceRewriter}.
 *
 * <p>Unknown kinds, malformed constants and missing template inputs degrade to well-defined
 * defaults instead of failing. Thread-safe: stateless apart from its settings.
 */
public final class ExpressionBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionBuilder.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern INPUT_INDEX = Pattern.compile("input-(\\d+)");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private final InputOrdering inputOrdering;

    public ExpressionBuilder(InputOrdering inputOrdering) {
        this.inputOrdering = Objects.requireNonNull(inputOrdering, "inputOrdering must not be null");
    }

    /**
     * Built node expressions plus the nodes that could not be built.
     *
     * @param expressions    expression per built node id, in node declaration order
     * @param unbuiltNodeIds ids of nodes never built, in node declaration order
     */
    public record BuildResult(Map<String, Expression> expressions, List<String> unbuiltNodeIds) {

        public BuildResult {
            expressions = Collections.unmodifiableMap(new LinkedHashMap<>(expressions));
            unbuiltNodeIds = List.copyOf(unbuiltNodeIds);
        }

        public boolean isBuilt(String nodeId) {
            return expressions.containsKey(nodeId);
        }
    }

    /** Builds every buildable node of the document. */
    public BuildResult build(MapSpec spec) {
        Map<String, MapNode> nodes = new LinkedHashMap<>();
        for (MapNode node : spec.nodes()) {
            if (!node.isValid()) {
                LOG.warn("Skipping invalid node: id={}, kind={}", node.id(), node.kind());
                continue;
            }
            if (nodes.putIfAbsent(node.id(), node) != null) {
                LOG.warn("Skipping duplicate node id: {}", node.id());
            }
        }

        Map<String, List<MapEdge>> incoming = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, Integer> pending = new HashMap<>();
        for (String id : nodes.keySet()) {
            incoming.put(id, new ArrayList<>());
            pending.put(id, 0);
        }
        for (MapEdge edge : spec.edges()) {
            List<MapEdge> inputs = incoming.get(edge.target());
            if (inputs == null) {
                continue;
            }
            inputs.add(edge);
            if (!edge.fromSourceSchema()) {
                pending.merge(edge.target(), 1, Integer::sum);
                if (nodes.containsKey(edge.source())) {
                    dependents.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
                }
            }
        }

        Queue<String> ready = new ArrayDeque<>();
        for (String id : nodes.keySet()) {
            if (pending.get(id) == 0) {
                ready.add(id);
            }
        }

        Map<String, Expression> built = new HashMap<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            built.put(id, lowerNode(nodes.get(id), incoming.get(id)));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        Map<String, Expression> ordered = new LinkedHashMap<>();
        List<String> unbuilt = new ArrayList<>();
        for (MapNode node : spec.nodes()) {
            String id = node.id();
            if (id == null || id.isBlank() || ordered.containsKey(id) || unbuilt.contains(id)) {
                continue;
            }
            if (built.containsKey(id)) {
                ordered.put(id, built.get(id));
            } else {
                unbuilt.add(id);
            }
        }
        if (!unbuilt.isEmpty()) {
            LOG.warn("Nodes not built (cycle, missing predecessor or invalid node): {}", unbuilt);
        }
        return new BuildResult(ordered, unbuilt);
    }

    /**
     * Builds the expression of a single node from its incoming edges. Inputs are ordered by the
     * {@code input-<N>} index of their target handle.
     */
    Expression lowerNode(MapNode node, List<MapEdge> inputEdges) {
        List<Expression> inputs = new ArrayList<>();
        for (MapEdge edge : orderInputs(inputEdges)) {
            inputs.add(sourceExpression(edge));
        }
        JsonNode config = node.config();

        switch (node.kind()) {
            // Binary arithmetic
            case "Binary.Add":
                return binary(BinaryOperator.ADD, inputs);
            case "Binary.Subtract":
                return binary(BinaryOperator.SUBTRACT, inputs);
            case "Binary.Multiply":
                return binary(BinaryOperator.MULTIPLY, inputs);
            case "Binary.Divide":
                return binary(BinaryOperator.DIVIDE, inputs);
            case "Binary.Modulo":
                return binary(BinaryOperator.MODULO, inputs);
            case "Binary.Power":
                return binary(BinaryOperator.POWER, inputs);

            // Binary comparison
            case "Binary.Equal":
                return binary(BinaryOperator.EQUAL, inputs);
            case "Binary.NotEqual":
                return binary(BinaryOperator.NOT_EQUAL, inputs);
            case "Binary.LessThan":
                return binary(BinaryOperator.LESS_THAN, inputs);
            case "Binary.LessThanOrEqual":
                return binary(BinaryOperator.LESS_EQUAL, inputs);
            case "Binary.GreaterThan":
                return binary(BinaryOperator.GREATER_THAN, inputs);
            case "Binary.GreaterThanOrEqual":
                return binary(BinaryOperator.GREATER_EQUAL, inputs);

            // Binary logical
            case "Binary.And":
                return binary(BinaryOperator.AND, inputs);
            case "Binary.Or":
                return binary(BinaryOperator.OR, inputs);

            // Unary
            case "Unary.Not":
                return Expression.unary(UnaryOperator.NOT, input(inputs, 0));
            case "Unary.Negate":
                return Expression.unary(UnaryOperator.NEGATE, input(inputs, 0));
            case "Unary.Abs":
                return Expression.unary(UnaryOperator.ABS, input(inputs, 0));
            case "Unary.Ceil":
                return Expression.unary(UnaryOperator.CEIL, input(inputs, 0));
            case "Unary.Floor":
                return Expression.unary(UnaryOperator.FLOOR, input(inputs, 0));
            case "Unary.Round":
                return Expression.unary(UnaryOperator.ROUND, input(inputs, 0));
            case "Unary.Sqrt":
                return Expression.unary(UnaryOperator.SQRT, input(inputs, 0));

            // String
            case "String.Concat":
                return concat(inputs);
            case "String.Uppercase":
                return Expression.call(FunctionName.UPPERCASE, inputs);
            case "String.Lowercase":
                return Expression.call(FunctionName.LOWERCASE, inputs);
            case "String.Trim":
                return Expression.call(FunctionName.TRIM, inputs);
            case "String.Length":
                return Expression.call(FunctionName.LENGTH, inputs);
            case "String.Substring":
                return Expression.call(FunctionName.SUBSTRING, inputs);
            case "String.Replace":
                return Expression.call(FunctionName.REPLACE, inputs, config);
            case "String.Split":
                return Expression.call(FunctionName.SPLIT, inputs, config);
            case "String.Join":
                return Expression.call(FunctionName.JOIN, inputs, config);
            case "String.Template":
            case "String.UrlTemplate":
                return template(inputs, node.configText("template"));

            // Conditional
            case "Conditional.If":
                return Expression.conditional(input(inputs, 0), input(inputs, 1), input(inputs, 2));
            case "Conditional.DefaultValue":
                return Expression.conditional(
                        Expression.binary(BinaryOperator.NOT_EQUAL, input(inputs, 0), Expression.nullLiteral()),
                        input(inputs, 0),
                        input(inputs, 1));
            case "Conditional.Switch":
                return switchExpr(input(inputs, 0), config);

            // Collection
            case "Collection.Map":
                return Expression.call(FunctionName.MAP, inputs);
            case "Collection.Filter":
                return Expression.call(FunctionName.FILTER, inputs);
            case "Collection.Count":
            case "Aggregate.Count":
                return Expression.call(FunctionName.COUNT, inputs);
            case "Collection.Distinct":
                return Expression.call(FunctionName.DISTINCT, inputs);
            case "Collection.Sort":
                return Expression.call(FunctionName.SORT, inputs);
            case "Collection.Reverse":
                return Expression.call(FunctionName.REVERSE, inputs);
            case "Collection.Flatten":
                return Expression.call(FunctionName.FLATTEN, inputs);

            // Aggregate
            case "Aggregate.Sum":
                return Expression.call(FunctionName.SUM, inputs);
            case "Aggregate.Average":
                return Expression.call(FunctionName.AVERAGE, inputs);
            case "Aggregate.Min":
                return Expression.call(FunctionName.MIN, inputs);
            case "Aggregate.Max":
                return Expression.call(FunctionName.MAX, inputs);

            // Conversion
            case "Convert.ToString":
                return Expression.call(FunctionName.TO_STRING, inputs);
            case "Convert.ToNumber":
                return Expression.call(FunctionName.TO_NUMBER, inputs);
            case "Convert.ToBoolean":
                return Expression.call(FunctionName.TO_BOOLEAN, inputs);
            case "Convert.ToInteger":
                return Expression.call(FunctionName.TO_INTEGER, inputs);
            case "Convert.ToArray":
                return Expression.call(FunctionName.TO_ARRAY, inputs);
            case "Convert.ToDate":
                return Expression.call(FunctionName.TO_DATE, inputs);
            case "Convert.ParseJSON":
                return Expression.call(FunctionName.PARSE_JSON, inputs);
            case "Convert.StringifyJSON":
                return Expression.call(FunctionName.STRINGIFY_JSON, inputs);

            // Date/time
            case "DateTime.Now":
                return Expression.call(FunctionName.NOW, List.of());
            case "DateTime.Format":
                return Expression.call(FunctionName.FORMAT_DATE, inputs, config);
            case "DateTime.Parse":
                return Expression.call(FunctionName.PARSE_DATE, inputs);
            case "DateTime.AddDays":
                return Expression.call(FunctionName.ADD_DAYS, inputs);
            case "DateTime.AddMonths":
                return Expression.call(FunctionName.ADD_MONTHS, inputs);
            case "DateTime.Diff":
                return Expression.call(FunctionName.DATE_DIFF, inputs);

            // Constant and custom
            case "Const.Value":
                return constValue(config);
            case "Custom.Function":
                return Expression.call(FunctionName.CUSTOM, inputs, config);

            default:
                LOG.debug("Unknown functoid kind '{}' on node {}, emitting null", node.kind(), node.id());
                return Expression.nullLiteral();
        }
    }

    // ── Inputs ──

    List<MapEdge> orderInputs(List<MapEdge> edges) {
        List<MapEdge> indexed = new ArrayList<>();
        List<MapEdge> unindexed = new ArrayList<>();
        for (MapEdge edge : edges) {
            if (inputIndex(edge.targetHandle()) >= 0 || inputOrdering == InputOrdering.LEGACY_INDEX_ZERO) {
                indexed.add(edge);
            } else {
                unindexed.add(edge);
            }
        }
        // List.sort is stable, so equal indices keep edge order
        indexed.sort(Comparator.comparingInt(edge -> Math.max(0, inputIndex(edge.targetHandle()))));
        indexed.addAll(unindexed);
        return indexed;
    }

    /** Index encoded as {@code input-<N>} in the handle, or {@code -1} if there is none. */
    static int inputIndex(String handle) {
        if (handle == null) {
            return -1;
        }
        Matcher matcher = INPUT_INDEX.matcher(handle);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static Expression sourceExpression(MapEdge edge) {
        if (edge.fromSourceSchema()) {
            return Expression.field(SyntheticSegments.cleanPath(edge.sourceHandle()));
        }
        return new Expression.UnresolvedRef(edge.source());
    }

    private static Expression input(List<Expression> inputs, int index) {
        return index < inputs.size() ? inputs.get(index) : Expression.nullLiteral();
    }

    // ── Construction rules ──

    private static Expression binary(BinaryOperator operator, List<Expression> inputs) {
        return Expression.binary(operator, input(inputs, 0), input(inputs, 1));
    }

    /** Left-folded chain of {@code concat}: {@code ((a + b) + c)}. */
    static Expression concat(List<Expression> parts) {
        if (parts.isEmpty()) {
            return Expression.string("");
        }
        Expression result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = Expression.binary(BinaryOperator.CONCAT, result, parts.get(i));
        }
        return result;
    }

    /**
     * Splits the template at its placeholders; the i-th distinct parameter is bound to the i-th
     * input, or to an empty string when fewer inputs are connected.
     */
    static Expression template(List<Expression> inputs, String template) {
        if (template == null || template.isEmpty()) {
            return Expression.string("");
        }
        List<Expression> parts = new ArrayList<>();
        for (TemplateParams.Segment segment : TemplateParams.split(template)) {
            if (!segment.isParam()) {
                parts.add(Expression.string(segment.text()));
            } else if (segment.paramIndex() < inputs.size()) {
                parts.add(inputs.get(segment.paramIndex()));
            } else {
                parts.add(Expression.string(""));
            }
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return concat(parts);
    }

    /** Nested conditionals built right to left, ending in the default value or {@code null}. */
    static Expression switchExpr(Expression input, JsonNode config) {
        JsonNode defaultValue = config.get("default");
        Expression result = defaultValue != null && !defaultValue.isNull() && !defaultValue.asText().isEmpty()
                ? Expression.string(defaultValue.asText())
                : Expression.nullLiteral();

        JsonNode cases = config.path("cases");
        if (!cases.isArray()) {
            return result;
        }
        for (int i = cases.size() - 1; i >= 0; i--) {
            JsonNode caseItem = cases.get(i);
            Expression condition = Expression.binary(
                    BinaryOperator.EQUAL, input, Expression.string(caseItem.path("when").asText()));
            result = Expression.conditional(condition, Expression.string(caseItem.path("then").asText()), result);
        }
        return result;
    }

    /** Typed literal from {@code config.value}, interpreted per {@code config.type}. */
    static Expression constValue(JsonNode config) {
        JsonNode valueNode = config.get("value");
        String value;
        if (valueNode == null || valueNode.isNull()) {
            value = null;
        } else {
            // arrays and objects written inline are handled like their JSON text
            value = valueNode.isContainerNode() ? valueNode.toString() : valueNode.asText();
        }
        String type = config.path("type").asText("string");
        if (type.isEmpty()) {
            type = "string";
        }

        switch (type) {
            case "string":
                return Expression.string(value);
            case "boolean":
                return new Expression.Literal("true".equals(value), LiteralType.BOOLEAN);
            case "integer":
                return integerLiteral(value);
            case "number":
                return numberLiteral(value);
            case "null":
                return Expression.nullLiteral();
            case "object":
            case "array":
                return jsonLiteral(value);
            default:
                return Expression.string(value);
        }
    }

    private static Expression integerLiteral(String value) {
        Matcher matcher = value == null ? null : LEADING_INTEGER.matcher(value);
        if (matcher == null || !matcher.find()) {
            return Expression.string(value);
        }
        try {
            return new Expression.Literal(Long.parseLong(matcher.group(1)), LiteralType.INTEGER);
        } catch (NumberFormatException e) {
            return Expression.string(value);
        }
    }

    private static Expression numberLiteral(String value) {
        Matcher matcher = value == null ? null : LEADING_NUMBER.matcher(value);
        if (matcher == null || !matcher.find()) {
            return Expression.string(value);
        }
        try {
            double parsed = Double.parseDouble(matcher.group(1));
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                return Expression.string(value);
            }
            return new Expression.Literal(parsed, LiteralType.NUMBER);
        } catch (NumberFormatException e) {
            return Expression.string(value);
        }
    }

    /** Object/array constants: a JSON array becomes an array of literals, anything else a string. */
    private static Expression jsonLiteral(String value) {
        if (value == null) {
            return Expression.string(null);
        }
        JsonNode parsed;
        try {
            parsed = JSON.readTree(value);
        } catch (IOException e) {
            return Expression.string(value);
        }
        if (parsed == null || !parsed.isArray()) {
            return Expression.string(value);
        }
        List<Expression> elements = new ArrayList<>(parsed.size());
        for (JsonNode element : parsed) {
            elements.add(elementLiteral(element));
        }
        return new Expression.ArrayLiteral(elements);
    }

    private static Expression elementLiteral(JsonNode element) {
        if (element.isNull()) {
            return Expression.nullLiteral();
        }
        if (element.isBoolean()) {
            return new Expression.Literal(element.booleanValue(), LiteralType.BOOLEAN);
        }
        if (element.isNumber()) {
            Object number = element.isIntegralNumber() && element.canConvertToLong()
                    ? (Object) element.longValue()
                    : (Object) element.doubleValue();
            return new Expression.Literal(number, LiteralType.NUMBER);
        }
        // strings stay strings; nested objects and arrays are carried as their JSON text
        return Expression.string(element.isTextual() ? element.textValue() : element.toString());
    }
}
