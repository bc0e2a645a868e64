package io.mapperxform.core.compiler;

import static io.mapperxform.core.compiler.Graphs.graph;
import static io.mapperxform.core.compiler.Graphs.json;
import static org.assertj.core.api.Assertions.assertThat;

import io.mapperxform.core.ir.BinaryOperator;
import io.mapperxform.core.ir.Expression;
import io.mapperxform.core.ir.FunctionName;
import io.mapperxform.core.ir.LiteralType;
import io.mapperxform.core.ir.UnaryOperator;
import io.mapperxform.core.model.MapNode;
import io.mapperxform.core.model.MapSpec;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionBuilderTest {

    private final ExpressionBuilder builder = new ExpressionBuilder(InputOrdering.APPEND_UNINDEXED);

    private static Expression field(String path) {
        return Expression.field(path);
    }

    private static Expression str(String value) {
        return Expression.string(value);
    }

    private Expression buildSingle(MapSpec spec, String nodeId) {
        ExpressionBuilder.BuildResult result = builder.build(spec);
        assertThat(result.isBuilt(nodeId)).as("node %s built", nodeId).isTrue();
        return result.expressions().get(nodeId);
    }

    @Nested
    class Inputs {

        @Test
        void inputsAreOrderedByHandleIndex() {
            MapSpec spec = graph().node("sub", "Binary.Subtract")
                    .field("b", "sub", 1)
                    .field("a", "sub", 0)
                    .build();

            assertThat(buildSingle(spec, "sub"))
                    .isEqualTo(Expression.binary(BinaryOperator.SUBTRACT, field("a"), field("b")));
        }

        @Test
        void unindexedInputsAreAppended() {
            MapSpec spec = graph().node("concat", "String.Concat")
                    .edge("source-schema", "$.x", "concat", "in")
                    .field("a", "concat", 0)
                    .field("b", "concat", 1)
                    .build();

            assertThat(buildSingle(spec, "concat"))
                    .isEqualTo(Expression.binary(
                            BinaryOperator.CONCAT,
                            Expression.binary(BinaryOperator.CONCAT, field("a"), field("b")),
                            field("x")));
        }

        @Test
        void legacyOrderingPlacesUnindexedInputsAtZero() {
            ExpressionBuilder legacy = new ExpressionBuilder(InputOrdering.LEGACY_INDEX_ZERO);
            MapSpec spec = graph().node("sub", "Binary.Subtract")
                    .field("b", "sub", 1)
                    .edge("source-schema", "$.x", "sub", "in")
                    .field("a", "sub", 0)
                    .build();

            // x and a both sort at position 0; edge order breaks the tie
            assertThat(legacy.build(spec).expressions().get("sub"))
                    .isEqualTo(Expression.binary(BinaryOperator.SUBTRACT, field("x"), field("a")));
        }

        @Test
        void functoidInputsBecomePlaceholders() {
            MapSpec spec = graph().node("up", "String.Uppercase")
                    .node("trim", "String.Trim")
                    .field("name", "trim", 0)
                    .wire("trim", "up", 0)
                    .build();

            assertThat(buildSingle(spec, "up"))
                    .isEqualTo(Expression.call(FunctionName.UPPERCASE, List.of(new Expression.UnresolvedRef("trim"))));
        }

        @Test
        void syntheticSegmentsAreRemovedFromFieldPaths() {
            MapSpec spec = graph().node("len", "String.Length")
                    .edge("source-schema", "$.config.__SYNTH__[type=6] HTTP Task.url", "len", "input-0")
                    .build();

            assertThat(buildSingle(spec, "len"))
                    .isEqualTo(Expression.call(FunctionName.LENGTH, List.of(field("config.url"))));
        }

        @Test
        void inputIndexIsFoundAnywhereInHandle() {
            assertThat(ExpressionBuilder.inputIndex("input-12")).isEqualTo(12);
            assertThat(ExpressionBuilder.inputIndex("param-input-3")).isEqualTo(3);
            assertThat(ExpressionBuilder.inputIndex("value")).isEqualTo(-1);
            assertThat(ExpressionBuilder.inputIndex(null)).isEqualTo(-1);
        }
    }

    @Nested
    class Operations {

        @Test
        void missingBinaryOperandIsNull() {
            MapSpec spec = graph().node("eq", "Binary.Equal").field("a", "eq", 0).build();

            assertThat(buildSingle(spec, "eq"))
                    .isEqualTo(Expression.binary(BinaryOperator.EQUAL, field("a"), Expression.nullLiteral()));
        }

        @Test
        void unaryUsesFirstInput() {
            MapSpec spec = graph().node("abs", "Unary.Abs").field("a", "abs", 0).build();

            assertThat(buildSingle(spec, "abs")).isEqualTo(Expression.unary(UnaryOperator.ABS, field("a")));
        }

        @Test
        void concatFoldsAllInputs() {
            MapSpec empty = graph().node("c", "String.Concat").build();
            MapSpec single = graph().node("c", "String.Concat").field("a", "c", 0).build();
            MapSpec triple = graph().node("c", "String.Concat")
                    .field("a", "c", 0)
                    .field("b", "c", 1)
                    .field("d", "c", 2)
                    .build();

            assertThat(buildSingle(empty, "c")).isEqualTo(str(""));
            assertThat(buildSingle(single, "c")).isEqualTo(field("a"));
            assertThat(buildSingle(triple, "c"))
                    .isEqualTo(Expression.binary(
                            BinaryOperator.CONCAT,
                            Expression.binary(BinaryOperator.CONCAT, field("a"), field("b")),
                            field("d")));
        }

        @Test
        void configuredStringCallsCarryConfig() {
            MapSpec spec = graph().node("join", "String.Join", "{\"separator\":\", \"}")
                    .field("tags", "join", 0)
                    .build();

            Expression.Call call = (Expression.Call) buildSingle(spec, "join");

            assertThat(call.function()).isEqualTo(FunctionName.JOIN);
            assertThat(call.config()).isEqualTo(json("{\"separator\":\", \"}"));
        }

        @Test
        void templateWithBoundInputsBecomesConcatChain() {
            MapSpec spec = graph().node("url", "String.Template", "{\"template\":\"http://{host}/api/{id}\"}")
                    .field("host", "url", 0)
                    .field("id", "url", 1)
                    .build();

            Expression expected = Expression.binary(
                    BinaryOperator.CONCAT,
                    Expression.binary(
                            BinaryOperator.CONCAT,
                            Expression.binary(BinaryOperator.CONCAT, str("http://"), field("host")),
                            str("/api/")),
                    field("id"));
            assertThat(buildSingle(spec, "url")).isEqualTo(expected);
        }

        @Test
        void templateWithoutInputsUsesEmptyStrings() {
            MapSpec spec = graph().node("url", "String.UrlTemplate", "{\"template\":\"http://{host}/api/{id}\"}")
                    .build();

            Expression expected = Expression.binary(
                    BinaryOperator.CONCAT,
                    Expression.binary(
                            BinaryOperator.CONCAT,
                            Expression.binary(BinaryOperator.CONCAT, str("http://"), str("")),
                            str("/api/")),
                    str(""));
            assertThat(buildSingle(spec, "url")).isEqualTo(expected);
        }

        @Test
        void templateEdgeCases() {
            assertThat(ExpressionBuilder.template(List.of(), "")).isEqualTo(str(""));
            assertThat(ExpressionBuilder.template(List.of(), null)).isEqualTo(str(""));
            assertThat(ExpressionBuilder.template(List.of(field("x")), "{only}")).isEqualTo(field("x"));
            assertThat(ExpressionBuilder.template(List.of(), "static text")).isEqualTo(str("static text"));
        }

        @Test
        void defaultValueDesugarsToNullCheck() {
            MapSpec spec = graph().node("dv", "Conditional.DefaultValue")
                    .field("nick", "dv", 0)
                    .field("name", "dv", 1)
                    .build();

            assertThat(buildSingle(spec, "dv"))
                    .isEqualTo(Expression.conditional(
                            Expression.binary(BinaryOperator.NOT_EQUAL, field("nick"), Expression.nullLiteral()),
                            field("nick"),
                            field("name")));
        }

        @Test
        void switchDesugarsRightToLeft() {
            MapSpec spec = graph().node(
                            "sw",
                            "Conditional.Switch",
                            "{\"cases\":[{\"when\":\"A\",\"then\":\"Alpha\"},{\"when\":\"B\",\"then\":\"Beta\"}],"
                                    + "\"default\":\"Other\"}")
                    .field("code", "sw", 0)
                    .build();

            Expression expected = Expression.conditional(
                    Expression.binary(BinaryOperator.EQUAL, field("code"), str("A")),
                    str("Alpha"),
                    Expression.conditional(
                            Expression.binary(BinaryOperator.EQUAL, field("code"), str("B")),
                            str("Beta"),
                            str("Other")));
            assertThat(buildSingle(spec, "sw")).isEqualTo(expected);
        }

        @Test
        void switchWithoutDefaultEndsInNull() {
            assertThat(ExpressionBuilder.switchExpr(field("x"), json("{}"))).isEqualTo(Expression.nullLiteral());
        }

        @Test
        void nowTakesNoArguments() {
            MapSpec spec = graph().node("now", "DateTime.Now").field("ignored", "now", 0).build();

            assertThat(buildSingle(spec, "now")).isEqualTo(Expression.call(FunctionName.NOW, List.of()));
        }

        @Test
        void customFunctionIsOpaqueCall() {
            MapSpec spec = graph().node("fn", "Custom.Function", "{\"name\":\"score\",\"code\":\"x * 2\"}")
                    .field("x", "fn", 0)
                    .build();

            Expression.Call call = (Expression.Call) buildSingle(spec, "fn");

            assertThat(call.function()).isEqualTo(FunctionName.CUSTOM);
            assertThat(call.args()).containsExactly(field("x"));
            assertThat(call.config().path("name").asText()).isEqualTo("score");
        }

        @Test
        void unknownKindBecomesNull() {
            MapSpec spec = graph().node("odd", "Vendor.Magic").field("a", "odd", 0).build();

            assertThat(buildSingle(spec, "odd")).isEqualTo(Expression.nullLiteral());
        }
    }

    @Nested
    class Constants {

        private Expression constant(String config) {
            return ExpressionBuilder.constValue(json(config));
        }

        @Test
        void stringIsTheDefaultType() {
            assertThat(constant("{\"value\":\"hello\"}")).isEqualTo(str("hello"));
        }

        @Test
        void booleanIsTrueOnlyForLiteralTrue() {
            assertThat(constant("{\"type\":\"boolean\",\"value\":\"true\"}"))
                    .isEqualTo(new Expression.Literal(true, LiteralType.BOOLEAN));
            assertThat(constant("{\"type\":\"boolean\",\"value\":\"yes\"}"))
                    .isEqualTo(new Expression.Literal(false, LiteralType.BOOLEAN));
        }

        @Test
        void integerParsesLeadingDigits() {
            assertThat(constant("{\"type\":\"integer\",\"value\":\"42abc\"}"))
                    .isEqualTo(new Expression.Literal(42L, LiteralType.INTEGER));
            assertThat(constant("{\"type\":\"integer\",\"value\":\"abc\"}")).isEqualTo(str("abc"));
        }

        @Test
        void numberParsesDecimal() {
            assertThat(constant("{\"type\":\"number\",\"value\":\"3.5\"}"))
                    .isEqualTo(new Expression.Literal(3.5, LiteralType.NUMBER));
            assertThat(constant("{\"type\":\"number\",\"value\":\"n/a\"}")).isEqualTo(str("n/a"));
        }

        @Test
        void nullType() {
            assertThat(constant("{\"type\":\"null\",\"value\":\"whatever\"}")).isEqualTo(Expression.nullLiteral());
        }

        @Test
        void arrayBecomesArrayOfTypedLiterals() {
            Expression result = constant("{\"type\":\"array\",\"value\":\"[1, \\\"x\\\", true, null, 2.5]\"}");

            assertThat(result)
                    .isEqualTo(new Expression.ArrayLiteral(List.of(
                            new Expression.Literal(1L, LiteralType.NUMBER),
                            str("x"),
                            new Expression.Literal(true, LiteralType.BOOLEAN),
                            Expression.nullLiteral(),
                            new Expression.Literal(2.5, LiteralType.NUMBER))));
        }

        @Test
        void objectAndMalformedJsonStayStrings() {
            assertThat(constant("{\"type\":\"object\",\"value\":\"{\\\"a\\\":1}\"}")).isEqualTo(str("{\"a\":1}"));
            assertThat(constant("{\"type\":\"array\",\"value\":\"[1,\"}")).isEqualTo(str("[1,"));
        }

        @Test
        void numberParsesLeadingDecimalLikeInteger() {
            assertThat(constant("{\"type\":\"number\",\"value\":\"12abc\"}"))
                    .isEqualTo(new Expression.Literal(12.0, LiteralType.NUMBER));
            assertThat(constant("{\"type\":\"number\",\"value\":\" -1.5e2kg\"}"))
                    .isEqualTo(new Expression.Literal(-150.0, LiteralType.NUMBER));
            assertThat(constant("{\"type\":\"number\",\"value\":\"1.5f\"}"))
                    .isEqualTo(new Expression.Literal(1.5, LiteralType.NUMBER));
            assertThat(constant("{\"type\":\"number\",\"value\":\"1e999\"}")).isEqualTo(str("1e999"));
        }

        @Test
        void inlineJsonArrayValueIsKept() {
            assertThat(constant("{\"type\":\"array\",\"value\":[1, \"x\"]}"))
                    .isEqualTo(new Expression.ArrayLiteral(
                            List.of(new Expression.Literal(1L, LiteralType.NUMBER), str("x"))));
        }

        @Test
        void inlineJsonObjectValueKeepsItsText() {
            assertThat(constant("{\"type\":\"object\",\"value\":{\"a\":1}}")).isEqualTo(str("{\"a\":1}"));
        }

        @Test
        void unrecognisedTypeKeepsRawValue() {
            assertThat(constant("{\"type\":\"decimal\",\"value\":\"[1]\"}")).isEqualTo(str("[1]"));
        }
    }

    @Nested
    class Ordering {

        @Test
        void chainIsBuiltRegardlessOfDeclarationOrder() {
            MapSpec spec = graph().node("outer", "Unary.Negate")
                    .node("inner", "Unary.Abs")
                    .wire("inner", "outer", 0)
                    .field("a", "inner", 0)
                    .build();

            ExpressionBuilder.BuildResult result = builder.build(spec);

            assertThat(result.unbuiltNodeIds()).isEmpty();
            assertThat(result.expressions()).containsOnlyKeys("outer", "inner");
            assertThat(result.expressions().keySet()).containsExactly("outer", "inner");
        }

        @Test
        void cycleMembersAndTheirDependentsStayUnbuilt() {
            MapSpec spec = graph().node("x", "Unary.Negate")
                    .node("y", "Unary.Abs")
                    .node("z", "String.Uppercase")
                    .node("ok", "String.Trim")
                    .wire("x", "y", 0)
                    .wire("y", "x", 0)
                    .wire("y", "z", 0)
                    .field("s", "ok", 0)
                    .build();

            ExpressionBuilder.BuildResult result = builder.build(spec);

            assertThat(result.unbuiltNodeIds()).containsExactly("x", "y", "z");
            assertThat(result.isBuilt("ok")).isTrue();
        }

        @Test
        void inputFromMissingNodeOrTargetSchemaBlocksBuild() {
            MapSpec spec = graph().node("a", "Unary.Not")
                    .node("b", "Unary.Not")
                    .wire("ghost", "a", 0)
                    .edge("target-schema", "$.x", "b", "input-0")
                    .build();

            assertThat(builder.build(spec).unbuiltNodeIds()).containsExactly("a", "b");
        }

        @Test
        void invalidNodesAreSkippedAndReported() {
            MapSpec spec = graph().node(new MapNode("blank-kind", " "))
                    .node(new MapNode(null, "Binary.Add"))
                    .node("fine", "Unary.Not")
                    .build();

            ExpressionBuilder.BuildResult result = builder.build(spec);

            assertThat(result.unbuiltNodeIds()).containsExactly("blank-kind");
            assertThat(result.expressions()).containsOnlyKeys("fine");
        }
    }
}
