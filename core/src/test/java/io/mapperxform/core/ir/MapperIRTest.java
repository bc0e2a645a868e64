package io.mapperxform.core.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.mapperxform.core.model.MapperMetadata;
import io.mapperxform.core.model.SchemaSet;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MapperIRTest {

    @Test
    void rejectsUnresolvedReferenceInMapping() {
        FieldMapping mapping = new FieldMapping(
                "out",
                Expression.binary(BinaryOperator.CONCAT, Expression.string("x"), new Expression.UnresolvedRef("n1")));

        assertThatThrownBy(() -> new MapperIR(
                        MapperIR.VERSION, SchemaSet.NONE, List.of(mapping), null, MapperMetadata.named("m")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("n1")
                .hasMessageContaining("mapping 'out'");
    }

    @Test
    void rejectsUnresolvedReferenceInSharedExpression() {
        SharedExpression shared = new SharedExpression(
                "n2", "$n2", Expression.unary(UnaryOperator.NOT, new Expression.UnresolvedRef("n3")), null, 2);

        assertThatThrownBy(() ->
                        new MapperIR(MapperIR.VERSION, null, List.of(), List.of(shared), MapperMetadata.named("m")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("n3");
    }

    @Test
    void sharedSubtreesAreCheckedOncePerInstance() {
        Expression expr = Expression.field("x");
        for (int i = 0; i < 64; i++) {
            expr = Expression.binary(BinaryOperator.MULTIPLY, expr, expr);
        }
        Expression deep = expr;

        MapperIR ir = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> new MapperIR(
                MapperIR.VERSION, null, List.of(new FieldMapping("out", deep)), null, MapperMetadata.named("m")));

        assertThat(ir.mappings()).hasSize(1);
    }

    @Test
    void emptySharedListIsNormalisedToAbsent() {
        MapperIR ir = new MapperIR(MapperIR.VERSION, null, null, List.of(), MapperMetadata.named("m"));

        assertThat(ir.sharedExpressions()).isNull();
        assertThat(ir.shared()).isEmpty();
        assertThat(ir.schemas()).isEqualTo(SchemaSet.NONE);
        assertThat(ir.mappings()).isEmpty();
    }

    @Test
    void lookupsByNodeAndTarget() {
        Expression add = Expression.binary(BinaryOperator.ADD, Expression.field("a"), Expression.field("b"));
        MapperIR ir = new MapperIR(
                MapperIR.VERSION,
                SchemaSet.NONE,
                List.of(new FieldMapping("total", new Expression.SharedRef("n", "$n"))),
                List.of(new SharedExpression("n", "$n", add, "add", 2)),
                MapperMetadata.named("m"));

        assertThat(ir.sharedFor("n")).map(SharedExpression::expression).contains(add);
        assertThat(ir.sharedFor("other")).isEmpty();
        assertThat(ir.mappingFor("total")).isPresent();
        assertThat(ir.mappingFor("missing")).isEmpty();
    }

    @Test
    void sharedRefRequiresName() {
        assertThatThrownBy(() -> new Expression.SharedRef("n", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("varName");
    }

    @Test
    void childrenFollowEvaluationOrder() {
        Expression cond = Expression.field("c");
        Expression then = Expression.string("t");
        Expression otherwise = Expression.nullLiteral();

        assertThat(Expression.conditional(cond, then, otherwise).children()).containsExactly(cond, then, otherwise);
        assertThat(Expression.field("x").children()).isEmpty();
    }
}
