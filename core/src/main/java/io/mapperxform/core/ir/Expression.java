package io.mapperxform.core.ir;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of the mapper intermediate representation. A closed sum type: every variant is known at
 * compile time and code generators must handle each of them.
 *
 * <p>Two reference variants exist. {@link UnresolvedRef} is a placeholder produced while building
 * node expressions; it names the functoid whose output is consumed without deciding yet whether
 * that output is inlined or hoisted. {@link SharedRef} is the resolved form pointing at a hoisted
 * {@link SharedExpression}. A {@link MapperIR} never contains an {@code UnresolvedRef}.
 *
 * <p>All variants are immutable and thread-safe.
 */
public sealed interface Expression {

    /** Direct sub-expressions in evaluation order; empty for leaves. */
    List<Expression> children();

    /** Wire name of this variant in serialized IR. */
    String kind();

    // ── Factories ──

    static Literal nullLiteral() {
        return Literal.NULL;
    }

    static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    static Field field(String path) {
        return new Field(path);
    }

    static Binary binary(BinaryOperator operator, Expression left, Expression right) {
        return new Binary(operator, left, right);
    }

    static Unary unary(UnaryOperator operator, Expression operand) {
        return new Unary(operator, operand);
    }

    static Call call(FunctionName function, List<Expression> args) {
        return new Call(function, args, null);
    }

    static Call call(FunctionName function, List<Expression> args, JsonNode config) {
        return new Call(function, args, config);
    }

    static Conditional conditional(Expression condition, Expression then, Expression otherwise) {
        return new Conditional(condition, then, otherwise);
    }

    // ── Leaves ──

    /**
     * Constant value. {@code value} is a {@link String}, {@link Boolean}, {@link Long},
     * {@link Double} (or another {@link Number}) or {@code null}, matching {@code type}.
     */
    record Literal(Object value, LiteralType type) implements Expression {

        static final Literal NULL = new Literal(null, LiteralType.NULL);

        public Literal {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String kind() {
            return "literal";
        }
    }

    /** Read of a source field. {@code path} is dotted, without the {@code $.} root marker. */
    record Field(String path) implements Expression {

        public Field {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String kind() {
            return "field";
        }
    }

    /** Placeholder for the output of functoid {@code nodeId}; resolved before IR assembly. */
    record UnresolvedRef(String nodeId) implements Expression {

        public UnresolvedRef {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String kind() {
            return "unresolvedRef";
        }
    }

    /**
     * Reference to a hoisted value. Generators bind {@code varName} once, before first use, and
     * never re-evaluate it per use site.
     */
    record SharedRef(String nodeId, String varName) implements Expression {

        public SharedRef {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
            if (varName == null || varName.isEmpty()) {
                throw new IllegalArgumentException("varName must not be null or empty");
            }
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String kind() {
            return "sharedRef";
        }
    }

    // ── Structural ──

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {

        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of(left, right);
        }

        @Override
        public String kind() {
            return "binary";
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {

        public Unary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of(operand);
        }

        @Override
        public String kind() {
            return "unary";
        }
    }

    /**
     * Named function call. {@code config} carries the functoid configuration for functions that
     * take extra parameters (e.g. the separator of {@code join}); it is {@code null} otherwise.
     */
    record Call(FunctionName function, List<Expression> args, JsonNode config) implements Expression {

        public Call {
            Objects.requireNonNull(function, "function must not be null");
            args = args == null ? List.of() : List.copyOf(args);
            config = config == null ? null : config.deepCopy();
        }

        @Override
        public List<Expression> children() {
            return args;
        }

        @Override
        public String kind() {
            return "call";
        }
    }

    record Conditional(Expression condition, Expression then, Expression otherwise) implements Expression {

        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(then, "then must not be null");
            Objects.requireNonNull(otherwise, "otherwise must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of(condition, then, otherwise);
        }

        @Override
        public String kind() {
            return "conditional";
        }
    }

    record ArrayLiteral(List<Expression> elements) implements Expression {

        public ArrayLiteral {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override
        public List<Expression> children() {
            return elements;
        }

        @Override
        public String kind() {
            return "array";
        }
    }

    record ObjectLiteral(List<Entry> entries) implements Expression {

        public ObjectLiteral {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }

        @Override
        public List<Expression> children() {
            List<Expression> values = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                values.add(entry.value());
            }
            return List.copyOf(values);
        }

        @Override
        public String kind() {
            return "object";
        }

        /** A single {@code key: value} pair. */
        public record Entry(String key, Expression value) {

            public Entry {
                Objects.requireNonNull(key, "key must not be null");
                Objects.requireNonNull(value, "value must not be null");
            }
        }
    }
}
