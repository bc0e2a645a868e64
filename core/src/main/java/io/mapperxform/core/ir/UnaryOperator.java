package io.mapperxform.core.ir;

/** Operators of {@link Expression.Unary}. */
public enum UnaryOperator {
    NEGATE("negate"),
    NOT("not"),
    ABS("abs"),
    CEIL("ceil"),
    FLOOR("floor"),
    ROUND("round"),
    SQRT("sqrt");

    private final String wireName;

    UnaryOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
