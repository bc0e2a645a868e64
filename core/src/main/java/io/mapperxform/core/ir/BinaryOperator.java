package io.mapperxform.core.ir;

/** Operators of {@link Expression.Binary}. Wire names are the vocabulary code generators render. */
public enum BinaryOperator {
    // Arithmetic
    ADD("add"),
    SUBTRACT("subtract"),
    MULTIPLY("multiply"),
    DIVIDE("divide"),
    MODULO("modulo"),
    POWER("power"),
    // Comparison
    EQUAL("equal"),
    NOT_EQUAL("notEqual"),
    LESS_THAN("lessThan"),
    LESS_EQUAL("lessEqual"),
    GREATER_THAN("greaterThan"),
    GREATER_EQUAL("greaterEqual"),
    // Logical
    AND("and"),
    OR("or"),
    // String
    CONCAT("concat");

    private final String wireName;

    BinaryOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
