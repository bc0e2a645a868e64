package io.mapperxform.core.ir;

/** Type tag carried by a {@link Expression.Literal}. */
public enum LiteralType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    NULL("null");

    private final String wireName;

    LiteralType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in serialized IR. */
    public String wireName() {
        return wireName;
    }
}
