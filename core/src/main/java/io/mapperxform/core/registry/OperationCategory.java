package io.mapperxform.core.registry;

/** Palette group a functoid belongs to. */
public enum OperationCategory {
    MATH("math"),
    STRING("string"),
    LOGICAL("logical"),
    CONDITIONAL("conditional"),
    COLLECTION("collection"),
    AGGREGATE("aggregate"),
    CONVERSION("conversion"),
    DATETIME("datetime"),
    CUSTOM("custom");

    private final String id;

    OperationCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
