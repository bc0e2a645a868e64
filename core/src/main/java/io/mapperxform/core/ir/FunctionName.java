package io.mapperxform.core.ir;

/**
 * Function vocabulary of {@link Expression.Call}. Every downstream generator must be able to
 * render each of these.
 */
public enum FunctionName {
    // String
    UPPERCASE("uppercase"),
    LOWERCASE("lowercase"),
    TRIM("trim"),
    LENGTH("length"),
    SUBSTRING("substring"),
    REPLACE("replace"),
    SPLIT("split"),
    JOIN("join"),
    // Collection
    MAP("map"),
    FILTER("filter"),
    COUNT("count"),
    DISTINCT("distinct"),
    SORT("sort"),
    REVERSE("reverse"),
    FLATTEN("flatten"),
    // Aggregate
    SUM("sum"),
    AVERAGE("average"),
    MIN("min"),
    MAX("max"),
    // Conversion
    TO_STRING("toString"),
    TO_NUMBER("toNumber"),
    TO_BOOLEAN("toBoolean"),
    TO_INTEGER("toInteger"),
    TO_ARRAY("toArray"),
    TO_DATE("toDate"),
    PARSE_JSON("parseJSON"),
    STRINGIFY_JSON("stringifyJSON"),
    // Date/time
    NOW("now"),
    FORMAT_DATE("formatDate"),
    PARSE_DATE("parseDate"),
    ADD_DAYS("addDays"),
    ADD_MONTHS("addMonths"),
    DATE_DIFF("dateDiff"),
    // Opaque user function
    CUSTOM("custom");

    private final String wireName;

    FunctionName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
