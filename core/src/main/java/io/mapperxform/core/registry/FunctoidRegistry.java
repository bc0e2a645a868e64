package io.mapperxform.core.registry;

import static io.mapperxform.core.registry.OperationCategory.AGGREGATE;
import static io.mapperxform.core.registry.OperationCategory.COLLECTION;
import static io.mapperxform.core.registry.OperationCategory.CONDITIONAL;
import static io.mapperxform.core.registry.OperationCategory.CONVERSION;
import static io.mapperxform.core.registry.OperationCategory.CUSTOM;
import static io.mapperxform.core.registry.OperationCategory.DATETIME;
import static io.mapperxform.core.registry.OperationCategory.LOGICAL;
import static io.mapperxform.core.registry.OperationCategory.MATH;
import static io.mapperxform.core.registry.OperationCategory.STRING;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Catalogue of functoid kinds: labels, ports, types and purity. The compiler receives a registry
 * as a constructor argument, so differently versioned operation sets can be compiled against
 * side by side.
 *
 * <p>Immutable once built. Thread-safe.
 */
public final class FunctoidRegistry {

    private static final FunctoidRegistry STANDARD = buildStandard();

    private final Map<String, OperationDefinition> definitions;

    private FunctoidRegistry(Map<String, OperationDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /** The full built-in catalogue. */
    public static FunctoidRegistry standard() {
        return STANDARD;
    }

    /** An empty builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-populated with this registry's definitions. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        definitions.values().forEach(builder::register);
        return builder;
    }

    /**
     * Looks up a definition by kind.
     *
     * @param kind operation kind, e.g. {@code Binary.Add}
     * @return the definition, or empty if the kind is not registered
     */
    public Optional<OperationDefinition> find(String kind) {
        return Optional.ofNullable(kind == null ? null : definitions.get(kind));
    }

    /** Returns {@code true} if the kind is registered. */
    public boolean contains(String kind) {
        return kind != null && definitions.containsKey(kind);
    }

    /**
     * Purity of a kind. Unregistered kinds count as pure: they compile to a {@code null} literal,
     * which has no effects.
     */
    public boolean isPure(String kind) {
        return find(kind).map(OperationDefinition::pure).orElse(true);
    }

    /** All definitions of one category, in registration order. */
    public List<OperationDefinition> byCategory(OperationCategory category) {
        return definitions.values().stream()
                .filter(def -> def.category() == category)
                .collect(Collectors.toUnmodifiableList());
    }

    /** Case-insensitive search over labels and descriptions. */
    public List<OperationDefinition> search(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        return definitions.values().stream()
                .filter(def -> def.label().toLowerCase(Locale.ROOT).contains(lower)
                        || (def.description() != null
                                && def.description().toLowerCase(Locale.ROOT).contains(lower)))
                .collect(Collectors.toUnmodifiableList());
    }

    /** All definitions in registration order. */
    public Collection<OperationDefinition> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    /** Collects definitions; a later registration of the same kind replaces the earlier one. */
    public static final class Builder {

        private final Map<String, OperationDefinition> definitions = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(OperationDefinition definition) {
            Objects.requireNonNull(definition, "definition must not be null");
            definitions.put(definition.kind(), definition);
            return this;
        }

        public Builder remove(String kind) {
            definitions.remove(kind);
            return this;
        }

        public FunctoidRegistry build() {
            return new FunctoidRegistry(definitions);
        }
    }

    private static FunctoidRegistry buildStandard() {
        Builder builder = new Builder();
        // Math
        builder.register(OperationDefinition.of("Binary.Add", "Add", MATH, "Add two numbers")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Sum", "number"));
        builder.register(OperationDefinition.of("Binary.Subtract", "Subtract", MATH, "Subtract right from left")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Difference", "number"));
        builder.register(OperationDefinition.of("Binary.Multiply", "Multiply", MATH, "Multiply two numbers")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Product", "number"));
        builder.register(OperationDefinition.of("Binary.Divide", "Divide", MATH, "Divide left by right")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Quotient", "number"));
        builder.register(OperationDefinition.of("Binary.Modulo", "Modulo", MATH, "Get remainder after division")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Remainder", "number"));
        builder.register(OperationDefinition.of("Binary.Power", "Power", MATH, "Raise base to exponent")
                .withPorts(List.of("Base", "Exponent"), List.of("number", "number"), "Result", "number"));
        builder.register(OperationDefinition.of("Unary.Abs", "Abs", MATH, "Absolute value")
                .withPorts(List.of("Value"), List.of("number"), "Result", "number"));
        builder.register(OperationDefinition.of("Unary.Ceil", "Ceil", MATH, "Round up to nearest integer")
                .withPorts(List.of("Value"), List.of("number"), "Result", "integer"));
        builder.register(OperationDefinition.of("Unary.Floor", "Floor", MATH, "Round down to nearest integer")
                .withPorts(List.of("Value"), List.of("number"), "Result", "integer"));
        builder.register(OperationDefinition.of("Unary.Round", "Round", MATH, "Round to nearest integer")
                .withPorts(List.of("Value"), List.of("number"), "Result", "integer"));
        builder.register(OperationDefinition.of("Unary.Sqrt", "Sqrt", MATH, "Square root")
                .withPorts(List.of("Value"), List.of("number"), "Result", "number"));
        builder.register(OperationDefinition.of("Unary.Negate", "Negate", MATH, "Negate number")
                .withPorts(List.of("Value"), List.of("number"), "Result", "number"));

        // String
        builder.register(OperationDefinition.of("String.Concat", "Concat", STRING, "Concatenate strings")
                .withPorts(List.of("String 1", "String 2"), List.of("string", "string"), "Result", "string"));
        builder.register(OperationDefinition.of("String.Uppercase", "Upper", STRING, "Convert to uppercase")
                .withPorts(List.of("String"), List.of("string"), "Result", "string"));
        builder.register(OperationDefinition.of("String.Lowercase", "Lower", STRING, "Convert to lowercase")
                .withPorts(List.of("String"), List.of("string"), "Result", "string"));
        builder.register(OperationDefinition.of("String.Trim", "Trim", STRING, "Remove leading/trailing whitespace")
                .withPorts(List.of("String"), List.of("string"), "Result", "string"));
        builder.register(OperationDefinition.of("String.Length", "Length", STRING, "Get string length")
                .withPorts(List.of("String"), List.of("string"), "Length", "integer"));
        builder.register(OperationDefinition.of("String.Substring", "Substr", STRING, "Extract substring")
                .withPorts(
                        List.of("String", "Start", "Length"),
                        List.of("string", "integer", "integer"),
                        "Result", "string"));
        builder.register(OperationDefinition.of("String.Replace", "Replace", STRING, "Replace text")
                .withPorts(
                        List.of("String", "Search", "Replace"),
                        List.of("string", "string", "string"),
                        "Result", "string"));
        builder.register(OperationDefinition.of("String.Split", "Split", STRING, "Split string into array")
                .withPorts(List.of("String", "Separator"), List.of("string", "string"), "Array", "array"));
        builder.register(OperationDefinition.of("String.Join", "Join", STRING, "Join array elements")
                .withPorts(List.of("Array", "Separator"), List.of("array", "string"), "String", "string"));
        builder.register(OperationDefinition.of(
                        "String.UrlTemplate", "URL Template", STRING, "Build URL from template with named parameters")
                .withPorts(List.of(), List.of(), "URL", "string"));
        builder.register(OperationDefinition.of(
                        "String.Template", "Template", STRING, "Build string from template with named parameters")
                .withPorts(List.of(), List.of(), "Result", "string"));

        // Logical
        builder.register(OperationDefinition.of("Binary.And", "And", LOGICAL, "Logical AND")
                .withPorts(List.of("Left", "Right"), List.of("boolean", "boolean"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Binary.Or", "Or", LOGICAL, "Logical OR")
                .withPorts(List.of("Left", "Right"), List.of("boolean", "boolean"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Unary.Not", "Not", LOGICAL, "Logical NOT")
                .withPorts(List.of("Value"), List.of("boolean"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Binary.Equal", "Equal", LOGICAL, "Check equality")
                .withPorts(List.of("Left", "Right"), List.of("any", "any"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Binary.NotEqual", "Not Equal", LOGICAL, "Check inequality")
                .withPorts(List.of("Left", "Right"), List.of("any", "any"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Binary.LessThan", "Less Than", LOGICAL, "Check if less than")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Result", "boolean"));
        builder.register(OperationDefinition.of(
                        "Binary.LessThanOrEqual", "Less/Eq", LOGICAL, "Check if less than or equal")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Result", "boolean"));
        builder.register(OperationDefinition.of("Binary.GreaterThan", "Greater", LOGICAL, "Check if greater than")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Result", "boolean"));
        builder.register(OperationDefinition.of(
                        "Binary.GreaterThanOrEqual", "Greater/Eq", LOGICAL, "Check if greater than or equal")
                .withPorts(List.of("Left", "Right"), List.of("number", "number"), "Result", "boolean"));

        // Conditional
        builder.register(OperationDefinition.of("Conditional.If", "If/Then/Else", CONDITIONAL, "Conditional expression")
                .withPorts(List.of("Condition", "Then", "Else"), List.of("boolean", "any", "any"), "Result", "any"));
        builder.register(OperationDefinition.of("Conditional.Switch", "Switch", CONDITIONAL, "Multi-branch conditional")
                .withPorts(List.of("Value", "Cases"), List.of("any", "any"), "Result", "any"));
        builder.register(OperationDefinition.of(
                        "Conditional.DefaultValue", "Default", CONDITIONAL, "Provide default value if null")
                .withPorts(List.of("Value", "Default"), List.of("any", "any"), "Result", "any"));

        // Collection
        builder.register(OperationDefinition.of("Collection.Map", "Map", COLLECTION, "Transform array elements")
                .withPorts(List.of("Array", "Transform"), List.of("array", "function"), "Result", "array"));
        builder.register(OperationDefinition.of("Collection.Filter", "Filter", COLLECTION, "Filter array elements")
                .withPorts(List.of("Array", "Predicate"), List.of("array", "function"), "Result", "array"));
        builder.register(OperationDefinition.of("Collection.Count", "Count", COLLECTION, "Count array elements")
                .withPorts(List.of("Array"), List.of("array"), "Count", "integer"));
        builder.register(OperationDefinition.of("Collection.Distinct", "Distinct", COLLECTION, "Get unique elements")
                .withPorts(List.of("Array"), List.of("array"), "Result", "array"));
        builder.register(OperationDefinition.of("Collection.Sort", "Sort", COLLECTION, "Sort array")
                .withPorts(List.of("Array", "Key"), List.of("array", "string"), "Result", "array"));
        builder.register(OperationDefinition.of("Collection.Reverse", "Reverse", COLLECTION, "Reverse array")
                .withPorts(List.of("Array"), List.of("array"), "Result", "array"));
        builder.register(OperationDefinition.of("Collection.Flatten", "Flatten", COLLECTION, "Flatten nested arrays")
                .withPorts(List.of("Array"), List.of("array"), "Result", "array"));

        // Aggregate
        builder.register(OperationDefinition.of("Aggregate.Sum", "Sum", AGGREGATE, "Sum array values")
                .withPorts(List.of("Array"), List.of("array"), "Sum", "number"));
        builder.register(OperationDefinition.of("Aggregate.Average", "Average", AGGREGATE, "Average of array values")
                .withPorts(List.of("Array"), List.of("array"), "Average", "number"));
        builder.register(OperationDefinition.of("Aggregate.Min", "Min", AGGREGATE, "Minimum value")
                .withPorts(List.of("Array"), List.of("array"), "Minimum", "number"));
        builder.register(OperationDefinition.of("Aggregate.Max", "Max", AGGREGATE, "Maximum value")
                .withPorts(List.of("Array"), List.of("array"), "Maximum", "number"));
        builder.register(OperationDefinition.of("Aggregate.Count", "Count", AGGREGATE, "Count elements")
                .withPorts(List.of("Array"), List.of("array"), "Count", "integer"));

        // Conversion
        builder.register(OperationDefinition.of("Convert.ToString", "ToString", CONVERSION, "Convert to string")
                .withPorts(List.of("Value"), List.of("any"), "String", "string"));
        builder.register(OperationDefinition.of("Convert.ToNumber", "ToNumber", CONVERSION, "Convert to number")
                .withPorts(List.of("Value"), List.of("any"), "Number", "number"));
        builder.register(OperationDefinition.of("Convert.ToBoolean", "ToBool", CONVERSION, "Convert to boolean")
                .withPorts(List.of("Value"), List.of("any"), "Boolean", "boolean"));
        builder.register(OperationDefinition.of("Convert.ToInteger", "ToInt", CONVERSION, "Convert to integer")
                .withPorts(List.of("Value"), List.of("any"), "Integer", "integer"));
        builder.register(OperationDefinition.of("Convert.ToArray", "ToArray", CONVERSION, "Convert to array")
                .withPorts(List.of("Value"), List.of("any"), "Array", "array"));
        builder.register(OperationDefinition.of("Convert.ToDate", "ToDate", CONVERSION, "Convert to date")
                .withPorts(List.of("Value"), List.of("string"), "Date", "string"));
        builder.register(OperationDefinition.of("Convert.ParseJSON", "Parse", CONVERSION, "Parse JSON string")
                .withPorts(List.of("String"), List.of("string"), "Object", "object"));
        builder.register(OperationDefinition.of(
                        "Convert.StringifyJSON", "Stringify", CONVERSION, "Convert to JSON string")
                .withPorts(List.of("Value"), List.of("any"), "String", "string"));

        // Datetime
        builder.register(OperationDefinition.of("DateTime.Now", "Now", DATETIME, "Current date/time")
                .withPorts(List.of(), List.of(), "DateTime", "string")
                .impure());
        builder.register(OperationDefinition.of("DateTime.Format", "Format", DATETIME, "Format date")
                .withPorts(List.of("Date", "Format"), List.of("string", "string"), "String", "string"));
        builder.register(OperationDefinition.of("DateTime.Parse", "Parse", DATETIME, "Parse date string")
                .withPorts(List.of("String"), List.of("string"), "Date", "string"));
        builder.register(OperationDefinition.of("DateTime.AddDays", "Add Days", DATETIME, "Add days to date")
                .withPorts(List.of("Date", "Days"), List.of("string", "integer"), "Date", "string"));
        builder.register(OperationDefinition.of("DateTime.AddMonths", "Add Months", DATETIME, "Add months to date")
                .withPorts(List.of("Date", "Months"), List.of("string", "integer"), "Date", "string"));
        builder.register(OperationDefinition.of("DateTime.Diff", "Diff", DATETIME, "Date difference")
                .withPorts(List.of("Start", "End"), List.of("string", "string"), "Duration", "number"));

        // Custom
        builder.register(OperationDefinition.of("Const.Value", "Const", CUSTOM, "Constant value")
                .withPorts(List.of(), List.of(), "Value", "any"));
        builder.register(OperationDefinition.of("Custom.Function", "Custom", CUSTOM, "User-defined function")
                .withPorts(List.of("Args"), List.of("any"), "Result", "any")
                .impure());

        return builder.build();
    }
}
