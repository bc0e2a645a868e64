package io.mapperxform.core.registry;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static description of one functoid kind.
 *
 * @param kind        operation kind, e.g. {@code Binary.Add}
 * @param label       short display label
 * @param category    palette group
 * @param inputs      input port labels, in positional order (empty for dynamic inputs)
 * @param output      output port label
 * @param description one-line description
 * @param inputTypes  expected input types, parallel to {@code inputs}
 * @param outputType  produced type
 * @param pure        {@code false} if evaluating twice may differ or have side effects; impure
 *                    outputs are never hoisted into shared values
 */
public record OperationDefinition(
        String kind,
        String label,
        OperationCategory category,
        List<String> inputs,
        String output,
        String description,
        List<String> inputTypes,
        String outputType,
        boolean pure) {

    private static final Pattern WORD_BREAK = Pattern.compile("[^a-zA-Z0-9]+(.)");

    public OperationDefinition {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(category, "category must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        inputTypes = inputTypes == null ? List.of() : List.copyOf(inputTypes);
    }

    /** Starts a pure definition without ports; complete it with {@link #withPorts}. */
    public static OperationDefinition of(String kind, String label, OperationCategory category, String description) {
        return new OperationDefinition(kind, label, category, List.of(), null, description, List.of(), null, true);
    }

    /** Copy with the given input and output ports. */
    public OperationDefinition withPorts(
            List<String> inputs, List<String> inputTypes, String output, String outputType) {
        return new OperationDefinition(
                kind, label, category, inputs, output, description, inputTypes, outputType, pure);
    }

    /** Copy marked impure. */
    public OperationDefinition impure() {
        return new OperationDefinition(
                kind, label, category, inputs, output, description, inputTypes, outputType, false);
    }

    /**
     * Camel-case variable hint derived from the label: each run of non-alphanumerics is removed and
     * the character after it upper-cased, then the first character lower-cased. {@code Not Equal}
     * becomes {@code notEqual}, {@code Less/Eq} becomes {@code lessEq}.
     */
    public String variableHint() {
        Matcher matcher = WORD_BREAK.matcher(label);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1).toUpperCase(Locale.ROOT)));
        }
        matcher.appendTail(sb);
        if (sb.length() > 0 && Character.isUpperCase(sb.charAt(0))) {
            sb.setCharAt(0, Character.toLowerCase(sb.charAt(0)));
        }
        return sb.toString();
    }
}
