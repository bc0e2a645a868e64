package io.mapperxform.core.template;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and substitution of {@code {name}} placeholders in free-form templates such as
 * {@code http://{hostname}/accounts?custno={custno}}.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class TemplateParams {

    /** A well-formed placeholder: identifier start, then identifier characters. */
    private static final Pattern PARAM = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)\\}");

    /** A placeholder whose first character cannot start an identifier. */
    private static final Pattern INVALID_PARAM = Pattern.compile("\\{([^a-zA-Z_}][^}]*)\\}");

    private TemplateParams() {}

    /**
     * Extracts parameter names in order of first appearance, each name once.
     *
     * @param template the template, may be null
     * @return unmodifiable list of distinct parameter names
     */
    public static List<String> extractParams(String template) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        Set<String> params = new LinkedHashSet<>();
        Matcher matcher = PARAM.matcher(template);
        while (matcher.find()) {
            params.add(matcher.group(1));
        }
        return List.copyOf(params);
    }

    /**
     * Checks a template for structural problems. Checks run in order: blank, unbalanced braces,
     * invalid parameter start character, empty {@code {}} placeholder.
     */
    public static TemplateValidation validate(String template) {
        if (template == null || template.isBlank()) {
            return TemplateValidation.invalid("Template cannot be empty");
        }

        long open = template.chars().filter(c -> c == '{').count();
        long close = template.chars().filter(c -> c == '}').count();
        if (open != close) {
            return TemplateValidation.invalid("Unmatched braces in template");
        }

        Matcher invalid = INVALID_PARAM.matcher(template);
        if (invalid.find()) {
            return TemplateValidation.invalid("Invalid parameter name: {" + invalid.group(1) + "}");
        }

        if (template.contains("{}")) {
            return TemplateValidation.invalid("Empty parameter names are not allowed");
        }

        return TemplateValidation.ok();
    }

    /**
     * Replaces every occurrence of each {@code {name}} with {@code String.valueOf(value)}.
     * Placeholder and replacement text are both treated literally.
     *
     * @param template    the template
     * @param paramValues parameter values by name; names absent from the template are ignored
     * @return the resolved string
     */
    public static String resolve(String template, Map<String, ?> paramValues) {
        String result = template;
        for (Map.Entry<String, ?> entry : paramValues.entrySet()) {
            String placeholder = "{" + entry.getKey() + "}";
            result = result.replaceAll(
                    Pattern.quote(placeholder), Matcher.quoteReplacement(String.valueOf(entry.getValue())));
        }
        return result;
    }

    /**
     * Display label for a parameter input port: first letter upper-cased.
     *
     * @param paramName parameter name, may be null
     * @return e.g. {@code Hostname} for {@code hostname}; empty for null or empty input
     */
    public static String displayName(String paramName) {
        if (paramName == null || paramName.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(paramName.charAt(0)) + paramName.substring(1);
    }

    /**
     * Splits a template into alternating literal and parameter segments. The i-th parameter
     * segment carries the index of its name in {@link #extractParams(String)}. Only the first
     * occurrence of each distinct parameter, searched left to right after the previous match, is
     * treated as a placeholder; later repeats stay in the literal text.
     *
     * @param template non-empty template
     * @return segments in template order; literal segments are never empty
     */
    public static List<Segment> split(String template) {
        List<Segment> segments = new ArrayList<>();
        List<String> params = extractParams(template);
        int current = 0;
        for (int i = 0; i < params.size(); i++) {
            String placeholder = "{" + params.get(i) + "}";
            int pos = template.indexOf(placeholder, current);
            if (pos == -1) {
                continue;
            }
            if (pos > current) {
                segments.add(Segment.literal(template.substring(current, pos)));
            }
            segments.add(Segment.param(params.get(i), i));
            current = pos + placeholder.length();
        }
        if (current < template.length()) {
            segments.add(Segment.literal(template.substring(current)));
        }
        return List.copyOf(segments);
    }

    /**
     * One piece of a split template: literal text, or a parameter with its positional index.
     *
     * @param text       literal text, or the parameter name
     * @param paramIndex index of the parameter, {@code -1} for literal segments
     */
    public record Segment(String text, int paramIndex) {

        static Segment literal(String text) {
            return new Segment(text, -1);
        }

        static Segment param(String name, int index) {
            return new Segment(name, index);
        }

        public boolean isParam() {
            return paramIndex >= 0;
        }
    }
}
