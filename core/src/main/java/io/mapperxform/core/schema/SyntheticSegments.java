package io.mapperxform.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Handles the display-only path segments the editor inserts for discriminated-union branches,
 * e.g. {@code __SYNTH__[type=6] HTTP Task}. Such a segment groups the fields of one
 * {@code if/then} branch in the tree view; it is not a real schema property and must be removed
 * before a handle is resolved or emitted.
 */
public final class SyntheticSegments {

    /** Prefix the editor puts in front of branch labels. */
    public static final String SYNTH_PREFIX = "__SYNTH__";

    /** Bracketed {@code key=value} tag followed by free text, with or without the prefix. */
    private static final Pattern BRANCH_LABEL = Pattern.compile("^(?:__SYNTH__)?\\[[^\\]=]+=[^\\]]*\\]\\s+.+$");

    /** The JSONPath root marker and an optional following dot. */
    private static final Pattern ROOT_MARKER = Pattern.compile("^\\$\\.?");

    private SyntheticSegments() {}

    /** Returns {@code true} if the segment is a branch display label. */
    public static boolean isSynthetic(String segment) {
        return segment != null && (segment.startsWith(SYNTH_PREFIX) || BRANCH_LABEL.matcher(segment).matches());
    }

    /**
     * Splits a root-stripped dotted path into its real segments, dropping branch labels and empty
     * segments.
     */
    public static List<String> realSegments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("\\.", -1)) {
            if (!segment.isEmpty() && !isSynthetic(segment)) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Converts an editor handle into the path emitted in the IR: strips the {@code $} root marker
     * and every branch label. {@code $.config.__SYNTH__[type=6] HTTP Task.headers} becomes
     * {@code config.headers}.
     *
     * @param handle editor handle, may be null
     * @return the cleaned path, empty for a null handle
     */
    public static String cleanPath(String handle) {
        if (handle == null) {
            return "";
        }
        String stripped = ROOT_MARKER.matcher(handle).replaceFirst("");
        return String.join(".", realSegments(stripped));
    }
}
