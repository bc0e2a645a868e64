package io.mapperxform.core.compiler;

import java.util.Objects;

/**
 * Compiler configuration. Immutable and thread-safe.
 *
 * @param arraySelector marker that makes a target handle a per-item (array element) position;
 *                      values reaching such a position are never hoisted (default {@code []})
 * @param inputOrdering placement of unindexed functoid inputs
 * @param sanitize      whether orphaned edges are removed before compilation (default on)
 */
public record CompilerSettings(String arraySelector, InputOrdering inputOrdering, boolean sanitize) {

    /** Default settings: {@code []} selector, unindexed inputs appended, sanitation on. */
    public static final CompilerSettings DEFAULT = new CompilerSettings("[]", InputOrdering.APPEND_UNINDEXED, true);

    public CompilerSettings {
        if (arraySelector == null || arraySelector.isEmpty()) {
            throw new IllegalArgumentException("arraySelector must not be null or empty");
        }
        Objects.requireNonNull(inputOrdering, "inputOrdering must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder starting from {@link #DEFAULT}. */
    public static final class Builder {

        private String arraySelector = DEFAULT.arraySelector();
        private InputOrdering inputOrdering = DEFAULT.inputOrdering();
        private boolean sanitize = DEFAULT.sanitize();

        private Builder() {}

        public Builder arraySelector(String arraySelector) {
            this.arraySelector = arraySelector;
            return this;
        }

        public Builder inputOrdering(InputOrdering inputOrdering) {
            this.inputOrdering = inputOrdering;
            return this;
        }

        public Builder sanitize(boolean sanitize) {
            this.sanitize = sanitize;
            return this;
        }

        public CompilerSettings build() {
            return new CompilerSettings(arraySelector, inputOrdering, sanitize);
        }
    }
}
