package io.mapperxform.core.ir;

import java.util.Objects;

/**
 * A single target field assignment.
 *
 * @param target     dotted target path without the {@code $.} root marker (e.g. {@code lines[].amount})
 * @param expression expression producing the value
 * @param type       optional type annotation, may be null
 */
public record FieldMapping(String target, Expression expression, String type) {

    public FieldMapping {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public FieldMapping(String target, Expression expression) {
        this(target, expression, null);
    }
}
