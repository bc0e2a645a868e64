package io.mapperxform.core.ir;

import java.util.Objects;

/**
 * A computation hoisted out of its call sites: evaluated once, referenced through
 * {@link Expression.SharedRef} by every consumer.
 *
 * @param nodeId     functoid the value was computed by
 * @param varName    variable name generators bind the value to
 * @param expression the computation
 * @param hintName   friendlier name derived from the functoid label, may be null
 * @param refCount   number of consuming edges
 */
public record SharedExpression(String nodeId, String varName, Expression expression, String hintName, int refCount) {

    public SharedExpression {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(varName, "varName must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
