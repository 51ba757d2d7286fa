/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ClauseBound;
import com.ammann.timegraph.enumeration.ComparisonOperator;
import com.ammann.timegraph.exception.ValidationException;
import java.util.Objects;

/**
 * One side of a value range: {@code value <operator> threshold}.
 *
 * @param bound     lower or upper bound; must agree with the operator
 * @param operator  comparison to apply
 * @param threshold value to compare against
 */
public record RangeClause(ClauseBound bound, ComparisonOperator operator, double threshold) {

    public RangeClause {
        Objects.requireNonNull(bound, "bound");
        Objects.requireNonNull(operator, "operator");
        if (operator.getBound() != bound) {
            throw ValidationException.invalidParameter(
                    "operator", operator.getSymbol(), "an operator valid for a " + bound + " bound");
        }
        if (Double.isNaN(threshold)) {
            throw ValidationException.invalidParameter("threshold", threshold, "a number");
        }
    }

    public static RangeClause lower(ComparisonOperator operator, double threshold) {
        return new RangeClause(ClauseBound.LOWER, operator, threshold);
    }

    public static RangeClause upper(ComparisonOperator operator, double threshold) {
        return new RangeClause(ClauseBound.UPPER, operator, threshold);
    }

    public boolean test(double value) {
        return operator.test(value, threshold);
    }
}
