/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.exception.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Range predicate over one parameter. The clauses are OR-combined; several conditions
 * in one query are AND-combined.
 *
 * @param parameter column the clauses apply to
 * @param clauses   non-empty list of range clauses
 */
public record FilterCondition(String parameter, List<RangeClause> clauses) {

    public FilterCondition {
        Objects.requireNonNull(parameter, "parameter");
        if (clauses == null || clauses.isEmpty()) {
            throw ValidationException.invalidParameter("clauses", clauses, "at least one range clause");
        }
        clauses = List.copyOf(clauses);
    }

    public static FilterCondition of(String parameter, RangeClause... clauses) {
        return new FilterCondition(parameter, List.of(clauses));
    }

    /**
     * Returns {@code true} if any clause accepts {@code value}.
     */
    public boolean test(double value) {
        for (RangeClause clause : clauses) {
            if (clause.test(value)) {
                return true;
            }
        }
        return false;
    }
}
