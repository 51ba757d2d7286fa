/* (C)2026 */
package com.ammann.timegraph.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied by a filter range clause.
 *
 * <p>{@code >=} and {@code >} belong to lower bounds, {@code <=} and {@code <} to upper
 * bounds. Comparisons against {@code NaN} are always false.
 */
public enum ComparisonOperator {
    GREATER_OR_EQUAL(">=", ClauseBound.LOWER),
    GREATER(">", ClauseBound.LOWER),
    LESS_OR_EQUAL("<=", ClauseBound.UPPER),
    LESS("<", ClauseBound.UPPER);

    private final String symbol;
    private final ClauseBound bound;

    ComparisonOperator(String symbol, ClauseBound bound) {
        this.symbol = symbol;
        this.bound = bound;
    }

    /**
     * Evaluates {@code value <op> threshold}.
     */
    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_OR_EQUAL -> value >= threshold;
            case GREATER -> value > threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case LESS -> value < threshold;
        };
    }

    /**
     * Looks up an operator by its symbol.
     *
     * @param symbol one of {@code >=}, {@code >}, {@code <=}, {@code <}
     * @return the matching operator
     * @throws IllegalArgumentException for unknown symbols
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }

    @JsonValue
    public String getSymbol() { return symbol; }

    public ClauseBound getBound() { return bound; }
}
