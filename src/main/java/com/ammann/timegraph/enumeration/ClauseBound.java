/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Side of a range clause. */
public enum ClauseBound {
    LOWER,
    UPPER
}
