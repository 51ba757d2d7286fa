/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** How the time axis of an imported table is obtained. */
public enum TimeMode {
    /** Parse a designated column of the table. */
    EXISTING,
    /** Generate a time axis from a sampling rate and a start instant. */
    SYNTHETIC
}
