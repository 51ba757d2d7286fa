/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Start instant of a synthetic time axis. */
public enum StartInstantMode {
    ZERO,
    NOW,
    CUSTOM
}
