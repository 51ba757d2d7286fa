/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.enumeration.SkipReason;

/**
 * A filter condition that evaluated to all-false because its parameter could not be read.
 */
public record SkippedConditionDTO(String parameter, SkipReason reason) {
}
