/* (C)2026 */
package com.ammann.timegraph.exception;

/**
 * Exception indicating that a caller-supplied parameter or configuration does not meet
 * the constraints of the requested operation.
 *
 * <p>Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends TimeGraphException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a missing required setting.
     */
    public static ValidationException missingSetting(String settingName, String context) {
        return new ValidationException(
                String.format("Missing setting '%s' required for %s", settingName, context));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
