package com.resumeForge.cvRenderer.schema.exception;

/**
 * Exception thrown when an input record does not conform to the resume schema.
 * Carries the path of the offending field, e.g. {@code experience[1].bullet_points[0]}.
 */
public class SchemaValidationException extends RuntimeException {

    private final String fieldPath;

    public SchemaValidationException(String fieldPath, String message) {
        super(fieldPath + ": " + message);
        this.fieldPath = fieldPath;
    }

    public SchemaValidationException(String fieldPath, String message, Throwable cause) {
        super(fieldPath + ": " + message, cause);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
