package com.resumeForge.cvRenderer.schema.util;

import java.util.Optional;

/**
 * Helpers for optional text fields of the resume record.
 */
public class TextValues {

    /**
     * A text value counts as present only when it is non-null and not blank.
     *
     * @param value Raw field value, may be null
     * @return The value unchanged, or empty when absent
     */
    public static Optional<String> present(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
