package com.williamcallahan.book_archive_engine.util;

import java.util.Collection;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    /**
     * Parse a whole number column, tolerating surrounding whitespace.
     *
     * @return the parsed value, or null for blank or non-numeric input
     */
    public static Long parseLongOrNull(String value) {
        if (!hasText(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer parseIntOrNull(String value) {
        if (!hasText(value)) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
