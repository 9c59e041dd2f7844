package com.williamcallahan.book_archive_engine.model;

import com.williamcallahan.book_archive_engine.util.ValidationUtils;

/**
 * Author split out of a raw INPX author entry such as {@code Doe,John,Q}.
 * The last name is never null; a blank last name is replaced by the first name.
 */
public record AuthorName(String lastName, String firstName, String middleName) {

    public static AuthorName parse(String raw) {
        String[] parts = raw == null ? new String[0] : raw.split(",", -1);
        String last = part(parts, 0);
        String first = part(parts, 1);
        String middle = part(parts, 2);
        if (last == null) {
            last = first == null ? "" : first;
            first = null;
        }
        return new AuthorName(last, first, middle);
    }

    private static String part(String[] parts, int index) {
        if (index >= parts.length) {
            return null;
        }
        String trimmed = parts[index].trim();
        return ValidationUtils.hasText(trimmed) ? trimmed : null;
    }

    public String displayName() {
        StringBuilder sb = new StringBuilder(lastName);
        if (firstName != null) {
            sb.append(' ').append(firstName);
        }
        if (middleName != null) {
            sb.append(' ').append(middleName);
        }
        return sb.toString();
    }
}
