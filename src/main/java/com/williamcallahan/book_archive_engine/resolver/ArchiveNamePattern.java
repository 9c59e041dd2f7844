package com.williamcallahan.book_archive_engine.resolver;

import com.williamcallahan.book_archive_engine.types.ArchiveInfo;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches archive file names of the form {@code [x.]<token>-<start>-<end>.<ext>}. The
 * optional single-letter prefix carries no meaning and is ignored.
 */
final class ArchiveNamePattern {

    private final Pattern pattern;

    ArchiveNamePattern(String token, String extension) {
        this.pattern = Pattern.compile(
            "(?:[a-z]\\.)?" + Pattern.quote(token) + "-(\\d+)-(\\d+)\\." + Pattern.quote(extension) + "$",
            Pattern.CASE_INSENSITIVE);
    }

    /**
     * @return the claimed range, or empty when the name does not match or the range is invalid
     */
    Optional<ArchiveInfo> match(Path path) {
        Matcher matcher = pattern.matcher(path.getFileName().toString());
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            long start = Long.parseLong(matcher.group(1));
            long end = Long.parseLong(matcher.group(2));
            if (start > end) {
                return Optional.empty();
            }
            return Optional.of(new ArchiveInfo(start, end, path));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
