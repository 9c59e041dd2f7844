package com.williamcallahan.book_archive_engine.types;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One archive file claiming an inclusive, closed range of document IDs.
 *
 * @param start first document ID stored in the archive
 * @param end last document ID stored in the archive
 * @param location archive file on disk
 */
public record ArchiveInfo(long start, long end, Path location) {

    public ArchiveInfo {
        Objects.requireNonNull(location, "location");
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid archive range " + start + "-" + end + " for " + location);
        }
    }

    public boolean contains(long id) {
        return start <= id && id <= end;
    }
}
