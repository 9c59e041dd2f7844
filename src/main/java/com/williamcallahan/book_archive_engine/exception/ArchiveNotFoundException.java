/**
 * Raised when an archive file, an archive member or the dump root does not exist
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.exception;

import java.nio.file.Path;

public class ArchiveNotFoundException extends LibraryArchiveException {

    private final Path path;
    private final String memberName;

    public ArchiveNotFoundException(Path path) {
        super("Path not found: " + path);
        this.path = path;
        this.memberName = null;
    }

    public ArchiveNotFoundException(Path path, String memberName) {
        super("Member '" + memberName + "' not found in archive " + path);
        this.path = path;
        this.memberName = memberName;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return the requested member, or null when the archive (or root) itself is missing
     */
    public String getMemberName() {
        return memberName;
    }
}
