/**
 * Raised when a dump has no recoverable central directory at all
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.exception;

import java.nio.file.Path;

public class MalformedContainerException extends LibraryArchiveException {

    private final Path path;

    public MalformedContainerException(Path path, String message) {
        super(path == null ? message : message + ": " + path);
        this.path = path;
    }

    public MalformedContainerException(Path path, String message, Throwable cause) {
        super(path == null ? message : message + ": " + path, cause);
        this.path = path;
    }

    /**
     * @return the dump location, or null when the container was scanned from memory
     */
    public Path getPath() {
        return path;
    }
}
