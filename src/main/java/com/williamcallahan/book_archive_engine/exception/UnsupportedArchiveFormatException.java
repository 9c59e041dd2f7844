/**
 * Raised for archives whose extension is unknown or whose codec cannot be instantiated
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.exception;

import java.nio.file.Path;

public class UnsupportedArchiveFormatException extends LibraryArchiveException {

    private final Path path;

    public UnsupportedArchiveFormatException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public UnsupportedArchiveFormatException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
