/**
 * Base class for failures raised while reading the library dump or its archives
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so parsing streams and assembly calls stay free of throws clauses
 * - Subclasses carry the path and member context needed to render a message
 */

package com.williamcallahan.book_archive_engine.exception;

public class LibraryArchiveException extends RuntimeException {

    public LibraryArchiveException(String message) {
        super(message);
    }

    public LibraryArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
