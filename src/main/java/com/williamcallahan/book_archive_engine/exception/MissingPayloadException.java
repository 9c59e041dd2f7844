/**
 * Raised when assembly is requested for a record with no resolvable primary archive
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.exception;

public class MissingPayloadException extends LibraryArchiveException {

    private final Long libId;

    public MissingPayloadException(Long libId) {
        super("No payload archive resolved for document " + libId);
        this.libId = libId;
    }

    public Long getLibId() {
        return libId;
    }
}
