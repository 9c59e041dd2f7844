package com.williamcallahan.book_archive_engine.inpx;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read access to the members of an opened metadata dump, whether it was opened through
 * its own directory or rebuilt by {@link CentralDirectoryScanner}.
 */
public interface InpxContainer extends Closeable {

    /**
     * Member names in container order, directories excluded.
     */
    List<String> memberNames();

    /**
     * @return the member bytes, or null when the container has no such member
     */
    byte[] read(String memberName) throws IOException;

    /**
     * True when the standard directory could not be used and members were recovered from
     * central directory headers.
     */
    boolean isRecovered();
}
