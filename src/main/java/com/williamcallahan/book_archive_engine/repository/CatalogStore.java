/**
 * Storage boundary for imported catalog records
 *
 * @author William Callahan
 *
 * Key capabilities:
 * - Stores each library ID at most once; later duplicates are reported, not stored
 * - Looks records up by library ID
 * - Token search over titles and author names
 */

package com.williamcallahan.book_archive_engine.repository;

import com.williamcallahan.book_archive_engine.model.CatalogRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CatalogStore {

    /**
     * Stores a record unless one with the same library ID is already present
     *
     * @param record record with a non-null library ID
     * @return true if the record was stored
     */
    boolean saveIfAbsent(CatalogRecord record);

    /**
     * Stores a chunk of records
     *
     * @return number of records stored; the rest were duplicates
     */
    default int saveAllIfAbsent(Collection<CatalogRecord> records) {
        int stored = 0;
        for (CatalogRecord record : records) {
            if (saveIfAbsent(record)) {
                stored++;
            }
        }
        return stored;
    }

    Optional<CatalogRecord> findById(long libId);

    long count();

    List<CatalogRecord> findAll();

    /**
     * Records where every whitespace-separated token occurs, case-insensitively, in the
     * title or in an author entry. Newest first by catalog date.
     */
    List<CatalogRecord> search(String query);
}
