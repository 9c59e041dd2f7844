package com.williamcallahan.book_archive_engine.resolver;

import com.williamcallahan.book_archive_engine.types.ArchiveInfo;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, start-sorted list of archive ranges answering "which archive holds ID x".
 *
 * <p>Ranges are expected not to overlap. Overlapping input is not rejected; lookups then
 * return the candidate with the greatest start not above the ID, which may not be the only
 * owner.</p>
 */
public final class ArchiveRangeIndex {

    private final List<ArchiveInfo> archives;
    private final long[] starts;

    public ArchiveRangeIndex(List<ArchiveInfo> archives) {
        List<ArchiveInfo> sorted = new ArrayList<>(archives);
        sorted.sort(Comparator.comparingLong(ArchiveInfo::start));
        this.archives = List.copyOf(sorted);
        this.starts = new long[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            starts[i] = sorted.get(i).start();
        }
    }

    /**
     * Binary search for the rightmost range starting at or below {@code id}; the match is
     * accepted only when {@code id} does not exceed that range's end.
     */
    public Optional<ArchiveInfo> find(long id) {
        int low = 0;
        int high = starts.length - 1;
        int candidate = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (starts[mid] <= id) {
                candidate = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        if (candidate < 0) {
            return Optional.empty();
        }
        ArchiveInfo info = archives.get(candidate);
        return info.contains(id) ? Optional.of(info) : Optional.empty();
    }

    public Optional<Path> findLocation(long id) {
        return find(id).map(ArchiveInfo::location);
    }

    public List<ArchiveInfo> archives() {
        return archives;
    }

    public int size() {
        return archives.size();
    }

    public boolean isEmpty() {
        return archives.isEmpty();
    }
}
