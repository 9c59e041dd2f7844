/**
 * Heap-backed catalog store used when no external store is wired
 *
 * @author William Callahan
 *
 * Features:
 * - Thread-safe, keyed by library ID
 * - Keeps insertion order for findAll
 * - Search scans every record; suitable for tests and small dumps
 */
package com.williamcallahan.book_archive_engine.repository;

import com.williamcallahan.book_archive_engine.model.AuthorName;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

@Repository
public class InMemoryCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final Map<Long, CatalogRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<Long> order = new ConcurrentLinkedQueue<>();

    public InMemoryCatalogStore() {
        logger.info("Using in-memory catalog store.");
    }

    @Override
    public boolean saveIfAbsent(CatalogRecord record) {
        if (record == null || record.getLibId() == null) {
            throw new IllegalArgumentException("Catalog record requires a library ID");
        }
        if (records.putIfAbsent(record.getLibId(), record) != null) {
            return false;
        }
        order.add(record.getLibId());
        return true;
    }

    @Override
    public Optional<CatalogRecord> findById(long libId) {
        return Optional.ofNullable(records.get(libId));
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public List<CatalogRecord> findAll() {
        List<CatalogRecord> result = new ArrayList<>(records.size());
        for (Long id : order) {
            result.add(records.get(id));
        }
        return result;
    }

    @Override
    public List<CatalogRecord> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<String> tokens = Arrays.stream(query.trim().split("\\s+"))
            .map(token -> token.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        return findAll().stream()
            .filter(record -> tokens.stream().allMatch(token -> matches(record, token)))
            .sorted(Comparator.comparing((CatalogRecord record) -> record.getParsedDate().orElse(LocalDate.MIN))
                .reversed())
            .collect(Collectors.toList());
    }

    private static boolean matches(CatalogRecord record, String token) {
        if (record.getTitle() != null && record.getTitle().toLowerCase(Locale.ROOT).contains(token)) {
            return true;
        }
        for (String author : record.getAuthors()) {
            if (AuthorName.parse(author).displayName().toLowerCase(Locale.ROOT).contains(token)) {
                return true;
            }
        }
        return false;
    }
}
