package com.williamcallahan.book_archive_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals for one dump import.
 */
public class ImportSummary {
    private static final Logger log = LoggerFactory.getLogger(ImportSummary.class);

    private final Path dump;
    private final AtomicLong imported = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong unresolved = new AtomicLong();
    private final AtomicLong decodeFallbacks = new AtomicLong();
    private final Instant startTime = Instant.now();
    private volatile Instant endTime;

    public ImportSummary(Path dump) {
        this.dump = dump;
    }

    void addImported(int count) {
        imported.addAndGet(count);
    }

    void addDuplicates(int count) {
        duplicates.addAndGet(count);
    }

    void incrementSkipped() {
        skipped.incrementAndGet();
    }

    void incrementUnresolved() {
        unresolved.incrementAndGet();
    }

    void incrementDecodeFallbacks() {
        decodeFallbacks.incrementAndGet();
    }

    void finish() {
        endTime = Instant.now();
    }

    public Path getDump() {
        return dump;
    }

    public long getImported() {
        return imported.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    public long getDuplicates() {
        return duplicates.get();
    }

    /**
     * Stored records for which no payload archive covers the library ID
     */
    public long getUnresolved() {
        return unresolved.get();
    }

    public long getDecodeFallbacks() {
        return decodeFallbacks.get();
    }

    public Duration getElapsedTime() {
        return Duration.between(startTime, endTime == null ? Instant.now() : endTime);
    }

    public void logSummary() {
        log.info("Import of {} finished - Imported: {}, Skipped: {}, Duplicates: {}, Without payload: {}, Decode fallbacks: {}, Elapsed: {}",
                dump.getFileName(),
                imported.get(),
                skipped.get(),
                duplicates.get(),
                unresolved.get(),
                decodeFallbacks.get(),
                getElapsedTime());
    }

    public Map<String, Object> toMap() {
        return Map.of(
            "imported", imported.get(),
            "skipped", skipped.get(),
            "duplicates", duplicates.get(),
            "unresolved", unresolved.get(),
            "decodeFallbacks", decodeFallbacks.get(),
            "elapsedMs", getElapsedTime().toMillis()
        );
    }
}
