/**
 * Service for tracking ingestion and assembly metrics
 * Provides counters and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
public class MetricsService {

    // Counters
    private final Counter recordsParsed;
    private final Counter recordsSkipped;
    private final Counter decodeFallbacks;
    private final Counter entriesDropped;
    private final Counter documentsAssembled;
    private final Counter assetsMissing;

    // Timers
    private final Timer assemblyTimer;

    public MetricsService(MeterRegistry meterRegistry) {

        this.recordsParsed = Counter.builder("inpx.records.parsed")
            .description("Number of catalog records emitted by the dump parser")
            .register(meterRegistry);

        this.recordsSkipped = Counter.builder("inpx.records.skipped")
            .description("Number of catalog records skipped for lacking a library ID")
            .register(meterRegistry);

        this.decodeFallbacks = Counter.builder("inpx.decode.fallbacks")
            .description("Number of lines decoded with the fallback charset")
            .register(meterRegistry);

        this.entriesDropped = Counter.builder("inpx.entries.dropped")
            .description("Number of container entries dropped during central directory recovery")
            .register(meterRegistry);

        this.documentsAssembled = Counter.builder("assembly.documents")
            .description("Number of documents assembled")
            .register(meterRegistry);

        this.assetsMissing = Counter.builder("assembly.assets.missing")
            .description("Number of referenced assets that could not be located")
            .register(meterRegistry);

        this.assemblyTimer = Timer.builder("assembly.duration")
            .description("Document assembly duration")
            .register(meterRegistry);
    }

    // Counter methods
    public void incrementRecordsParsed() {
        recordsParsed.increment();
    }

    public void incrementRecordsSkipped() {
        recordsSkipped.increment();
    }

    public void incrementDecodeFallback() {
        decodeFallbacks.increment();
    }

    public void incrementEntriesDropped(int count) {
        if (count > 0) {
            entriesDropped.increment(count);
        }
    }

    public void incrementDocumentsAssembled() {
        documentsAssembled.increment();
    }

    public void incrementAssetsMissing() {
        assetsMissing.increment();
    }

    // Timer methods
    public <T> T recordAssembly(Supplier<T> operation) {
        return assemblyTimer.record(operation);
    }
}
