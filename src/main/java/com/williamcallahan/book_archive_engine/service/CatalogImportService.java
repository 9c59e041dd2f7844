/**
 * Imports an INPX dump into the catalog store
 *
 * @author William Callahan
 *
 * Features:
 * - Streams records from the dump parser without holding the whole catalog in memory
 * - Skips records without a library ID and counts them
 * - Attaches payload, cover and illustration archives when a dump root is configured
 * - Stores records in chunks; duplicates by library ID keep the first occurrence
 * - Logs per-member progress in 5 percent steps and a summary at the end
 */

package com.williamcallahan.book_archive_engine.service;

import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.inpx.InpxParser;
import com.williamcallahan.book_archive_engine.inpx.ParseProgressListener;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.monitoring.MetricsService;
import com.williamcallahan.book_archive_engine.repository.CatalogStore;
import com.williamcallahan.book_archive_engine.resolver.ArchiveResolver;
import com.williamcallahan.book_archive_engine.types.AssetKind;
import com.williamcallahan.book_archive_engine.types.ResolvedArchives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Service
public class CatalogImportService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogImportService.class);
    private static final int PROGRESS_STEP_PERCENT = 5;

    private final InpxParser parser;
    private final CatalogStore catalogStore;
    private final ArchiveResolver archiveResolver;
    private final MetricsService metricsService;
    private final int chunkSize;

    @Autowired
    public CatalogImportService(InpxParser parser,
                                CatalogStore catalogStore,
                                ObjectProvider<ArchiveResolver> archiveResolver,
                                MetricsService metricsService,
                                LibraryArchiveProperties properties) {
        this(parser, catalogStore, archiveResolver.getIfAvailable(), metricsService, properties.getImportChunkSize());
    }

    public CatalogImportService(InpxParser parser,
                                CatalogStore catalogStore,
                                ArchiveResolver archiveResolver,
                                MetricsService metricsService,
                                int chunkSize) {
        this.parser = parser;
        this.catalogStore = catalogStore;
        this.archiveResolver = archiveResolver;
        this.metricsService = metricsService;
        this.chunkSize = Math.max(1, chunkSize);
    }

    /**
     * Import every record of a dump
     *
     * @param dump path to the .inpx file
     * @return totals for this run
     * @throws IOException if the dump cannot be read
     */
    public ImportSummary importDump(Path dump) throws IOException {
        ImportSummary summary = new ImportSummary(dump);
        if (archiveResolver == null) {
            logger.info("No dump root configured; importing {} without archive locations", dump);
        }
        List<CatalogRecord> chunk = new ArrayList<>(chunkSize);
        try (Stream<CatalogRecord> records = parser.parse(dump, new ProgressLogger(summary))) {
            Iterator<CatalogRecord> it = records.iterator();
            while (it.hasNext()) {
                CatalogRecord record = it.next();
                if (!record.isResolvable()) {
                    summary.incrementSkipped();
                    metricsService.incrementRecordsSkipped();
                    continue;
                }
                if (archiveResolver != null) {
                    ResolvedArchives resolved = archiveResolver.resolve(record.getLibId());
                    record.attachArchives(resolved);
                    if (resolved.get(AssetKind.PAYLOAD).isEmpty()) {
                        summary.incrementUnresolved();
                    }
                }
                chunk.add(record);
                if (chunk.size() >= chunkSize) {
                    flush(chunk, summary);
                }
            }
            flush(chunk, summary);
        }
        summary.finish();
        summary.logSummary();
        return summary;
    }

    private void flush(List<CatalogRecord> chunk, ImportSummary summary) {
        if (chunk.isEmpty()) {
            return;
        }
        int stored = catalogStore.saveAllIfAbsent(chunk);
        summary.addImported(stored);
        summary.addDuplicates(chunk.size() - stored);
        logger.debug("Stored chunk of {} record(s), {} new", chunk.size(), stored);
        chunk.clear();
    }

    private static final class ProgressLogger implements ParseProgressListener {
        private final ImportSummary summary;
        private final Map<String, Integer> lastLoggedPercent = new HashMap<>();

        private ProgressLogger(ImportSummary summary) {
            this.summary = summary;
        }

        @Override
        public void onProgress(String memberName, long processedBytes, long totalBytes) {
            int percent = totalBytes <= 0 ? 100 : (int) (processedBytes * 100 / totalBytes);
            int step = percent / PROGRESS_STEP_PERCENT * PROGRESS_STEP_PERCENT;
            Integer last = lastLoggedPercent.get(memberName);
            if (last == null || step > last) {
                lastLoggedPercent.put(memberName, step);
                logger.info("{}: {}% ({} / {} bytes)", memberName, step, processedBytes, totalBytes);
            }
        }

        @Override
        public void onDecodeFallback(String memberName, long lineNumber) {
            summary.incrementDecodeFallbacks();
        }
    }
}
