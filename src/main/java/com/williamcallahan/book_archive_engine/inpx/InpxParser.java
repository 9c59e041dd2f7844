/**
 * Service that streams catalog records out of an INPX metadata dump
 *
 * @author William Callahan
 *
 * Features:
 * - Opens dumps with or without a usable end-of-central-directory record
 * - Reads the column order from structure.info, defaulting when it is absent
 * - Decodes each line strictly, falling back to a legacy charset per line
 * - Emits records lazily; closing the stream releases the dump
 * - Reports progress per member through an optional listener
 */
package com.williamcallahan.book_archive_engine.inpx;

import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.MalformedContainerException;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.monitoring.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Service
public class InpxParser {

    private static final Logger logger = LoggerFactory.getLogger(InpxParser.class);

    static final String RECORD_MEMBER_SUFFIX = ".inp";

    private final Charset encoding;
    private final Charset fallbackEncoding;
    private final long progressIntervalBytes;
    private final MetricsService metricsService;

    public InpxParser(LibraryArchiveProperties properties, MetricsService metricsService) {
        this.encoding = Charset.forName(properties.getEncoding());
        this.fallbackEncoding = Charset.forName(properties.getFallbackEncoding());
        this.progressIntervalBytes = Math.max(1, properties.getProgressIntervalBytes());
        this.metricsService = metricsService;
    }

    public Stream<CatalogRecord> parse(Path dump) throws IOException {
        return parse(dump, null);
    }

    /**
     * Stream every record of every {@code .inp} member in the dump.
     *
     * <p>The stream is lazy, finite and not restartable; re-invoke to re-scan. It holds the
     * opened dump, so callers must close it (try-with-resources). Records whose library ID
     * is missing or not numeric are still emitted with a null ID so the caller can count
     * them as skipped.</p>
     *
     * @param dump location of the INPX dump
     * @param listener optional progress sink, may be null
     * @throws ArchiveNotFoundException if the dump does not exist
     * @throws MalformedContainerException if no central directory can be recovered
     */
    public Stream<CatalogRecord> parse(Path dump, ParseProgressListener listener) throws IOException {
        InpxContainer container = InpxContainers.open(dump, metricsService::incrementEntriesDropped);
        try {
            InpStructure structure = readStructure(container);
            logger.info("Parsing dump {} ({} columns: {}, recovered={})", dump, structure.size(), structure, container.isRecovered());
            RecordIterator iterator = new RecordIterator(container, structure,
                listener == null ? ParseProgressListener.NONE : listener);
            return StreamSupport.stream(
                    Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> closeContainer(container, dump));
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(container, e);
            throw e;
        }
    }

    InpStructure readStructure(InpxContainer container) throws IOException {
        byte[] raw = container.read(InpStructure.STRUCTURE_MEMBER);
        if (raw == null) {
            logger.debug("No {} in dump; using default columns", InpStructure.STRUCTURE_MEMBER);
            return InpStructure.DEFAULT;
        }
        return InpStructure.parse(new String(raw, StandardCharsets.UTF_8));
    }

    private void closeContainer(InpxContainer container, Path dump) {
        try {
            container.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close dump " + dump, e);
        }
    }

    private static void closeAfterFailure(InpxContainer container, Exception failure) {
        try {
            container.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Walks members and lines on demand. Member bytes are read when the member is reached,
     * so only one member is held in memory at a time.
     */
    private final class RecordIterator implements Iterator<CatalogRecord> {
        private final InpxContainer container;
        private final InpStructure structure;
        private final ParseProgressListener listener;
        private final InpLineDecoder decoder = new InpLineDecoder(encoding, fallbackEncoding);
        private final Deque<String> pendingMembers = new ArrayDeque<>();

        private String memberName;
        private byte[] data;
        private int position;
        private long lineNumber;
        private long nextProgressAt;
        private int fallbackLines;
        private CatalogRecord next;

        RecordIterator(InpxContainer container, InpStructure structure, ParseProgressListener listener) {
            this.container = container;
            this.structure = structure;
            this.listener = listener;
            for (String name : container.memberNames()) {
                if (name.toLowerCase(Locale.ROOT).endsWith(RECORD_MEMBER_SUFFIX)) {
                    pendingMembers.add(name);
                }
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public CatalogRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CatalogRecord record = next;
            next = null;
            return record;
        }

        private CatalogRecord advance() {
            while (true) {
                if (data == null) {
                    if (pendingMembers.isEmpty()) {
                        return null;
                    }
                    openMember(pendingMembers.poll());
                    continue;
                }
                if (position >= data.length) {
                    finishMember();
                    continue;
                }
                CatalogRecord record = nextLine();
                if (record != null) {
                    metricsService.incrementRecordsParsed();
                    return record;
                }
            }
        }

        private void openMember(String name) {
            try {
                byte[] bytes = container.read(name);
                memberName = name;
                data = bytes == null ? new byte[0] : bytes;
                position = 0;
                lineNumber = 0;
                fallbackLines = 0;
                nextProgressAt = progressIntervalBytes;
                logger.debug("Reading member {} ({} bytes)", name, data.length);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read member " + name, e);
            }
        }

        private void finishMember() {
            listener.onProgress(memberName, data.length, data.length);
            if (fallbackLines > 0) {
                logger.warn("Member {}: {} of {} lines decoded with {}", memberName, fallbackLines, lineNumber, fallbackEncoding);
            }
            data = null;
            memberName = null;
        }

        /**
         * Consume one line.
         *
         * @return the record, or null for an empty line
         */
        private CatalogRecord nextLine() {
            int start = position;
            int end = start;
            while (end < data.length && data[end] != '\n' && data[end] != '\r') {
                end++;
            }
            int terminator = 0;
            if (end < data.length) {
                terminator = (data[end] == '\r' && end + 1 < data.length && data[end + 1] == '\n') ? 2 : 1;
            }
            position = end + terminator;
            lineNumber++;
            reportProgress();

            if (end == start) {
                return null;
            }
            InpLineDecoder.DecodedLine decoded = decoder.decode(data, start, end - start);
            if (decoded.fallback()) {
                fallbackLines++;
                metricsService.incrementDecodeFallback();
                listener.onDecodeFallback(memberName, lineNumber);
            }
            if (decoded.text().isEmpty()) {
                return null;
            }
            return InpRecordMapper.map(decoded.text(), structure);
        }

        private void reportProgress() {
            // the end-of-member notification covers the final line
            if (position >= nextProgressAt && position < data.length) {
                listener.onProgress(memberName, position, data.length);
                nextProgressAt = position + progressIntervalBytes;
            }
        }
    }
}
