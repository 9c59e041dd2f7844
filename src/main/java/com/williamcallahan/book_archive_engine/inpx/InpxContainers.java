package com.williamcallahan.book_archive_engine.inpx;

import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.MalformedContainerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Opens metadata dumps, falling back to central directory recovery when the standard ZIP
 * reader rejects the file or finds it empty.
 */
public final class InpxContainers {

    private static final Logger logger = LoggerFactory.getLogger(InpxContainers.class);

    private InpxContainers() {
    }

    /**
     * @param droppedEntrySink receives the number of entries dropped by recovery; may be null
     * @throws ArchiveNotFoundException if the dump does not exist
     * @throws MalformedContainerException if neither the standard reader nor recovery finds a directory
     */
    public static InpxContainer open(Path dump, IntConsumer droppedEntrySink) throws IOException {
        if (dump == null || !Files.isRegularFile(dump)) {
            throw new ArchiveNotFoundException(dump);
        }

        ZipFile zip = null;
        try {
            zip = new ZipFile(dump.toFile());
            if (zip.size() > 0) {
                return new ZipFileContainer(zip);
            }
            logger.info("Dump {} opened but lists no entries; attempting central directory recovery", dump);
            zip.close();
        } catch (ZipException e) {
            logger.info("Standard open of dump {} failed ({}); attempting central directory recovery", dump, e.getMessage());
            if (zip != null) {
                zip.close();
            }
        }

        byte[] data = Files.readAllBytes(dump);
        CentralDirectoryScanner.RecoveryResult result;
        try {
            result = CentralDirectoryScanner.scan(data);
        } catch (MalformedContainerException e) {
            throw new MalformedContainerException(dump, "Central directory not found, cannot recover dump", e);
        }
        if (!result.droppedEntries().isEmpty()) {
            logger.warn("Recovery of {} dropped {} entries: {}", dump, result.droppedEntries().size(), result.droppedEntries());
        }
        if (droppedEntrySink != null) {
            droppedEntrySink.accept(result.droppedEntries().size());
        }
        logger.info("Recovered {} members from dump {}", result.members().size(), dump);
        return new RecoveredContainer(result.members());
    }

    static final class ZipFileContainer implements InpxContainer {
        private final ZipFile zip;

        ZipFileContainer(ZipFile zip) {
            this.zip = zip;
        }

        @Override
        public List<String> memberNames() {
            List<String> names = new ArrayList<>();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory()) {
                    names.add(entry.getName());
                }
            }
            return names;
        }

        @Override
        public byte[] read(String memberName) throws IOException {
            ZipEntry entry = zip.getEntry(memberName);
            if (entry == null) {
                return null;
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return in.readAllBytes();
            }
        }

        @Override
        public boolean isRecovered() {
            return false;
        }

        @Override
        public void close() throws IOException {
            zip.close();
        }
    }

    static final class RecoveredContainer implements InpxContainer {
        private final Map<String, byte[]> members;

        RecoveredContainer(Map<String, byte[]> members) {
            this.members = members;
        }

        @Override
        public List<String> memberNames() {
            return new ArrayList<>(members.keySet());
        }

        @Override
        public byte[] read(String memberName) {
            return members.get(memberName);
        }

        @Override
        public boolean isRecovered() {
            return true;
        }

        @Override
        public void close() {
            // in-memory; nothing to release
        }
    }
}
