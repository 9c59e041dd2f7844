package com.williamcallahan.book_archive_engine.archive;

import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.UnsupportedArchiveFormatException;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Archive container kinds the library dump is distributed in.
 *
 * <p>Each constant implements the member capability for its format. Supporting a new
 * format means adding a constant, never branching on the file type elsewhere.</p>
 */
public enum ArchiveKind {

    /**
     * Deflate/stored ZIP containers. Archives holding a single payload may name it
     * arbitrarily, so a missing member falls back to the first file entry.
     */
    ZIP("zip") {
        @Override
        ArchiveMember open(Path archive, String memberName, Path scratchRoot) throws IOException {
            ZipFile zip = new ZipFile(archive.toFile());
            try {
                ZipEntry entry = zip.getEntry(memberName);
                if (entry == null || entry.isDirectory()) {
                    entry = firstFileEntry(zip);
                }
                if (entry == null) {
                    throw new ArchiveNotFoundException(archive, memberName);
                }
                return new ArchiveMember(archive, memberName, entry.getName(), zip.getInputStream(entry), zip, null);
            } catch (IOException | RuntimeException e) {
                closeAfterFailure(zip, e);
                throw e;
            }
        }

        @Override
        List<String> list(Path archive) throws IOException {
            try (ZipFile zip = new ZipFile(archive.toFile())) {
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
        }

        @Override
        Map<String, byte[]> readAll(Path archive, Collection<String> memberNames, Path scratchRoot) throws IOException {
            Map<String, byte[]> result = new LinkedHashMap<>();
            try (ZipFile zip = new ZipFile(archive.toFile())) {
                for (String name : memberNames) {
                    ZipEntry entry = zip.getEntry(name);
                    if (entry == null || entry.isDirectory() || result.containsKey(name)) {
                        continue;
                    }
                    try (InputStream in = zip.getInputStream(entry)) {
                        result.put(name, in.readAllBytes());
                    }
                }
            }
            return result;
        }

        private ZipEntry firstFileEntry(ZipFile zip) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry candidate = entries.nextElement();
                if (!candidate.isDirectory()) {
                    return candidate;
                }
            }
            return null;
        }
    },

    /**
     * Solid-block 7z containers. Members are extracted one at a time into a private scratch
     * directory that lives exactly as long as the returned {@link ArchiveMember}.
     */
    SEVEN_Z("7z") {
        @Override
        ArchiveMember open(Path archive, String memberName, Path scratchRoot) throws IOException {
            Path scratchDir = createScratchDir(scratchRoot);
            try {
                Path extracted = scratchDir.resolve("member.bin");
                String found = null;
                try (SevenZFile sevenZ = openSevenZ(archive)) {
                    SevenZArchiveEntry entry;
                    while ((entry = sevenZ.getNextEntry()) != null) {
                        if (entry.isDirectory() || !memberName.equals(normalizeName(entry.getName()))) {
                            continue;
                        }
                        try (OutputStream out = Files.newOutputStream(extracted)) {
                            copyCurrentEntry(sevenZ, out);
                        }
                        found = memberName;
                        break;
                    }
                } catch (LinkageError e) {
                    throw new UnsupportedArchiveFormatException(archive, "7z codec is not available", e);
                } catch (IOException e) {
                    rejectUnsupportedCoder(archive, e);
                    throw e;
                }
                if (found == null) {
                    throw new ArchiveNotFoundException(archive, memberName);
                }
                return new ArchiveMember(archive, memberName, found, Files.newInputStream(extracted), null, scratchDir);
            } catch (IOException | RuntimeException e) {
                try {
                    ArchiveMember.deleteRecursively(scratchDir);
                } catch (IOException cleanupFailure) {
                    e.addSuppressed(cleanupFailure);
                }
                throw e;
            }
        }

        @Override
        List<String> list(Path archive) throws IOException {
            try (SevenZFile sevenZ = openSevenZ(archive)) {
                List<String> names = new ArrayList<>();
                for (SevenZArchiveEntry entry : sevenZ.getEntries()) {
                    if (!entry.isDirectory()) {
                        names.add(normalizeName(entry.getName()));
                    }
                }
                return names;
            } catch (LinkageError e) {
                throw new UnsupportedArchiveFormatException(archive, "7z codec is not available", e);
            }
        }

        @Override
        Map<String, byte[]> readAll(Path archive, Collection<String> memberNames, Path scratchRoot) throws IOException {
            Set<String> wanted = new HashSet<>(memberNames);
            Map<String, byte[]> result = new LinkedHashMap<>();
            try (SevenZFile sevenZ = openSevenZ(archive)) {
                SevenZArchiveEntry entry;
                while (result.size() < wanted.size() && (entry = sevenZ.getNextEntry()) != null) {
                    String name = normalizeName(entry.getName());
                    if (entry.isDirectory() || !wanted.contains(name) || result.containsKey(name)) {
                        continue;
                    }
                    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                    copyCurrentEntry(sevenZ, buffer);
                    result.put(name, buffer.toByteArray());
                }
            } catch (LinkageError e) {
                throw new UnsupportedArchiveFormatException(archive, "7z codec is not available", e);
            } catch (IOException e) {
                rejectUnsupportedCoder(archive, e);
                throw e;
            }
            return result;
        }

        private SevenZFile openSevenZ(Path archive) throws IOException {
            return SevenZFile.builder().setFile(archive.toFile()).get();
        }

        private void copyCurrentEntry(SevenZFile sevenZ, OutputStream out) throws IOException {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = sevenZ.read(buffer)) != -1) {
                out.write(buffer, 0, read);
            }
        }

        private void rejectUnsupportedCoder(Path archive, IOException e) {
            String message = e.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("unsupported compression method")) {
                throw new UnsupportedArchiveFormatException(archive, "Unsupported 7z coder", e);
            }
        }
    };

    private final String extension;

    ArchiveKind(String extension) {
        this.extension = extension;
    }

    /**
     * Open one member. The returned handle owns every resource acquired for it.
     */
    abstract ArchiveMember open(Path archive, String memberName, Path scratchRoot) throws IOException;

    /**
     * Non-directory member names in archive order, with forward slashes as separators.
     */
    abstract List<String> list(Path archive) throws IOException;

    /**
     * Read the named members in one pass over the archive. Names that are absent are
     * omitted from the result.
     */
    abstract Map<String, byte[]> readAll(Path archive, Collection<String> memberNames, Path scratchRoot) throws IOException;

    /**
     * Resolve the container kind from the archive file name.
     */
    public static Optional<ArchiveKind> forPath(Path archive) {
        Path fileName = archive.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (ArchiveKind kind : values()) {
            if (name.endsWith("." + kind.extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    static String normalizeName(String name) {
        return name == null ? "" : name.replace('\\', '/');
    }

    static Path createScratchDir(Path scratchRoot) throws IOException {
        if (scratchRoot == null) {
            return Files.createTempDirectory("archive-member-");
        }
        Files.createDirectories(scratchRoot);
        return Files.createTempDirectory(scratchRoot, "archive-member-");
    }

    static void closeAfterFailure(Closeable resource, Exception failure) {
        try {
            resource.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
