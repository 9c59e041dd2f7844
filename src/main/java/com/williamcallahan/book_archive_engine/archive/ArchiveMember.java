package com.williamcallahan.book_archive_engine.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A single archive member opened for reading.
 *
 * <p>Owns the member stream, the archive handle it was read from and, for solid archives,
 * the private scratch directory the member was extracted to. {@link #close()} releases all
 * of them, so callers should always use try-with-resources.</p>
 */
public final class ArchiveMember implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveMember.class);

    private final Path archive;
    private final String requestedName;
    private final String name;
    private final InputStream inputStream;
    private final Closeable owner;
    private final Path scratchDir;
    private boolean closed;

    ArchiveMember(Path archive, String requestedName, String name, InputStream inputStream,
                  Closeable owner, Path scratchDir) {
        this.archive = archive;
        this.requestedName = requestedName;
        this.name = name;
        this.inputStream = inputStream;
        this.owner = owner;
        this.scratchDir = scratchDir;
    }

    public Path getArchive() {
        return archive;
    }

    /**
     * Name of the member actually opened; differs from the requested name when the
     * single-payload fallback picked the first entry of the archive.
     */
    public String getName() {
        return name;
    }

    public String getRequestedName() {
        return requestedName;
    }

    public boolean isFallback() {
        return !name.equals(requestedName);
    }

    public InputStream getInputStream() {
        return inputStream;
    }

    public byte[] readAllBytes() throws IOException {
        return inputStream.readAllBytes();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        IOException failure = null;
        try {
            inputStream.close();
        } catch (IOException e) {
            failure = e;
        }
        if (owner != null) {
            try {
                owner.close();
            } catch (IOException e) {
                failure = chain(failure, e);
            }
        }
        if (scratchDir != null) {
            try {
                deleteRecursively(scratchDir);
            } catch (IOException e) {
                failure = chain(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    static IOException chain(IOException first, IOException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
        logger.debug("Removed scratch directory {}", dir);
    }
}
