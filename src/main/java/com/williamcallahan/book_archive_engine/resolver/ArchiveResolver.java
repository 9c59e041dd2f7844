/**
 * Locates the payload, cover and illustration archives that own a document ID
 *
 * @author William Callahan
 *
 * Features:
 * - Scans the dump root once, recursively, at construction
 * - Reads inclusive ID ranges from archive file names such as d.fb2-009373-367300.7z
 * - Keeps one start-sorted index per asset kind for O(log n) lookups
 * - Indexes are read-only after construction and safe for concurrent readers
 */
package com.williamcallahan.book_archive_engine.resolver;

import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.types.ArchiveInfo;
import com.williamcallahan.book_archive_engine.types.AssetKind;
import com.williamcallahan.book_archive_engine.types.ResolvedArchives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public class ArchiveResolver {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveResolver.class);

    private final Map<AssetKind, ArchiveRangeIndex> indexes = new EnumMap<>(AssetKind.class);

    public ArchiveResolver(Path root) {
        this(root, new LibraryArchiveProperties());
    }

    /**
     * @throws ArchiveNotFoundException if {@code root} does not exist or is not a directory
     */
    public ArchiveResolver(Path root, LibraryArchiveProperties properties) {
        if (root == null || !Files.isDirectory(root)) {
            throw new ArchiveNotFoundException(root);
        }
        Path base = root.toAbsolutePath().normalize();

        ArchiveNamePattern payloadPattern = new ArchiveNamePattern(properties.getPayloadToken(), properties.getPayloadExtension());
        ArchiveNamePattern assetPattern = new ArchiveNamePattern(properties.getPayloadToken(), properties.getAssetExtension());

        indexes.put(AssetKind.PAYLOAD, new ArchiveRangeIndex(scan(base, payloadPattern)));
        indexes.put(AssetKind.COVER, new ArchiveRangeIndex(scan(base.resolve(properties.getCoversDir()), assetPattern)));
        indexes.put(AssetKind.ILLUSTRATION, new ArchiveRangeIndex(scan(base.resolve(properties.getImagesDir()), assetPattern)));

        logger.info("Indexed archives under {}: {} payload, {} cover, {} illustration",
            base, index(AssetKind.PAYLOAD).size(), index(AssetKind.COVER).size(), index(AssetKind.ILLUSTRATION).size());
    }

    /**
     * Resolve all three archive kinds for one document ID. Never throws for unmatched IDs.
     */
    public ResolvedArchives resolve(long id) {
        return new ResolvedArchives(
            find(AssetKind.PAYLOAD, id).orElse(null),
            find(AssetKind.COVER, id).orElse(null),
            find(AssetKind.ILLUSTRATION, id).orElse(null));
    }

    public Optional<Path> find(AssetKind kind, long id) {
        return index(kind).findLocation(id);
    }

    public ArchiveRangeIndex index(AssetKind kind) {
        return indexes.get(kind);
    }

    public List<ArchiveInfo> archives(AssetKind kind) {
        return index(kind).archives();
    }

    private static List<ArchiveInfo> scan(Path dir, ArchiveNamePattern pattern) {
        List<ArchiveInfo> found = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            logger.debug("Archive directory {} does not exist; no archives indexed from it", dir);
            return found;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile)
                .forEach(path -> pattern.match(path).ifPresent(found::add));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan archive directory " + dir, e);
        }
        return found;
    }
}
