/**
 * Service for reading single members out of ZIP and 7z archives
 *
 * @author William Callahan
 *
 * Features:
 * - Dispatches on the archive extension through {@link ArchiveKind}
 * - Never extracts a whole archive; solid archives extract only the requested member
 * - Scratch files live in a private directory removed when the member is closed
 * - Surfaces missing archives and members as {@link ArchiveNotFoundException}
 */
package com.williamcallahan.book_archive_engine.archive;

import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.UnsupportedArchiveFormatException;
import com.williamcallahan.book_archive_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Map;

@Service
public class ArchiveMemberExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveMemberExtractor.class);

    private final Path scratchRoot;

    /**
     * Uses the JVM temp directory for scratch files.
     */
    public ArchiveMemberExtractor() {
        this((Path) null);
    }

    public ArchiveMemberExtractor(Path scratchRoot) {
        this.scratchRoot = scratchRoot;
    }

    @Autowired
    public ArchiveMemberExtractor(LibraryArchiveProperties properties) {
        this(ValidationUtils.hasText(properties.getScratchDir()) ? Paths.get(properties.getScratchDir()) : null);
    }

    /**
     * Open one member of an archive. The caller must close the returned handle, which
     * releases the archive and deletes any scratch files.
     *
     * @param archive archive file
     * @param memberName member path inside the archive
     * @return the opened member
     * @throws ArchiveNotFoundException if the archive or the member does not exist
     * @throws UnsupportedArchiveFormatException if the extension is unknown or the codec is unavailable
     */
    public ArchiveMember openMember(Path archive, String memberName) throws IOException {
        ArchiveKind kind = kindOf(archive);
        ArchiveMember member = kind.open(archive, memberName, scratchRoot);
        if (member.isFallback()) {
            logger.debug("Member '{}' absent from {}; using single-payload entry '{}'", memberName, archive, member.getName());
        }
        return member;
    }

    /**
     * Read one member fully. Every handle and scratch file is released before returning.
     */
    public byte[] readMember(Path archive, String memberName) throws IOException {
        try (ArchiveMember member = openMember(archive, memberName)) {
            return member.readAllBytes();
        }
    }

    /**
     * Read several members in a single pass. Absent names are left out of the result.
     */
    public Map<String, byte[]> readMembers(Path archive, Collection<String> memberNames) throws IOException {
        if (ValidationUtils.isNullOrEmpty(memberNames)) {
            return Map.of();
        }
        return kindOf(archive).readAll(archive, memberNames, scratchRoot);
    }

    /**
     * Non-directory member names in archive order.
     */
    public List<String> listMembers(Path archive) throws IOException {
        return kindOf(archive).list(archive);
    }

    private ArchiveKind kindOf(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new ArchiveNotFoundException(archive);
        }
        return ArchiveKind.forPath(archive)
            .orElseThrow(() -> new UnsupportedArchiveFormatException(archive, "Unknown archive type"));
    }
}
