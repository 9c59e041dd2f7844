/**
 * Assembles a self-contained FB2 document from a payload archive plus its cover and
 * illustration archives
 *
 * @author William Callahan
 *
 * Features:
 * - Reads the payload member for a record and parses it with a hardened DOM parser
 * - Resolves the cover ID from coverpage markup and rewrites or creates the coverpage link
 * - Matches local image references against the per-book folder of the illustration archive
 * - Inlines every found asset as a base64 binary block, in document order
 * - Tolerates missing or unreadable asset archives; only the payload is mandatory
 * - Output is deterministic, so assembling an assembled document changes nothing
 */

package com.williamcallahan.book_archive_engine.service.assembly;

import com.williamcallahan.book_archive_engine.archive.ArchiveMember;
import com.williamcallahan.book_archive_engine.archive.ArchiveMemberExtractor;
import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.LibraryArchiveException;
import com.williamcallahan.book_archive_engine.exception.MissingPayloadException;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.monitoring.MetricsService;
import com.williamcallahan.book_archive_engine.types.AssetReference;
import com.williamcallahan.book_archive_engine.types.ComposedDocument;
import com.williamcallahan.book_archive_engine.types.EmbeddedAsset;
import com.williamcallahan.book_archive_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class Fb2DocumentAssembler {

    private static final Logger logger = LoggerFactory.getLogger(Fb2DocumentAssembler.class);

    private static final String DEFAULT_PAYLOAD_EXTENSION = "fb2";
    private static final List<String> ILLUSTRATION_SUFFIXES = List.of("", ".jpg", ".png", ".gif");
    // Elements that follow coverpage inside title-info
    private static final Set<String> AFTER_COVERPAGE = Set.of("lang", "src-lang", "translator", "sequence");

    private final ArchiveMemberExtractor extractor;
    private final LibraryArchiveProperties properties;
    private final MetricsService metricsService;

    public Fb2DocumentAssembler(ArchiveMemberExtractor extractor,
                                LibraryArchiveProperties properties,
                                MetricsService metricsService) {
        this.extractor = extractor;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Build the full document for a catalog record
     *
     * @param record record with resolved archive locations
     * @return serialized document and the assets that were inlined
     * @throws MissingPayloadException if the record has no payload archive
     * @throws ArchiveNotFoundException if the payload member is absent
     */
    public ComposedDocument assemble(CatalogRecord record) {
        return metricsService.recordAssembly(() -> doAssemble(record));
    }

    private ComposedDocument doAssemble(CatalogRecord record) {
        Long libId = record.getLibId();
        if (libId == null || record.getPayloadArchive() == null) {
            throw new MissingPayloadException(libId);
        }
        String id = String.valueOf(libId);
        Document document = readPayload(record.getPayloadArchive(), payloadMemberName(record), id);
        Element root = document.getDocumentElement();

        Set<String> existingBinaries = new HashSet<>();
        for (Element binary : Fb2Markup.elements(document, "binary")) {
            existingBinaries.add(binary.getAttribute("id"));
        }

        Map<String, EmbeddedAsset> collected = new LinkedHashMap<>();

        String coverId = coverIdOf(document);
        if (!existingBinaries.contains(coverId)) {
            Optional<EmbeddedAsset> cover = findCover(record.getCoverArchive(), id, coverId, false);
            if (cover.isPresent()) {
                collected.put(coverId, cover.get());
            } else {
                metricsService.incrementAssetsMissing();
            }
        }
        writeCoverLink(document, coverId);

        Set<String> referenced = new LinkedHashSet<>();
        for (Element image : Fb2Markup.elements(document, "image")) {
            AssetReference ref = AssetReference.fromHref(Fb2Markup.href(image));
            if (ref != null) {
                referenced.add(ref.id());
            }
        }
        List<String> pending = new ArrayList<>();
        for (String ref : referenced) {
            if (!collected.containsKey(ref) && !existingBinaries.contains(ref)) {
                pending.add(ref);
            }
        }
        if (!pending.isEmpty()) {
            for (EmbeddedAsset asset : findIllustrations(record.getIllustrationArchive(), id, pending)) {
                collected.put(asset.id(), asset);
            }
        }

        for (EmbeddedAsset asset : collected.values()) {
            Element binary = Fb2Markup.create(document, "binary");
            binary.setAttribute("id", asset.id());
            binary.setAttribute("content-type", asset.contentType());
            binary.setTextContent(Base64.getEncoder().encodeToString(asset.bytes()));
            root.appendChild(binary);
        }

        byte[] content = Fb2Markup.serialize(document);
        metricsService.incrementDocumentsAssembled();
        logger.debug("Assembled document {} with {} inlined asset(s)", id, collected.size());
        return new ComposedDocument(libId, content, coverId, new ArrayList<>(collected.values()), id + ".fb2");
    }

    /**
     * Look up the cover image for a record without assembling the document
     *
     * <p>Only members named {@code <id>} or {@code <id>.jpg} match; unlike assembly there is no
     * fallback to the first member of the archive. Misses are not counted as missing assets.</p>
     */
    public Optional<EmbeddedAsset> findCover(CatalogRecord record) {
        if (record.getLibId() == null) {
            return Optional.empty();
        }
        String id = String.valueOf(record.getLibId());
        return findCover(record.getCoverArchive(), id, id, true);
    }

    static String payloadMemberName(CatalogRecord record) {
        String ext = ValidationUtils.hasText(record.getFileExtension())
            ? record.getFileExtension().trim()
            : DEFAULT_PAYLOAD_EXTENSION;
        return record.getLibId() + "." + ext;
    }

    private Document readPayload(Path archive, String memberName, String id) {
        try (ArchiveMember member = extractor.openMember(archive, memberName)) {
            return Fb2Markup.parse(member.getInputStream(), archive + "!" + member.getName());
        } catch (IOException e) {
            throw new LibraryArchiveException("Failed to read payload of document " + id + " from " + archive, e);
        }
    }

    private String coverIdOf(Document document) {
        Element image = coverImage(document);
        if (image != null) {
            AssetReference ref = AssetReference.fromHref(Fb2Markup.href(image));
            if (ref != null) {
                return ref.id();
            }
        }
        return properties.getDefaultCoverId();
    }

    private static Element coverImage(Document document) {
        for (Element coverpage : Fb2Markup.elements(document, "coverpage")) {
            Element image = Fb2Markup.firstChild(coverpage, "image");
            if (image != null) {
                return image;
            }
        }
        return null;
    }

    private Optional<EmbeddedAsset> findCover(Path archive, String libId, String coverId, boolean strict) {
        if (archive == null) {
            logger.debug("No cover archive for document {}", libId);
            return Optional.empty();
        }
        try {
            List<String> members = extractor.listMembers(archive);
            String match = matchByBaseName(members, libId, libId + ".jpg");
            if (match == null && !strict && !members.isEmpty()) {
                match = members.get(0);
            }
            if (match == null) {
                logger.debug("No cover member for document {} in {}", libId, archive);
                return Optional.empty();
            }
            byte[] bytes = extractor.readMembers(archive, List.of(match)).get(match);
            if (bytes == null) {
                return Optional.empty();
            }
            return Optional.of(new EmbeddedAsset(coverId, match, AssetContentTypes.fromFileName(match), bytes));
        } catch (ArchiveNotFoundException e) {
            logger.debug("Cover archive {} unavailable for document {}: {}", archive, libId, e.getMessage());
        } catch (IOException | LibraryArchiveException e) {
            logger.warn("Failed to read cover for document {} from {}: {}", libId, archive, e.getMessage());
        }
        return Optional.empty();
    }

    private static String matchByBaseName(List<String> members, String... candidates) {
        for (String candidate : candidates) {
            for (String member : members) {
                if (candidate.equals(AssetContentTypes.lastSegment(member))) {
                    return member;
                }
            }
        }
        return null;
    }

    private List<EmbeddedAsset> findIllustrations(Path archive, String libId, List<String> refs) {
        if (archive == null) {
            logger.debug("No illustration archive for document {}; {} reference(s) left unresolved", libId, refs.size());
            refs.forEach(ref -> metricsService.incrementAssetsMissing());
            return List.of();
        }
        try {
            // Members under <libId>/, keyed by last path segment
            Map<String, String> folder = new LinkedHashMap<>();
            for (String member : extractor.listMembers(archive)) {
                String[] segments = member.replace('\\', '/').split("/");
                if (segments.length >= 2 && segments[0].equals(libId)) {
                    folder.putIfAbsent(segments[segments.length - 1], member);
                }
            }

            Map<String, String> wanted = new LinkedHashMap<>();
            for (String ref : refs) {
                String match = null;
                for (String suffix : ILLUSTRATION_SUFFIXES) {
                    match = folder.get(ref + suffix);
                    if (match != null) {
                        break;
                    }
                }
                if (match == null) {
                    logger.debug("Illustration {} of document {} not found in {}", ref, libId, archive);
                    metricsService.incrementAssetsMissing();
                } else {
                    wanted.put(ref, match);
                }
            }
            if (wanted.isEmpty()) {
                return List.of();
            }

            Map<String, byte[]> bytes = extractor.readMembers(archive, new LinkedHashSet<>(wanted.values()));
            List<EmbeddedAsset> assets = new ArrayList<>(wanted.size());
            wanted.forEach((ref, member) -> {
                byte[] data = bytes.get(member);
                if (data == null) {
                    metricsService.incrementAssetsMissing();
                } else {
                    assets.add(new EmbeddedAsset(ref, member, AssetContentTypes.fromFileName(member), data));
                }
            });
            return assets;
        } catch (ArchiveNotFoundException e) {
            logger.debug("Illustration archive {} unavailable for document {}: {}", archive, libId, e.getMessage());
        } catch (IOException | LibraryArchiveException e) {
            logger.warn("Failed to read illustrations for document {} from {}: {}", libId, archive, e.getMessage());
        }
        refs.forEach(ref -> metricsService.incrementAssetsMissing());
        return List.of();
    }

    private static void writeCoverLink(Document document, String coverId) {
        String href = new AssetReference(coverId).toHref();
        Element image = coverImage(document);
        if (image == null) {
            Element titleInfo = ensureTitleInfo(document);
            Element coverpage = Fb2Markup.firstChild(titleInfo, "coverpage");
            if (coverpage == null) {
                coverpage = Fb2Markup.create(document, "coverpage");
                titleInfo.insertBefore(coverpage, firstFollowingSibling(titleInfo));
            }
            image = Fb2Markup.create(document, "image");
            coverpage.appendChild(image);
        }
        Fb2Markup.setHref(image, href);
    }

    private static Node firstFollowingSibling(Element titleInfo) {
        for (Node child = titleInfo.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && Fb2Markup.FB_NS.equals(element.getNamespaceURI())
                    && AFTER_COVERPAGE.contains(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    private static Element ensureTitleInfo(Document document) {
        Element root = document.getDocumentElement();
        Element description = Fb2Markup.firstChild(root, "description");
        if (description == null) {
            description = Fb2Markup.create(document, "description");
            root.insertBefore(description, root.getFirstChild());
        }
        Element titleInfo = Fb2Markup.firstChild(description, "title-info");
        if (titleInfo == null) {
            titleInfo = Fb2Markup.create(document, "title-info");
            description.insertBefore(titleInfo, description.getFirstChild());
        }
        return titleInfo;
    }
}
