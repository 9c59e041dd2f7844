/**
 * Reads display details for one book straight from its archives
 *
 * @author William Callahan
 *
 * Features:
 * - Extracts the publication year and annotation from the payload description
 * - Reports cover availability with strict member matching
 * - Never fails the caller: unreadable archives yield empty details
 */

package com.williamcallahan.book_archive_engine.service.assembly;

import com.williamcallahan.book_archive_engine.archive.ArchiveMember;
import com.williamcallahan.book_archive_engine.archive.ArchiveMemberExtractor;
import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.exception.LibraryArchiveException;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.types.BookDetails;
import com.williamcallahan.book_archive_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.List;

@Service
public class Fb2DetailsReader {

    private static final Logger logger = LoggerFactory.getLogger(Fb2DetailsReader.class);

    private final ArchiveMemberExtractor extractor;
    private final Fb2DocumentAssembler assembler;

    public Fb2DetailsReader(ArchiveMemberExtractor extractor, Fb2DocumentAssembler assembler) {
        this.extractor = extractor;
        this.assembler = assembler;
    }

    public BookDetails readDetails(CatalogRecord record) {
        if (record.getLibId() == null) {
            return BookDetails.EMPTY;
        }
        boolean coverAvailable = assembler.findCover(record).isPresent();
        if (record.getPayloadArchive() == null) {
            return new BookDetails(null, null, coverAvailable);
        }

        String memberName = Fb2DocumentAssembler.payloadMemberName(record);
        try (ArchiveMember member = extractor.openMember(record.getPayloadArchive(), memberName)) {
            Document document = Fb2Markup.parse(member.getInputStream(), member.getName());
            return new BookDetails(publishYear(document), annotation(document), coverAvailable);
        } catch (ArchiveNotFoundException e) {
            logger.debug("Payload {} missing for document {}", memberName, record.getLibId());
        } catch (IOException | LibraryArchiveException e) {
            logger.warn("Failed to read details of document {}: {}", record.getLibId(), e.getMessage());
        }
        return new BookDetails(null, null, coverAvailable);
    }

    private static String publishYear(Document document) {
        for (Element publishInfo : Fb2Markup.elements(document, "publish-info")) {
            Element year = Fb2Markup.firstChild(publishInfo, "year");
            if (year != null && ValidationUtils.hasText(year.getTextContent())) {
                return year.getTextContent().trim();
            }
        }
        return null;
    }

    private static String annotation(Document document) {
        List<Element> annotations = Fb2Markup.elements(document, "annotation");
        return annotations.isEmpty() ? null : Fb2Markup.innerXml(annotations.get(0));
    }
}
