/**
 * One normalized metadata row parsed from an INPX dump
 *
 * Features:
 * - Carries the columns every dump provides (authors, title, series, file and size data)
 * - Keeps the raw lower-cased column map for columns without a dedicated field
 * - Receives archive locations once the range resolver has run
 * - A record without a numeric library ID is reported by the parser but never stored
 */
package com.williamcallahan.book_archive_engine.model;

import com.williamcallahan.book_archive_engine.types.ResolvedArchives;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(exclude = "rawFields")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CatalogRecord {

    @EqualsAndHashCode.Include
    private Long libId;
    private String title;
    private List<String> authors = new ArrayList<>();
    private List<String> genres = new ArrayList<>();
    private String series;
    private Integer seriesNumber;
    private String fileStub;
    private String fileExtension;
    private Long size;
    private String date;
    private boolean deleted;
    private String language;
    private String keywords;
    private String folder;
    private Map<String, String> rawFields = new LinkedHashMap<>();

    private Path payloadArchive;
    private Path coverArchive;
    private Path illustrationArchive;

    public boolean isResolvable() {
        return libId != null;
    }

    /**
     * @return the ISO date, or empty when the column is blank or not an ISO date
     */
    public Optional<LocalDate> getParsedDate() {
        if (date == null || date.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(date.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public void attachArchives(ResolvedArchives archives) {
        if (archives == null) {
            return;
        }
        this.payloadArchive = archives.payload();
        this.coverArchive = archives.cover();
        this.illustrationArchive = archives.illustration();
    }
}
