package com.williamcallahan.book_archive_engine.inpx;

import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the fields of one decoded {@code .inp} line onto a {@link CatalogRecord}.
 */
final class InpRecordMapper {

    static final char FIELD_SEPARATOR = '\u0004';
    private static final String LIST_SEPARATOR = ":";

    private InpRecordMapper() {
    }

    static CatalogRecord map(String line, InpStructure structure) {
        String[] fields = line.split(String.valueOf(FIELD_SEPARATOR), -1);
        Map<String, String> row = new LinkedHashMap<>();
        List<String> columns = structure.columns();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), i < fields.length ? fields[i] : "");
        }

        CatalogRecord record = new CatalogRecord();
        record.setRawFields(row);
        record.setAuthors(splitList(row.get("author")));
        record.setGenres(splitList(row.get("genre")));
        record.setTitle(row.getOrDefault("title", ""));
        record.setSeries(ValidationUtils.hasText(row.get("series")) ? row.get("series") : null);
        record.setSeriesNumber(ValidationUtils.parseIntOrNull(row.get("serno")));
        record.setFileStub(row.getOrDefault("file", ""));
        record.setSize(ValidationUtils.parseLongOrNull(row.get("size")));
        record.setLibId(ValidationUtils.parseLongOrNull(row.get("libid")));
        record.setDeleted("1".equals(row.get("del")));
        record.setFileExtension(row.getOrDefault("ext", ""));
        record.setDate(ValidationUtils.hasText(row.get("date")) ? row.get("date") : null);
        record.setLanguage(row.get("lang"));
        record.setKeywords(row.get("keywords"));
        record.setFolder(ValidationUtils.hasText(row.get("folder")) ? row.get("folder") : null);
        return record;
    }

    /**
     * Colon-separated list with empty entries dropped, e.g. {@code Doe,John,:Roe,Jane,:}.
     */
    static List<String> splitList(String field) {
        List<String> values = new ArrayList<>();
        if (field == null || field.isEmpty()) {
            return values;
        }
        for (String value : field.split(LIST_SEPARATOR)) {
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
