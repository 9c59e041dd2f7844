package com.williamcallahan.book_archive_engine.inpx;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Column order of {@code .inp} lines, read from {@code structure.info} or defaulted.
 */
public final class InpStructure {

    public static final String STRUCTURE_MEMBER = "structure.info";

    static final String DEFAULT_STRUCTURE = "AUTHOR;GENRE;TITLE;SERIES;SERNO;FILE;SIZE;LIBID;DEL;EXT;DATE;LANG;KEYWORDS;FOLDER;";

    public static final InpStructure DEFAULT = new InpStructure(split(DEFAULT_STRUCTURE));

    private final List<String> columns;

    private InpStructure(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    /**
     * Parse a semicolon-separated column list; the trailing separator is optional and
     * names are lower-cased. A blank list yields {@link #DEFAULT}.
     */
    public static InpStructure parse(String structureLine) {
        List<String> columns = split(structureLine);
        return columns.isEmpty() ? DEFAULT : new InpStructure(columns);
    }

    private static List<String> split(String structureLine) {
        String line = structureLine == null ? "" : structureLine.replace("\uFEFF", "").trim();
        List<String> columns = new ArrayList<>();
        for (String name : line.split(";")) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                columns.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    @Override
    public String toString() {
        return String.join(";", columns);
    }
}
