package com.williamcallahan.book_archive_engine.types;

/**
 * Details read from a payload's description block for a book detail view.
 *
 * @param publishYear text of {@code publish-info/year}, or null
 * @param annotation inner markup of the first {@code annotation}, or null
 * @param coverAvailable whether the cover archive holds a member named after the book
 */
public record BookDetails(String publishYear, String annotation, boolean coverAvailable) {

    public static final BookDetails EMPTY = new BookDetails(null, null, false);
}
