package com.williamcallahan.book_archive_engine.types;

/**
 * Symbolic asset ID referenced from FB2 markup through a local {@code #id} link.
 *
 * @param id the referenced ID without the leading hash
 */
public record AssetReference(String id) {

    /**
     * Parses an {@code l:href} value.
     *
     * @return the reference, or null for empty or non-local links
     */
    public static AssetReference fromHref(String href) {
        if (href == null || href.length() < 2 || href.charAt(0) != '#') {
            return null;
        }
        return new AssetReference(href.substring(1));
    }

    public String toHref() {
        return "#" + id;
    }
}
