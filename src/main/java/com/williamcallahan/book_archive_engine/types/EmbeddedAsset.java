package com.williamcallahan.book_archive_engine.types;

/**
 * Binary asset inlined into a composed document.
 *
 * @param id symbolic ID written to the binary block
 * @param sourceName archive member the bytes came from
 * @param contentType MIME type inferred from the member name
 * @param bytes raw asset bytes
 */
public record EmbeddedAsset(String id, String sourceName, String contentType, byte[] bytes) {
}
