package com.williamcallahan.book_archive_engine.inpx;

/**
 * Side channel for long-running dump parses.
 *
 * <p>{@link #onProgress} is called at most once per configured byte interval of each
 * {@code .inp} member and always once when a member is finished, with
 * {@code processed == total}.</p>
 */
@FunctionalInterface
public interface ParseProgressListener {

    ParseProgressListener NONE = (member, processed, total) -> { };

    void onProgress(String memberName, long processedBytes, long totalBytes);

    /**
     * A line was not valid in the primary encoding and was decoded with the fallback
     * charset. Lines are numbered from 1 within their member.
     */
    default void onDecodeFallback(String memberName, long lineNumber) {
    }
}
