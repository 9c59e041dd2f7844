package com.williamcallahan.book_archive_engine.types;

/**
 * Kinds of range-partitioned archives that make up the library dump.
 */
public enum AssetKind {
    /** Primary FB2 payload archives at the dump root */
    PAYLOAD,
    /** Cover image archives */
    COVER,
    /** Inline illustration archives */
    ILLUSTRATION
}
