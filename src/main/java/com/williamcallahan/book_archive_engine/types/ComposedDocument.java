package com.williamcallahan.book_archive_engine.types;

import java.util.List;

/**
 * Result of assembling one FB2 document with its binary assets inlined.
 */
public class ComposedDocument {
    private final long libId;
    private final byte[] content;
    private final String coverId;
    private final List<EmbeddedAsset> assets;
    private final String fileName;

    public ComposedDocument(long libId, byte[] content, String coverId, List<EmbeddedAsset> assets, String fileName) {
        this.libId = libId;
        this.content = content;
        this.coverId = coverId;
        this.assets = assets == null ? List.of() : List.copyOf(assets);
        this.fileName = fileName;
    }

    public long getLibId() {
        return libId;
    }

    /**
     * Serialized document, UTF-8 with an XML declaration
     */
    public byte[] getContent() {
        return content;
    }

    public String getCoverId() {
        return coverId;
    }

    public List<EmbeddedAsset> getAssets() {
        return assets;
    }

    public boolean hasCover() {
        return assets.stream().anyMatch(asset -> asset.id().equals(coverId));
    }

    /**
     * Suggested download name for the presentation layer
     */
    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return "application/xml+fictionbook";
    }
}
