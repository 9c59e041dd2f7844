/**
 * Library dump and archive configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.book_archive_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.library")
public class LibraryArchiveProperties {
    private String dumpRoot;
    private String payloadToken = "fb2";
    private String payloadExtension = "7z";
    private String assetExtension = "zip";
    private String coversDir = "covers";
    private String imagesDir = "images";
    private String encoding = "UTF-8";
    private String fallbackEncoding = "windows-1251";
    private long progressIntervalBytes = 500_000L;
    private String scratchDir;
    private int importChunkSize = 1000;
    private String defaultCoverId = "cover.jpg";

    // Getters and setters
    public String getDumpRoot() { return dumpRoot; }
    public void setDumpRoot(String dumpRoot) { this.dumpRoot = dumpRoot; }

    public String getPayloadToken() { return payloadToken; }
    public void setPayloadToken(String payloadToken) { this.payloadToken = payloadToken; }

    public String getPayloadExtension() { return payloadExtension; }
    public void setPayloadExtension(String payloadExtension) { this.payloadExtension = payloadExtension; }

    public String getAssetExtension() { return assetExtension; }
    public void setAssetExtension(String assetExtension) { this.assetExtension = assetExtension; }

    public String getCoversDir() { return coversDir; }
    public void setCoversDir(String coversDir) { this.coversDir = coversDir; }

    public String getImagesDir() { return imagesDir; }
    public void setImagesDir(String imagesDir) { this.imagesDir = imagesDir; }

    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }

    public String getFallbackEncoding() { return fallbackEncoding; }
    public void setFallbackEncoding(String fallbackEncoding) { this.fallbackEncoding = fallbackEncoding; }

    public long getProgressIntervalBytes() { return progressIntervalBytes; }
    public void setProgressIntervalBytes(long progressIntervalBytes) { this.progressIntervalBytes = progressIntervalBytes; }

    public String getScratchDir() { return scratchDir; }
    public void setScratchDir(String scratchDir) { this.scratchDir = scratchDir; }

    public int getImportChunkSize() { return importChunkSize; }
    public void setImportChunkSize(int importChunkSize) { this.importChunkSize = importChunkSize; }

    public String getDefaultCoverId() { return defaultCoverId; }
    public void setDefaultCoverId(String defaultCoverId) { this.defaultCoverId = defaultCoverId; }
}
