package com.williamcallahan.book_archive_engine.service.assembly;

import java.util.Locale;
import java.util.Map;

/**
 * Content types for inlined assets, inferred from the archive member name.
 */
public final class AssetContentTypes {

    public static final String JPEG = "image/jpeg";
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
        "jpg", JPEG,
        "jpeg", JPEG,
        "png", "image/png",
        "gif", "image/gif"
    );

    private AssetContentTypes() {
    }

    /**
     * Extension-less names are assumed to be JPEG, the format cover archives ship in.
     */
    public static String fromFileName(String name) {
        String fileName = lastSegment(name);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return JPEG;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, OCTET_STREAM);
    }

    static String lastSegment(String name) {
        if (name == null) {
            return "";
        }
        String normalized = name.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
