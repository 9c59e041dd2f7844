package com.williamcallahan.book_archive_engine.types;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Archive locations owning one document ID. Any component may be null when no archive
 * claims the ID for that kind.
 */
public record ResolvedArchives(Path payload, Path cover, Path illustration) {

    public static final ResolvedArchives NONE = new ResolvedArchives(null, null, null);

    public Optional<Path> get(AssetKind kind) {
        return Optional.ofNullable(switch (kind) {
            case PAYLOAD -> payload;
            case COVER -> cover;
            case ILLUSTRATION -> illustration;
        });
    }

    public boolean isEmpty() {
        return payload == null && cover == null && illustration == null;
    }
}
