package com.williamcallahan.book_archive_engine.resolver;

import com.williamcallahan.book_archive_engine.exception.ArchiveNotFoundException;
import com.williamcallahan.book_archive_engine.types.ArchiveInfo;
import com.williamcallahan.book_archive_engine.types.AssetKind;
import com.williamcallahan.book_archive_engine.types.ResolvedArchives;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveResolverTest {

    @TempDir
    Path root;

    private ArchiveResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        touch(root.resolve("fb2-10-20.7z"));
        touch(root.resolve("nested/d.fb2-21-30.7z"));
        touch(root.resolve("fb2-40-50.zip"));
        touch(root.resolve("notes.txt"));
        touch(root.resolve("covers/fb2-10-30.zip"));
        touch(root.resolve("images/F.FB2-15-25.ZIP"));
        resolver = new ArchiveResolver(root);
    }

    @Test
    void indexesEachKindFromItsOwnLocation() {
        assertThat(resolver.archives(AssetKind.PAYLOAD)).extracting(ArchiveInfo::start).containsExactly(10L, 21L);
        assertThat(resolver.archives(AssetKind.COVER)).extracting(ArchiveInfo::end).containsExactly(30L);
        assertThat(resolver.archives(AssetKind.ILLUSTRATION)).extracting(ArchiveInfo::start).containsExactly(15L);
    }

    @Test
    void resolvesAllKindsForCoveredId() {
        ResolvedArchives archives = resolver.resolve(22);

        assertThat(archives.payload()).endsWith(Path.of("nested", "d.fb2-21-30.7z"));
        assertThat(archives.cover()).endsWith(Path.of("covers", "fb2-10-30.zip"));
        assertThat(archives.illustration()).endsWith(Path.of("images", "F.FB2-15-25.ZIP"));
    }

    @ParameterizedTest
    @ValueSource(longs = {10, 15, 20})
    void rangeBoundsAreInclusive(long id) {
        assertThat(resolver.find(AssetKind.PAYLOAD, id)).hasValueSatisfying(p -> assertThat(p.getFileName().toString()).isEqualTo("fb2-10-20.7z"));
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 9, 31, 45, 1_000_000})
    void idsOutsideEveryRangeResolveToNothing(long id) {
        assertThat(resolver.find(AssetKind.PAYLOAD, id)).isEmpty();
    }

    @Test
    void unclaimedIdResolvesToNone() {
        ResolvedArchives archives = resolver.resolve(1_000_000);

        assertThat(archives.isEmpty()).isTrue();
        assertThat(archives).isEqualTo(ResolvedArchives.NONE);
        assertThat(resolver.resolve(12).get(AssetKind.ILLUSTRATION)).isEmpty();
    }

    @Test
    void gapsBetweenRangesDoNotBorrowTheNeighbour() {
        ArchiveRangeIndex index = new ArchiveRangeIndex(List.of(
            new ArchiveInfo(100, 199, Path.of("b.7z")),
            new ArchiveInfo(1, 10, Path.of("a.7z"))));

        assertThat(index.find(50)).isEmpty();
        assertThat(index.findLocation(5)).contains(Path.of("a.7z"));
        assertThat(index.findLocation(199)).contains(Path.of("b.7z"));
    }

    @Test
    void missingAssetDirectoriesYieldEmptyIndexes(@TempDir Path bare) throws IOException {
        touch(bare.resolve("fb2-1-5.7z"));

        ArchiveResolver payloadOnly = new ArchiveResolver(bare);

        assertThat(payloadOnly.resolve(3)).isEqualTo(new ResolvedArchives(payloadOnly.find(AssetKind.PAYLOAD, 3).orElseThrow(), null, null));
        assertThat(payloadOnly.index(AssetKind.COVER).isEmpty()).isTrue();
    }

    @Test
    void missingRootIsNotFound() {
        assertThatThrownBy(() -> new ArchiveResolver(root.resolve("absent")))
            .isInstanceOf(ArchiveNotFoundException.class);
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.createFile(file);
    }
}
