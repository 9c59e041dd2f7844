package com.williamcallahan.book_archive_engine.service;

import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.inpx.InpxParser;
import com.williamcallahan.book_archive_engine.model.CatalogRecord;
import com.williamcallahan.book_archive_engine.monitoring.MetricsService;
import com.williamcallahan.book_archive_engine.repository.CatalogStore;
import com.williamcallahan.book_archive_engine.repository.InMemoryCatalogStore;
import com.williamcallahan.book_archive_engine.resolver.ArchiveResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.inpLine;
import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.members;
import static com.williamcallahan.book_archive_engine.testutil.ArchiveFixtures.writeZip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CatalogImportServiceTest {

    private static final String STRUCTURE = "AUTHOR;GENRE;TITLE;SERIES;SERNO;FILE;SIZE;LIBID;DEL;EXT;DATE;";

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private InpxParser parser;
    private CatalogStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(registry);
        parser = new InpxParser(new LibraryArchiveProperties(), metrics);
        store = spy(new InMemoryCatalogStore());
    }

    @Test
    void importsInChunksSkippingInvalidAndDuplicateIds() throws IOException {
        Path dump = writeZip(tempDir.resolve("lib.inpx"), members("structure.info", STRUCTURE, "a.inp", String.join("\n",
            line("1", "One"), line("", "No id"), line("2", "Two"), line("1", "One again"), line("3", "Three"))));
        CatalogImportService service = new CatalogImportService(parser, store, null, new MetricsService(registry), 2);

        ImportSummary summary = service.importDump(dump);

        assertThat(summary.getImported()).isEqualTo(3);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getDuplicates()).isEqualTo(1);
        assertThat(summary.getUnresolved()).isZero();
        assertThat(store.findAll()).extracting(CatalogRecord::getTitle).containsExactly("One", "Two", "Three");
        verify(store, times(2)).saveAllIfAbsent(anyCollection());
        assertThat(registry.counter("inpx.records.skipped").count()).isEqualTo(1.0);
    }

    @Test
    void attachesArchivesWhenResolverIsConfigured() throws IOException {
        Path root = tempDir.resolve("library");
        Files.createDirectories(root.resolve("covers"));
        Files.createFile(root.resolve("fb2-1-10.7z"));
        Files.createFile(root.resolve("covers/fb2-1-10.zip"));
        Path dump = writeZip(tempDir.resolve("lib.inpx"), members("structure.info", STRUCTURE, "a.inp",
            line("5", "Inside") + "\n" + line("50", "Outside")));
        CatalogImportService service = new CatalogImportService(parser, store, new ArchiveResolver(root),
            new MetricsService(registry), 100);

        ImportSummary summary = service.importDump(dump);

        assertThat(summary.getUnresolved()).isEqualTo(1);
        CatalogRecord inside = store.findById(5).orElseThrow();
        assertThat(inside.getPayloadArchive()).endsWith(Path.of("fb2-1-10.7z"));
        assertThat(inside.getCoverArchive()).endsWith(Path.of("covers", "fb2-1-10.zip"));
        assertThat(inside.getIllustrationArchive()).isNull();
        assertThat(store.findById(50).orElseThrow().getPayloadArchive()).isNull();
        assertThat(summary.toMap()).containsEntry("imported", 2L);
    }

    private static String line(String id, String title) {
        return inpLine("Doe,John,", "sf:", title, "", "", "file" + id, "100", id, "", "fb2", "2020-01-01");
    }
}
