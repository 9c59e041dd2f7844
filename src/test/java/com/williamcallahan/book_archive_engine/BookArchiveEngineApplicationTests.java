/**
 * Application context load test for the book archive engine
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads under the "test" profile
 * - Checks that no archive resolver is built when no dump root is configured
 * - Validates binding of the app.library properties
 */

package com.williamcallahan.book_archive_engine;

import com.williamcallahan.book_archive_engine.archive.ArchiveMemberExtractor;
import com.williamcallahan.book_archive_engine.config.LibraryArchiveProperties;
import com.williamcallahan.book_archive_engine.repository.CatalogStore;
import com.williamcallahan.book_archive_engine.resolver.ArchiveResolver;
import com.williamcallahan.book_archive_engine.service.CatalogImportService;
import com.williamcallahan.book_archive_engine.service.assembly.Fb2DocumentAssembler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class BookArchiveEngineApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private LibraryArchiveProperties properties;

    @Test
    void contextLoadsWithoutDumpRoot() {
        assertThat(context.getBean(CatalogImportService.class)).isNotNull();
        assertThat(context.getBean(Fb2DocumentAssembler.class)).isNotNull();
        assertThat(context.getBean(ArchiveMemberExtractor.class)).isNotNull();
        assertThat(context.getBean(CatalogStore.class)).isNotNull();
        assertThat(context.getBeansOfType(ArchiveResolver.class)).isEmpty();
    }

    @Test
    void bindsLibraryProperties() {
        assertThat(properties.getImportChunkSize()).isEqualTo(2);
        assertThat(properties.getFallbackEncoding()).isEqualTo("windows-1251");
        assertThat(properties.getDefaultCoverId()).isEqualTo("cover.jpg");
    }
}
