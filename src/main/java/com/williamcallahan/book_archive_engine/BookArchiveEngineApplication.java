/**
 * Main application class for the book archive engine
 *
 * @author William Callahan
 *
 * Features:
 * - Boots the archive extractor, dump parser, range resolver and document assembler
 * - Imports a dump at startup when started with --import.dump=<path.inpx>
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.book_archive_engine;

import com.williamcallahan.book_archive_engine.service.CatalogImportService;
import com.williamcallahan.book_archive_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@SpringBootApplication
public class BookArchiveEngineApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BookArchiveEngineApplication.class);

    static final String IMPORT_OPTION = "import.dump";

    private final CatalogImportService catalogImportService;

    public BookArchiveEngineApplication(CatalogImportService catalogImportService) {
        this.catalogImportService = catalogImportService;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(BookArchiveEngineApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        String dump = firstOptionValue(args, IMPORT_OPTION);
        if (!ValidationUtils.hasText(dump)) {
            return;
        }
        Path path = Paths.get(dump.trim());
        log.info("Importing catalog dump {}", path);
        try {
            catalogImportService.importDump(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to import dump " + path, e);
        }
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
