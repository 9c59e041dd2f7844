/**
 * Wires the archive range resolver when a dump root is configured
 *
 * @author William Callahan
 *
 * Features:
 * - Builds the ArchiveResolver once at startup from app.library.dump-root
 * - Leaves the resolver out of the context when no dump root is set, so imports
 *   store records without archive locations
 */

package com.williamcallahan.book_archive_engine.config;

import com.williamcallahan.book_archive_engine.resolver.ArchiveResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class LibraryArchiveConfig {

    private static final Logger log = LoggerFactory.getLogger(LibraryArchiveConfig.class);

    @Bean
    @ConditionalOnExpression("'${app.library.dump-root:}'.trim().length() > 0")
    public ArchiveResolver archiveResolver(LibraryArchiveProperties properties) {
        log.info("Building archive resolver for dump root {}", properties.getDumpRoot());
        return new ArchiveResolver(Paths.get(properties.getDumpRoot()), properties);
    }
}
