package com.civicintel.servicerequest.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite data source at {@code service-request-ingest.store.path} (DB_PATH).
 *
 * Every connection is opened with foreign keys enforced, so a fact row can
 * never point at a dimension row that does not exist.
 */
@Configuration
@Slf4j
public class StoreConfig {

    private static final int BUSY_TIMEOUT_MS = 30_000;

    @Bean
    public DataSource dataSource(IngestProperties properties) {
        Path dbPath = Paths.get(properties.store().path()).toAbsolutePath();
        log.info("Using SQLite store at {}", dbPath);
        return sqliteDataSource(dbPath);
    }

    public static DataSource sqliteDataSource(Path dbPath) {
        ensureDirectory(dbPath.getParent());

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }

    private static void ensureDirectory(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory: " + dir, e);
        }
    }
}
