package com.kmg.repost.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final RepostProperties properties;
    private final JdbcTemplate jdbcTemplate;

    public StartupInitializer(RepostProperties properties, JdbcTemplate jdbcTemplate) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        initializeSchema();
        log.info("Schedule store ready at {}", properties.getState().getDbPath());
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        String sessionStatePath = properties.getAction().getSessionStatePath();
        if (sessionStatePath != null && !sessionStatePath.isBlank()) {
            Path sessionParent = Path.of(sessionStatePath).getParent();
            if (sessionParent != null) {
                Files.createDirectories(sessionParent);
            }
        }
    }

    public void initializeSchema() {
        configureSqlitePragmas();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS schedules (
              id TEXT PRIMARY KEY,
              url TEXT NOT NULL,
              period_hours REAL NOT NULL,
              jitter_minutes INTEGER NOT NULL DEFAULT 7,
              next_run INTEGER,
              last_result TEXT,
              active INTEGER NOT NULL DEFAULT 1,
              created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_schedules_due ON schedules(active, next_run)");
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
