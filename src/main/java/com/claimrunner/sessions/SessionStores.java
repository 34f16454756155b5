package com.claimrunner.sessions;

import com.claimrunner.shared.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;

import javax.sql.DataSource;
import java.nio.file.Path;

/** Picks the session store backend once, at startup. */
public final class SessionStores {

    private static final Logger log = LoggerFactory.getLogger(SessionStores.class);

    private SessionStores() {
    }

    public static SessionStore create(StoreConfig config) {
        return switch (config.backend()) {
            case FILE -> {
                log.info("Session store: file {}", config.file());
                yield new JsonFileSessionStore(Path.of(config.file()));
            }
            case POSTGRES -> {
                log.info("Session store: postgres {}", config.redactedUrl());
                yield new PostgresSessionStore(dataSource(config));
            }
        };
    }

    static DataSource dataSource(StoreConfig config) {
        return DataSourceBuilder.create()
                .driverClassName("org.postgresql.Driver")
                .url(config.url())
                .username(config.username())
                .password(config.password())
                .build();
    }
}
