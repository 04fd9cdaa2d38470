package com.uptimer.config;

import com.uptimer.util.DsnParser;
import com.uptimer.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the connection pool for the uptime check store.
 *
 * <p>The pool opens one connection eagerly, so an unreachable store stops the application at
 * startup instead of failing on the first batch.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource uptimeStoreDataSource(UptimerProperties properties) {
        UptimerProperties.Store store = properties.getStore();
        if (store.getDsn() == null || store.getDsn().isBlank()) {
            throw new IllegalStateException("uptimer.store.dsn is not configured (set SECRET_XATA_PG_ENDPOINT)");
        }

        JdbcConnectionInfo info = DsnParser.parse(store.getDsn());

        HikariConfig config = new HikariConfig();
        config.setPoolName("uptime-store");
        config.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null && !info.getUsername().isEmpty()) {
            config.setUsername(info.getUsername());
        }
        if (info.getPassword() != null && !info.getPassword().isEmpty()) {
            config.setPassword(info.getPassword());
        }
        config.setMaximumPoolSize(store.getMaximumPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(store.getConnectionTimeout().toMillis());
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(1);

        log.info("Connecting to uptime store: jdbc_url={}, pool_size={}", info.getUrl(), store.getMaximumPoolSize());
        return new HikariDataSource(config);
    }
}
