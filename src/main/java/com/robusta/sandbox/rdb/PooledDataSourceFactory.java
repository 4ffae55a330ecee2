package com.robusta.sandbox.rdb;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Hikari has no cap on idle connections, only a floor ({@code minimumIdle}); connections above it are
 * retired after the idle timeout. {@link DbConfig#getMaxIdle()} becomes that floor, never above the
 * pool size, and the pool grows to at least {@value #DEFAULT_MAXIMUM_POOL_SIZE} connections.
 */
public final class PooledDataSourceFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(PooledDataSourceFactory.class);
    static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;

    private PooledDataSourceFactory() {
    }

    public static HikariDataSource create(DbConfig config) {
        checkArgument(config != null, "A valid database configuration is required");
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getDsn());
        int maximumPoolSize = Math.max(config.getMaxIdle(), DEFAULT_MAXIMUM_POOL_SIZE);
        hikariConfig.setMaximumPoolSize(maximumPoolSize);
        hikariConfig.setMinimumIdle(Math.min(config.getMaxIdle(), maximumPoolSize));
        LOGGER.debug("Creating connection pool for {}", config);
        return new HikariDataSource(hikariConfig);
    }
}
