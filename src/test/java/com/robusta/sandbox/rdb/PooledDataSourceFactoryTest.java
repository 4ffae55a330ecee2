package com.robusta.sandbox.rdb;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.Test;

import java.util.UUID;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class PooledDataSourceFactoryTest {

    @Test
    public void testCreate_shouldKeepMaxIdleConnectionsWithinTheDefaultPoolSize() throws Exception {
        HikariDataSource pool = PooledDataSourceFactory.create(new DbConfig(aDsn(), 3));
        try {
            assertThat(pool.getMinimumIdle(), is(3));
            assertThat(pool.getMaximumPoolSize(), is(PooledDataSourceFactory.DEFAULT_MAXIMUM_POOL_SIZE));
        } finally {
            pool.close();
        }
    }

    @Test
    public void testCreate_whenMaxIdleExceedsDefaultPoolSize_shouldGrowThePool() throws Exception {
        HikariDataSource pool = PooledDataSourceFactory.create(new DbConfig(aDsn(), 12));
        try {
            assertThat(pool.getMinimumIdle(), is(12));
            assertThat(pool.getMaximumPoolSize(), is(12));
        } finally {
            pool.close();
        }
    }

    private static String aDsn() {
        return "jdbc:h2:mem:pool-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    }
}
