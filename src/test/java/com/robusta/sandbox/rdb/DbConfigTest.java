package com.robusta.sandbox.rdb;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class DbConfigTest {

    @Test
    public void testToString() throws Exception {
        DbConfig config = new DbConfig("jdbc:h2:mem:owl", 4);
        assertThat(config.toString(), is("DSN: [jdbc:h2:mem:owl]. Max Idle: [4]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstruct_whenDsnIsEmpty_shouldThrowIllegalArgument() throws Exception {
        new DbConfig("", 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstruct_whenMaxIdleIsNegative_shouldThrowIllegalArgument() throws Exception {
        new DbConfig("jdbc:h2:mem:owl", -1);
    }

    @Test(expected = InitializationException.class)
    public void testFromConfig_whenNoDriverAcceptsTheDsn_shouldThrowInitializationException() throws Exception {
        JDBCDbController.fromConfig(new DbConfig("jdbc:nosuchdriver://localhost/owl", 1));
    }
}
