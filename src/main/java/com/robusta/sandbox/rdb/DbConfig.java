package com.robusta.sandbox.rdb;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

public final class DbConfig {
    private final String dsn;
    private final int maxIdle;

    public DbConfig(String dsn, int maxIdle) {
        checkArgument(!isNullOrEmpty(dsn), "A valid DSN (JDBC url) is required");
        checkArgument(maxIdle >= 0, "Max idle connections cannot be negative: %s", maxIdle);
        this.dsn = dsn;
        this.maxIdle = maxIdle;
    }

    public String getDsn() {
        return dsn;
    }

    public int getMaxIdle() {
        return maxIdle;
    }

    @Override
    public String toString() {
        return String.format("DSN: [%s]. Max Idle: [%d]", dsn, maxIdle);
    }
}
