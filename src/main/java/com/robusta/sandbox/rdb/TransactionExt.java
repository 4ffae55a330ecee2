package com.robusta.sandbox.rdb;

import java.sql.Connection;
import java.sql.SQLException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Must not be used again once the transaction is committed or rolled back.
 */
public class TransactionExt {
    private final Connection connection;

    TransactionExt(Connection connection) {
        checkArgument(connection != null, "A valid connection is required for the transaction");
        this.connection = connection;
    }

    public Connection connection() {
        return connection;
    }

    public ResultExt exec(String sql, Object... arguments) {
        return JdbcOperations.executeUpdate(connection, sql, arguments);
    }

    public StatementExt prepare(String sql) {
        if (JdbcOperations.isInsert(sql)) {
            return new StatementExt(JdbcOperations.prepareForKeys(connection, sql), sql, true);
        }
        return new StatementExt(JdbcOperations.prepare(connection, sql), sql, false);
    }

    /**
     * The returned rows must be closed by the caller.
     */
    public RowsExt query(String sql, Object... arguments) {
        return JdbcOperations.openRows(connection, sql, arguments);
    }

    public long queryForRows(DbController.RowsCallback rowsCallback, String sql, Object... arguments) throws SQLException {
        return JdbcOperations.queryForRows(connection, rowsCallback, sql, arguments);
    }

    public void queryForRow(DbController.RowCallback rowCallback, String sql, Object... arguments) throws SQLException {
        JdbcOperations.queryForRow(connection, rowCallback, sql, arguments);
    }

    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new DriverException("Unable to commit the transaction", e);
        }
    }

    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new DriverException("Unable to rollback the transaction", e);
        }
    }
}
