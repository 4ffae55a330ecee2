package com.robusta.sandbox.rdb;

import java.sql.PreparedStatement;
import java.sql.SQLException;

import static com.google.common.base.Preconditions.checkArgument;

public class StatementExt implements AutoCloseable {
    private final PreparedStatement preparedStatement;
    private final String sql;
    private final boolean generatesKeys;

    StatementExt(PreparedStatement preparedStatement, String sql, boolean generatesKeys) {
        checkArgument(preparedStatement != null, "A valid prepared statement is required");
        this.preparedStatement = preparedStatement;
        this.sql = sql;
        this.generatesKeys = generatesKeys;
    }

    public PreparedStatement preparedStatement() {
        return preparedStatement;
    }

    public ResultExt exec(Object... arguments) {
        JdbcOperations.bind(preparedStatement, sql, arguments);
        try {
            return ResultExt.fromExecutedStatement(preparedStatement, preparedStatement.executeUpdate(), generatesKeys);
        } catch (SQLException e) {
            throw new DriverException("Execute SQL with exception", e, sql, arguments);
        }
    }

    /**
     * The returned rows must be closed by the caller; the statement stays open for reuse.
     */
    public RowsExt query(Object... arguments) {
        JdbcOperations.bind(preparedStatement, sql, arguments);
        try {
            return new RowsExt(preparedStatement.executeQuery());
        } catch (SQLException e) {
            throw new DriverException("Query SQL with exception", e, sql, arguments);
        }
    }

    @Override
    public void close() {
        try {
            preparedStatement.close();
        } catch (SQLException e) {
            throw new DriverException("Unable to close the prepared statement", e, sql);
        }
    }
}
