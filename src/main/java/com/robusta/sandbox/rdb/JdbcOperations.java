package com.robusta.sandbox.rdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

enum JdbcOperations {
    ;

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcOperations.class);

    static ResultExt executeUpdate(Connection connection, String sql, Object... arguments) {
        boolean generatesKeys = isInsert(sql);
        PreparedStatement preparedStatement = generatesKeys ? prepareForKeys(connection, sql) : prepare(connection, sql);
        try {
            bind(preparedStatement, sql, arguments);
            int rowsAffected = preparedStatement.executeUpdate();
            LOGGER.trace("Executed SQL: '{}', {} row(s) affected", sql, rowsAffected);
            return ResultExt.fromExecutedStatement(preparedStatement, rowsAffected, generatesKeys);
        } catch (SQLException e) {
            throw new DriverException("Execute SQL with exception", e, sql, arguments);
        } finally {
            closeQuietly(preparedStatement, "prepared statement");
        }
    }

    static long queryForRows(Connection connection, DbController.RowsCallback rowsCallback,
                             String sql, Object... arguments) throws SQLException {
        checkArgument(rowsCallback != null, "A valid rows callback is required");
        RowsExt rows = openRows(connection, sql, arguments);
        long numberOfRows = 0;
        try {
            while (rows.next()) {
                numberOfRows++;
                if (rowsCallback.nextRow(rows) == IterationSignal.STOP) {
                    LOGGER.trace("Rows callback stopped the iteration at row {}", numberOfRows);
                    break;
                }
            }
            return numberOfRows;
        } finally {
            rows.close();
        }
    }

    static void queryForRow(Connection connection, DbController.RowCallback rowCallback,
                            String sql, Object... arguments) throws SQLException {
        checkArgument(rowCallback != null, "A valid row callback is required");
        RowsExt rows = openRows(connection, sql, arguments);
        try {
            rowCallback.resultRow(new RowExt(rows, rows.next()));
        } finally {
            rows.close();
        }
    }

    static RowsExt openRows(Connection connection, String sql, Object... arguments) {
        PreparedStatement preparedStatement = prepare(connection, sql);
        boolean opened = false;
        try {
            bind(preparedStatement, sql, arguments);
            RowsExt rows = new RowsExt(preparedStatement.executeQuery(), preparedStatement);
            opened = true;
            return rows;
        } catch (SQLException e) {
            throw new DriverException("Query SQL with exception", e, sql, arguments);
        } finally {
            if (!opened) {
                closeQuietly(preparedStatement, "prepared statement");
            }
        }
    }

    static PreparedStatement prepare(Connection connection, String sql) {
        checkPreparable(connection, sql);
        try {
            return connection.prepareStatement(sql);
        } catch (SQLException e) {
            throw new DriverException("Prepare SQL with exception", e, sql);
        }
    }

    static PreparedStatement prepareForKeys(Connection connection, String sql) {
        checkPreparable(connection, sql);
        try {
            return connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
        } catch (SQLException e) {
            throw new DriverException("Prepare SQL with exception", e, sql);
        }
    }

    /**
     * Only INSERTs ask the driver for generated keys: on UPDATE some drivers report the keys of the
     * updated rows, others return every affected row.
     */
    static boolean isInsert(String sql) {
        return sql != null && sql.trim().regionMatches(true, 0, "INSERT", 0, "INSERT".length());
    }

    private static void checkPreparable(Connection connection, String sql) {
        checkArgument(!isNullOrEmpty(sql), "A valid SQL (as string) is required to prepare the statement");
        checkArgument(connection != null, "A valid Connection is required to prepare the statement");
        LOGGER.trace("Asked to prepare a statement for SQL string: '{}'", sql);
    }

    static void bind(PreparedStatement preparedStatement, String sql, Object... arguments) {
        if (arguments == null) {
            return;
        }
        try {
            for (int i = 0; i < arguments.length; i++) {
                preparedStatement.setObject(i + 1, arguments[i]);
            }
        } catch (SQLException e) {
            throw new DriverException("Bind parameters with exception", e, sql, arguments);
        }
    }

    static void closeQuietly(AutoCloseable closeable, String what) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOGGER.warn("Exception trying to close the {}, logging and ignoring", what, e);
            }
        }
    }
}
