package com.robusta.sandbox.rdb;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.Lists.newArrayListWithCapacity;

public class RowsExt implements AutoCloseable {
    private final ResultSet resultSet;
    private final Statement ownedStatement;

    public RowsExt(ResultSet resultSet) {
        this(resultSet, null);
    }

    /**
     * @param ownedStatement statement closed together with the result set, may be {@code null}
     */
    RowsExt(ResultSet resultSet, Statement ownedStatement) {
        checkArgument(resultSet != null, "A valid result set is required");
        this.resultSet = resultSet;
        this.ownedStatement = ownedStatement;
    }

    public ResultSet resultSet() {
        return resultSet;
    }

    public boolean next() {
        try {
            return resultSet.next();
        } catch (SQLException e) {
            throw new DriverException("Unable to advance to the next row", e);
        }
    }

    public List<String> columns() {
        try {
            ResultSetMetaData metaData = resultSet.getMetaData();
            List<String> columns = newArrayListWithCapacity(metaData.getColumnCount());
            for (int column = 1; column <= metaData.getColumnCount(); column++) {
                columns.add(metaData.getColumnLabel(column));
            }
            return columns;
        } catch (SQLException e) {
            throw new DriverException("Unable to read the columns of the result set", e);
        }
    }

    /**
     * @return every column value of the current row, in column order
     */
    public Object[] scan() {
        try {
            int columnCount = resultSet.getMetaData().getColumnCount();
            Object[] values = new Object[columnCount];
            for (int column = 1; column <= columnCount; column++) {
                values[column - 1] = resultSet.getObject(column);
            }
            return values;
        } catch (SQLException e) {
            throw new DriverException("Unable to scan the current row", e);
        }
    }

    public Object getObject(int column) {
        try {
            return resultSet.getObject(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public Object getObject(String column) {
        try {
            return resultSet.getObject(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public String getString(int column) {
        try {
            return resultSet.getString(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public String getString(String column) {
        try {
            return resultSet.getString(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public long getLong(int column) {
        try {
            return resultSet.getLong(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public long getLong(String column) {
        try {
            return resultSet.getLong(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public int getInt(int column) {
        try {
            return resultSet.getInt(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public int getInt(String column) {
        try {
            return resultSet.getInt(column);
        } catch (SQLException e) {
            throw columnFailure(column, e);
        }
    }

    public boolean wasNull() {
        try {
            return resultSet.wasNull();
        } catch (SQLException e) {
            throw new DriverException("Unable to check the last read value for null", e);
        }
    }

    @Override
    public void close() {
        JdbcOperations.closeQuietly(resultSet, "result set");
        JdbcOperations.closeQuietly(ownedStatement, "prepared statement");
    }

    private static DriverException columnFailure(Object column, SQLException e) {
        return new DriverException(String.format("Unable to read column '%s'", column), e);
    }
}
