package com.robusta.sandbox.rdb;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public class ResultExt {
    private final long rowsAffected;
    private final Long lastInsertId;
    private final SQLException lastInsertIdFailure;

    public ResultExt(long rowsAffected, Long lastInsertId) {
        this(rowsAffected, lastInsertId, null);
    }

    private ResultExt(long rowsAffected, Long lastInsertId, SQLException lastInsertIdFailure) {
        this.rowsAffected = rowsAffected;
        this.lastInsertId = lastInsertId;
        this.lastInsertIdFailure = lastInsertIdFailure;
    }

    static ResultExt fromExecutedStatement(PreparedStatement preparedStatement, int rowsAffected, boolean keysRequested) {
        if (!keysRequested) {
            return new ResultExt(rowsAffected, null);
        }
        ResultSet generatedKeys = null;
        try {
            generatedKeys = preparedStatement.getGeneratedKeys();
            Long lastInsertId = null;
            while (generatedKeys != null && generatedKeys.next()) {
                lastInsertId = generatedKeys.getLong(1);
            }
            return new ResultExt(rowsAffected, lastInsertId);
        } catch (SQLException e) {
            return new ResultExt(rowsAffected, null, e);
        } finally {
            JdbcOperations.closeQuietly(generatedKeys, "generated keys");
        }
    }

    public long lastInsertId() {
        if (lastInsertIdFailure != null) {
            throw new DriverException("Unable to read the generated key of the statement", lastInsertIdFailure);
        }
        if (lastInsertId == null) {
            throw new DriverException("The statement did not generate any key");
        }
        return lastInsertId;
    }

    public long rowsAffected() {
        if (rowsAffected < 0) {
            throw new DriverException("The driver did not report the number of affected rows");
        }
        return rowsAffected;
    }
}
