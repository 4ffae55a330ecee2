package com.robusta.sandbox.rdb;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Failures inside any operation are re-thrown to the caller unless {@link FailureHandler}s are
 * registered, in which case only the handlers receive them.
 */
public interface DbController {
    void registerFailureHandler(FailureHandler failureHandler);

    void operate(ConnectionCallback connectionCallback) throws NotInitializedException;

    /**
     * @return the execution result, or {@code null} if a failure was consumed by a registered handler
     */
    ResultExt execute(String sql, Object... arguments) throws NotInitializedException;

    /**
     * @return the number of rows handed to the callback
     */
    long queryForRows(RowsCallback rowsCallback, String sql, Object... arguments) throws NotInitializedException;

    void queryForRow(RowCallback rowCallback, String sql, Object... arguments) throws NotInitializedException;

    void runInTransaction(TransactionCallback transactionCallback) throws NotInitializedException;

    void runConditionallyInTransaction(TransactionCondition bootCallback, TransactionStep thenCallback) throws NotInitializedException;

    void runConditionallyInTransaction(ConditionalTransaction conditionalTransaction) throws NotInitializedException;

    void executeManyInTransaction(String... queries) throws NotInitializedException;

    /**
     * Closes the connection handle. The controller is unusable afterwards; a second call fails with
     * {@link NotInitializedException}.
     */
    void release() throws NotInitializedException;

    interface ConnectionCallback {
        void doWithConnection(Connection connection) throws SQLException;
    }

    interface RowsCallback {
        IterationSignal nextRow(RowsExt rows) throws SQLException;
    }

    interface RowCallback {
        void resultRow(RowExt row) throws SQLException;
    }

    interface TransactionCallback {
        TransactionOutcome inTransaction(TransactionExt transaction) throws SQLException;
    }

    interface TransactionCondition {
        boolean test(TransactionExt transaction) throws SQLException;
    }

    interface TransactionStep {
        void run(TransactionExt transaction) throws SQLException;
    }

    interface ConditionalTransaction {
        /** First call on the database, deciding whether {@link #ifTrue} runs. */
        boolean bootCallback(TransactionExt transaction) throws SQLException;

        void ifTrue(TransactionExt transaction) throws SQLException;
    }

    interface FailureHandler {
        void onFailure(Throwable failure);
    }
}
