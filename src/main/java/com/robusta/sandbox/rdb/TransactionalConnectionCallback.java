package com.robusta.sandbox.rdb;

import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

// A failed commit is rolled back too, like a failed callback.
class TransactionalConnectionCallback implements DbController.ConnectionCallback {
    private final Logger LOGGER = LoggerFactory.getLogger(getClass());

    private final DbController.TransactionCallback transactionCallback;

    TransactionalConnectionCallback(DbController.TransactionCallback transactionCallback) {
        checkArgument(transactionCallback != null, "A valid transaction callback is required.");
        this.transactionCallback = transactionCallback;
    }

    @Override
    public void doWithConnection(Connection connection) throws SQLException {
        boolean previousAutoCommit = begin(connection);
        try {
            TransactionExt transaction = new TransactionExt(connection);
            try {
                TransactionOutcome outcome = transactionCallback.inTransaction(transaction);
                checkState(outcome != null, "The transaction callback returned no outcome");
                if (outcome == TransactionOutcome.COMMIT) {
                    transaction.commit();
                    LOGGER.trace("Transaction committed");
                    return;
                }
            } catch (Throwable failure) {
                LOGGER.trace("Failure inside the transaction, rolling back before re-throwing", failure);
                rollbackAfter(connection, failure);
                Throwables.throwIfInstanceOf(failure, SQLException.class);
                Throwables.throwIfUnchecked(failure);
                throw new DriverException("Unexpected failure inside the transaction", failure);
            }
            transaction.rollback();
            LOGGER.trace("Transaction rolled back as asked by the transaction callback");
        } finally {
            restoreAutoCommit(connection, previousAutoCommit);
        }
    }

    private boolean begin(Connection connection) {
        try {
            boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            LOGGER.trace("Began a transaction on the borrowed connection");
            return previousAutoCommit;
        } catch (SQLException e) {
            throw new DriverException("Unable to begin the transaction", e);
        }
    }

    private void rollbackAfter(Connection connection, Throwable failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            LOGGER.error("Rolling back the transaction failed. Reason for rollback was: ", failure);
            throw new CompositeFailureException(failure,
                    new DriverException("Unable to rollback the transaction", rollbackFailure));
        }
    }

    private void restoreAutoCommit(Connection connection, boolean previousAutoCommit) {
        try {
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            LOGGER.warn("SQL Exception trying to restore auto commit on the connection, logging and ignoring", e);
        }
    }
}
