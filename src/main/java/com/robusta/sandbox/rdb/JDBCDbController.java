package com.robusta.sandbox.rdb;

import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.base.Preconditions.checkArgument;

public class JDBCDbController implements DbController {
    private final Logger LOGGER = LoggerFactory.getLogger(getClass());

    private volatile DataSource dataSource;
    private final List<FailureHandler> failureHandlers = new CopyOnWriteArrayList<FailureHandler>();

    public JDBCDbController(DataSource dataSource) {
        if (dataSource == null) {
            throw new InitializationException("Need viable data source (javax.sql.DataSource)");
        }
        this.dataSource = dataSource;
    }

    public static JDBCDbController fromConfig(DbConfig config) {
        checkArgument(config != null, "A valid database configuration is required");
        DataSource pool;
        try {
            pool = PooledDataSourceFactory.create(config);
        } catch (RuntimeException e) {
            throw new InitializationException(String.format("Unable to create the connection pool for %s", config), e);
        }
        return new JDBCDbController(pool);
    }

    @Override
    public void registerFailureHandler(FailureHandler failureHandler) {
        checkArgument(failureHandler != null, "A valid failure handler is required.");
        failureHandlers.add(failureHandler);
    }

    @Override
    public void operate(ConnectionCallback connectionCallback) throws NotInitializedException {
        checkArgument(connectionCallback != null, "A valid connection call back is required.");
        DataSource currentDataSource = needInitialized();
        try {
            Connection connection = borrowConnectionFromDataSource(currentDataSource);
            LOGGER.trace("Borrowed a connection, passing connection to the connection callback");
            try {
                connectionCallback.doWithConnection(connection);
                LOGGER.trace("Connection callback finished with connection");
            } finally {
                JdbcOperations.closeQuietly(connection, "connection");
            }
        } catch (Throwable failure) {
            handleFailure(failure);
        }
    }

    @Override
    public ResultExt execute(String sql, Object... arguments) throws NotInitializedException {
        ExecutingConnectionCallback executingCallback = new ExecutingConnectionCallback(sql, arguments);
        operate(executingCallback);
        return executingCallback.result;
    }

    @Override
    public long queryForRows(RowsCallback rowsCallback, String sql, Object... arguments) throws NotInitializedException {
        RowCountingRowsCallback countingCallback = new RowCountingRowsCallback(rowsCallback);
        operate(new RowsQueryingConnectionCallback(countingCallback, sql, arguments));
        return countingCallback.numberOfRows;
    }

    @Override
    public void queryForRow(RowCallback rowCallback, String sql, Object... arguments) throws NotInitializedException {
        operate(new RowQueryingConnectionCallback(rowCallback, sql, arguments));
    }

    @Override
    public void runInTransaction(TransactionCallback transactionCallback) throws NotInitializedException {
        operate(new TransactionalConnectionCallback(transactionCallback));
    }

    @Override
    public void runConditionallyInTransaction(TransactionCondition bootCallback, TransactionStep thenCallback) throws NotInitializedException {
        runInTransaction(new ConditionalTransactionCallback(bootCallback, thenCallback));
    }

    @Override
    public void runConditionallyInTransaction(ConditionalTransaction conditionalTransaction) throws NotInitializedException {
        checkArgument(conditionalTransaction != null, "A valid conditional transaction is required");
        runInTransaction(new ConditionalTransactionCallback(
                new BootCallbackCondition(conditionalTransaction), new IfTrueStep(conditionalTransaction)));
    }

    @Override
    public void executeManyInTransaction(String... queries) throws NotInitializedException {
        runInTransaction(transactionForQueries(queries));
    }

    /**
     * Builds a callback executing the given statements in order, always committing.
     */
    public static TransactionCallback transactionForQueries(String... queries) {
        return new ManyQueriesTransactionCallback(queries);
    }

    @Override
    public void release() throws NotInitializedException {
        DataSource currentDataSource = needInitialized();
        try {
            if (currentDataSource instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) currentDataSource).close();
                } catch (Exception e) {
                    LOGGER.error("Release database connection error", e);
                    throw new DriverException("Release database connection error", e);
                }
            }
            dataSource = null;
            LOGGER.debug("Released the data source, controller is no longer usable");
        } catch (Throwable failure) {
            handleFailure(failure);
        }
    }

    protected Connection borrowConnectionFromDataSource(DataSource currentDataSource) {
        try {
            return currentDataSource.getConnection();
        } catch (SQLException e) {
            LOGGER.trace("Controller was unable to borrow a connection from the data source");
            throw new DriverException("Unable to borrow a connection from the data source", e);
        }
    }

    private DataSource needInitialized() {
        DataSource currentDataSource = dataSource;
        if (currentDataSource == null) {
            throw new NotInitializedException();
        }
        return currentDataSource;
    }

    /**
     * Dispatches the failure to the registered handlers, or re-throws it when there are none.
     * A handler throwing ends the dispatch and its exception reaches the caller.
     */
    private void handleFailure(Throwable failure) {
        if (failure instanceof SQLException) {
            failure = new DriverException("Database operation failed", failure);
        }

        if (failureHandlers.isEmpty()) {
            Throwables.throwIfUnchecked(failure);
            throw new DriverException("Unexpected failure in connection callback", failure);
        }

        LOGGER.debug("Dispatching failure to {} handler(s): {}", failureHandlers.size(), failure.toString());
        for (FailureHandler failureHandler : failureHandlers) {
            failureHandler.onFailure(failure);
        }
    }

    private static class ExecutingConnectionCallback implements ConnectionCallback {
        private final String sql;
        private final Object[] arguments;
        private ResultExt result;

        ExecutingConnectionCallback(String sql, Object[] arguments) {
            this.sql = sql;
            this.arguments = arguments;
        }

        @Override
        public void doWithConnection(Connection connection) {
            result = JdbcOperations.executeUpdate(connection, sql, arguments);
        }
    }

    private static class RowsQueryingConnectionCallback implements ConnectionCallback {
        private final RowsCallback rowsCallback;
        private final String sql;
        private final Object[] arguments;

        RowsQueryingConnectionCallback(RowsCallback rowsCallback, String sql, Object[] arguments) {
            this.rowsCallback = rowsCallback;
            this.sql = sql;
            this.arguments = arguments;
        }

        @Override
        public void doWithConnection(Connection connection) throws SQLException {
            JdbcOperations.queryForRows(connection, rowsCallback, sql, arguments);
        }
    }

    private static class RowQueryingConnectionCallback implements ConnectionCallback {
        private final RowCallback rowCallback;
        private final String sql;
        private final Object[] arguments;

        RowQueryingConnectionCallback(RowCallback rowCallback, String sql, Object[] arguments) {
            checkArgument(rowCallback != null, "A valid row callback is required");
            this.rowCallback = rowCallback;
            this.sql = sql;
            this.arguments = arguments;
        }

        @Override
        public void doWithConnection(Connection connection) throws SQLException {
            JdbcOperations.queryForRow(connection, rowCallback, sql, arguments);
        }
    }

    // Counts outside the iteration so the number survives a failing callback.
    private static class RowCountingRowsCallback implements RowsCallback {
        private final RowsCallback rowsCallback;
        private long numberOfRows;

        RowCountingRowsCallback(RowsCallback rowsCallback) {
            checkArgument(rowsCallback != null, "A valid rows callback is required");
            this.rowsCallback = rowsCallback;
        }

        @Override
        public IterationSignal nextRow(RowsExt rows) throws SQLException {
            numberOfRows++;
            return rowsCallback.nextRow(rows);
        }
    }

    private static class ConditionalTransactionCallback implements TransactionCallback {
        private final TransactionCondition bootCallback;
        private final TransactionStep thenCallback;

        ConditionalTransactionCallback(TransactionCondition bootCallback, TransactionStep thenCallback) {
            checkArgument(bootCallback != null && thenCallback != null, "Valid boot and then callbacks are required");
            this.bootCallback = bootCallback;
            this.thenCallback = thenCallback;
        }

        @Override
        public TransactionOutcome inTransaction(TransactionExt transaction) throws SQLException {
            if (bootCallback.test(transaction)) {
                thenCallback.run(transaction);
            }
            return TransactionOutcome.COMMIT;
        }
    }

    private static class BootCallbackCondition implements TransactionCondition {
        private final ConditionalTransaction conditionalTransaction;

        BootCallbackCondition(ConditionalTransaction conditionalTransaction) {
            this.conditionalTransaction = conditionalTransaction;
        }

        @Override
        public boolean test(TransactionExt transaction) throws SQLException {
            return conditionalTransaction.bootCallback(transaction);
        }
    }

    private static class IfTrueStep implements TransactionStep {
        private final ConditionalTransaction conditionalTransaction;

        IfTrueStep(ConditionalTransaction conditionalTransaction) {
            this.conditionalTransaction = conditionalTransaction;
        }

        @Override
        public void run(TransactionExt transaction) throws SQLException {
            conditionalTransaction.ifTrue(transaction);
        }
    }

    private static class ManyQueriesTransactionCallback implements TransactionCallback {
        private final String[] queries;

        ManyQueriesTransactionCallback(String[] queries) {
            checkArgument(queries != null, "Queries are required");
            this.queries = queries;
        }

        @Override
        public TransactionOutcome inTransaction(TransactionExt transaction) {
            for (String query : queries) {
                transaction.exec(query);
            }
            return TransactionOutcome.COMMIT;
        }
    }
}
