package com.robusta.sandbox.rdb;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.collect.Lists.newArrayList;
import static com.robusta.sandbox.rdb.FailureHandlers.captureFailureInto;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

/**
 * Runs the controller against an in-memory H2 database behind a Hikari pool.
 */
public class JDBCDbControllerH2Test {
    private JDBCDbController controller;
    private boolean released;

    @Before
    public void setUp() throws Exception {
        DbConfig config = new DbConfig("jdbc:h2:mem:rdb-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", 2);
        controller = JDBCDbController.fromConfig(config);
        controller.operate(connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE t (id INT NOT NULL)");
                statement.execute("CREATE TABLE person (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, name VARCHAR(64))");
            }
        });
    }

    @After
    public void tearDown() throws Exception {
        if (!released) {
            controller.release();
        }
    }

    @Test
    public void testExecuteManyInTransaction_shouldInsertEveryRow() throws Exception {
        controller.executeManyInTransaction("INSERT INTO t VALUES (1)", "INSERT INTO t VALUES (2)");

        assertThat(idsOfT(), contains(1, 2));
    }

    @Test
    public void testExecuteManyInTransaction_whenOneStatementIsInvalid_shouldInsertNothing() throws Exception {
        try {
            controller.executeManyInTransaction("INSERT INTO t VALUES (1)", "INSERT INTO t VALUES (2)", "INVALID SQL");
            fail("expected a DriverException");
        } catch (DriverException e) {
            assertThat(e.getSql(), is("INVALID SQL"));
        }

        assertThat(idsOfT(), is(empty()));
    }

    @Test
    public void testRunInTransaction_whenCommitted_shouldMakeWritesVisible() throws Exception {
        controller.runInTransaction(transaction -> {
            transaction.exec("INSERT INTO t VALUES (?)", 7);
            return TransactionOutcome.COMMIT;
        });

        assertThat(idsOfT(), contains(7));
    }

    @Test
    public void testRunInTransaction_whenRolledBack_shouldDiscardWrites() throws Exception {
        controller.runInTransaction(transaction -> {
            transaction.exec("INSERT INTO t VALUES (?)", 7);
            return TransactionOutcome.ROLLBACK;
        });

        assertThat(idsOfT(), is(empty()));
    }

    @Test
    public void testRunInTransaction_whenCallbackThrows_shouldRollbackAndCaptureOriginalFailure() throws Exception {
        AtomicReference<Exception> captured = new AtomicReference<Exception>();
        controller.registerFailureHandler(captureFailureInto(captured));
        final IllegalStateException boom = new IllegalStateException("validation failed");

        controller.runInTransaction(transaction -> {
            transaction.exec("INSERT INTO t VALUES (?)", 7);
            throw boom;
        });

        assertThat(captured.get(), sameInstance((Exception) boom));
        assertThat(idsOfT(), is(empty()));
    }

    @Test
    public void testRunConditionallyInTransaction_shouldRunThenCallbackOnlyWhenBootCallbackHolds() throws Exception {
        controller.execute("INSERT INTO t VALUES (1)");

        controller.runConditionallyInTransaction(
                transaction -> countOf(transaction, 1) > 0,
                transaction -> transaction.exec("INSERT INTO t VALUES (2)"));
        controller.runConditionallyInTransaction(new DbController.ConditionalTransaction() {
            @Override
            public boolean bootCallback(TransactionExt transaction) throws SQLException {
                return countOf(transaction, 99) > 0;
            }

            @Override
            public void ifTrue(TransactionExt transaction) {
                transaction.exec("INSERT INTO t VALUES (3)");
            }
        });

        assertThat(idsOfT(), contains(1, 2));
    }

    @Test
    public void testRunConditionallyInTransaction_whenThenCallbackFails_shouldRollbackEverything() throws Exception {
        try {
            controller.runConditionallyInTransaction(
                    transaction -> {
                        transaction.exec("INSERT INTO t VALUES (1)");
                        return true;
                    },
                    transaction -> transaction.exec("INSERT INTO missing_table VALUES (2)"));
            fail("expected a DriverException");
        } catch (DriverException e) {
            assertThat(e.getSql(), is("INSERT INTO missing_table VALUES (2)"));
        }

        assertThat(idsOfT(), is(empty()));
    }

    @Test
    public void testExecute_shouldReportGeneratedKeyAndAffectedRows() throws Exception {
        ResultExt first = controller.execute("INSERT INTO person (name) VALUES (?)", "ada");
        ResultExt second = controller.execute("INSERT INTO person (name) VALUES (?)", "grace");
        ResultExt update = controller.execute("UPDATE person SET name = ? WHERE id > ?", "anonymous", 0);

        assertThat(first.rowsAffected(), is(1L));
        assertThat(second.lastInsertId(), is(first.lastInsertId() + 1));
        assertThat(update.rowsAffected(), is(2L));
    }

    @Test
    public void testExecute_whenStatementIsNotAnInsert_shouldNotReportAGeneratedKey() throws Exception {
        controller.execute("INSERT INTO person (name) VALUES (?)", "ada");
        controller.execute("INSERT INTO person (name) VALUES (?)", "grace");
        ResultExt update = controller.execute("UPDATE person SET name = ?", "anonymous");

        assertThat(update.rowsAffected(), is(2L));
        try {
            update.lastInsertId();
            fail("expected a DriverException");
        } catch (DriverException expected) {
            assertThat(expected.getMessage(), is("The statement did not generate any key"));
        }
    }

    @Test
    public void testTransactionExt_preparedInsert_shouldReportGeneratedKeys() throws Exception {
        final AtomicLong firstId = new AtomicLong();
        final AtomicLong secondId = new AtomicLong();
        controller.runInTransaction(transaction -> {
            try (StatementExt insert = transaction.prepare("insert into person (name) values (?)")) {
                firstId.set(insert.exec("ada").lastInsertId());
                secondId.set(insert.exec("grace").lastInsertId());
            }
            return TransactionOutcome.COMMIT;
        });

        assertThat(secondId.get(), is(firstId.get() + 1));
    }

    @Test
    public void testQueryForRow_shouldHandTheRowToTheCallback() throws Exception {
        controller.execute("INSERT INTO person (name) VALUES (?)", "ada");
        final AtomicReference<String> name = new AtomicReference<String>();

        controller.queryForRow(row -> name.set(row.getString("name")), "SELECT name FROM person WHERE name = ?", "ada");

        assertThat(name.get(), is("ada"));
    }

    @Test(expected = DriverException.class)
    public void testQueryForRow_whenNothingMatchesAndCallbackScans_shouldThrowDriverException() throws Exception {
        controller.queryForRow(row -> row.scan(), "SELECT name FROM person WHERE name = ?", "nobody");
    }

    @Test
    public void testQueryForRows_whenStoppedAfterThirdRow_shouldCountThree() throws Exception {
        controller.executeManyInTransaction(
                "INSERT INTO t VALUES (1)", "INSERT INTO t VALUES (2)", "INSERT INTO t VALUES (3)",
                "INSERT INTO t VALUES (4)", "INSERT INTO t VALUES (5)");
        final List<Integer> seen = newArrayList();

        long numberOfRows = controller.queryForRows(rows -> {
            seen.add(rows.getInt(1));
            return seen.size() == 3 ? IterationSignal.STOP : IterationSignal.CONTINUE;
        }, "SELECT id FROM t ORDER BY id");

        assertThat(numberOfRows, is(3L));
        assertThat(seen, contains(1, 2, 3));
    }

    @Test
    public void testTransactionExt_preparedStatementAndNestedQueries() throws Exception {
        final AtomicLong total = new AtomicLong();
        controller.runInTransaction(transaction -> {
            try (StatementExt insert = transaction.prepare("INSERT INTO t VALUES (?)")) {
                insert.exec(10);
                insert.exec(20);
            }
            transaction.queryForRows(rows -> {
                total.addAndGet(rows.getLong("id"));
                return IterationSignal.CONTINUE;
            }, "SELECT id FROM t");
            return TransactionOutcome.COMMIT;
        });

        assertThat(total.get(), is(30L));
        assertThat(idsOfT(), contains(10, 20));
    }

    @Test
    public void testRelease_shouldCloseThePoolAndMakeTheControllerUnusable() throws Exception {
        controller.release();
        released = true;

        try {
            controller.executeManyInTransaction("INSERT INTO t VALUES (1)");
            fail("expected a NotInitializedException");
        } catch (NotInitializedException expected) {
            assertThat(expected, instanceOf(DbControllerException.class));
        }
    }

    private List<Integer> idsOfT() {
        final List<Integer> ids = newArrayList();
        controller.queryForRows(rows -> {
            ids.add(rows.getInt("id"));
            return IterationSignal.CONTINUE;
        }, "SELECT id FROM t ORDER BY id");
        return ids;
    }

    private static long countOf(TransactionExt transaction, int id) throws SQLException {
        final AtomicLong count = new AtomicLong();
        transaction.queryForRow(row -> count.set(row.getLong(1)), "SELECT COUNT(*) FROM t WHERE id = ?", id);
        return count.get();
    }
}
