package io.mistral.core.database;

import io.mistral.core.lock.NamedLockManager;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeFalse;

public class ThreadLocalTransactionManagerTest
{
    private DatabaseFactory factory;
    private TransactionManager tm;
    private NamedLockManager locks;

    @Rule
    public final ExpectedException exception = ExpectedException.none();

    @Before
    public void setUp()
            throws Exception
    {
        factory = DatabaseTestingUtils.setupDatabase();
        tm = factory.get();
        locks = factory.getNamedLockManager();
    }

    @After
    public void tearDown()
    {
        factory.close();
    }

    @Test
    public void nestedTransactionIsNotAllowed()
            throws Exception
    {
        exception.expectMessage(containsString("Nested transaction is not allowed"));
        exception.expect(IllegalStateException.class);
        tm.begin(() -> {
            return tm.begin(() -> {
                fail();
                return null;
            });
        });
    }

    @Test
    public void startTransactionTwiceIsNotAllowed()
    {
        tm.startTransaction();
        try {
            exception.expect(IllegalStateException.class);
            tm.startTransaction();
        }
        finally {
            tm.endTransaction();
        }
    }

    @Test
    public void commitWithoutTransactionFails()
    {
        exception.expectMessage(containsString("Not in transaction"));
        exception.expect(IllegalStateException.class);
        tm.commitTransaction();
    }

    @Test
    public void rollbackWithoutTransactionFails()
    {
        exception.expect(IllegalStateException.class);
        tm.rollbackTransaction();
    }

    @Test
    public void endWithoutTransactionFails()
    {
        exception.expect(IllegalStateException.class);
        tm.endTransaction();
    }

    @Test
    public void getHandleWithoutTransactionFails()
    {
        exception.expect(IllegalStateException.class);
        tm.getHandle();
    }

    @Test
    public void sessionIsUsableAfterCommitAndRollback()
    {
        tm.startTransaction();
        assertThat(tm.isInTransaction(), is(true));
        try {
            locks.createNamedLock("committed");
            tm.commitTransaction();

            locks.createNamedLock("rolled-back");
            tm.rollbackTransaction();

            locks.createNamedLock("ended");
        }
        finally {
            tm.endTransaction();
        }
        assertThat(tm.isInTransaction(), is(false));

        assertThat(locks.getNamedLocks().size(), is(1));
        assertThat(locks.getNamedLocks().get(0).getName(), is("committed"));
    }

    @Test
    public void beginCommitsAndClosesHandle()
    {
        String name = tm.begin(() -> {
            locks.createNamedLock("committed");
            return "committed";
        });
        assertThat(name, is("committed"));
        assertThat(tm.isInTransaction(), is(false));

        // a second session starts cleanly after the first handle closed
        tm.begin(() -> locks.createNamedLock("second"));
        assertThat(locks.getNamedLocks().size(), is(2));
    }

    @Test
    public void beginReadOnlyRollsBack()
    {
        tm.beginReadOnly(() -> locks.createNamedLock("read-only"));
        assertThat(locks.getNamedLocks().size(), is(0));
    }

    @Test
    public void beginRollsBackOnException()
    {
        try {
            tm.begin(() -> {
                locks.createNamedLock("failing");
                throw new IllegalArgumentException("failed");
            });
            fail();
        }
        catch (IllegalArgumentException ex) {
            assertThat(ex.getMessage(), is("failed"));
        }
        assertThat(tm.isInTransaction(), is(false));
        assertThat(locks.getNamedLocks().size(), is(0));
    }

    @Test
    public void uncommittedRowsAreInvisibleToOtherThreads()
            throws Exception
    {
        tm.begin(() -> {
            locks.createNamedLock("uncommitted");

            // this transaction reads its own write
            assertThat(locks.getNamedLocks().size(), is(1));

            // another session doesn't read it until committed
            int count = CompletableFuture.supplyAsync(() -> locks.getNamedLocks().size())
                .get(10, TimeUnit.SECONDS);
            assertThat(count, is(0));
            return null;
        }, Exception.class);

        int count = CompletableFuture.supplyAsync(() -> locks.getNamedLocks().size())
            .get(10, TimeUnit.SECONDS);
        assertThat(count, is(1));
    }

    @Test
    public void localLocksAreReleasedAtCommit()
            throws Exception
    {
        assumeFalse(factory.getConfig().getRowLocks());

        TransactionManager other = factory.newTransactionManager();
        tm.begin(() -> {
            tm.lockLocally("scheduled_jobs:1");
            assertThat(factory.getLocalLocks().getLocks(), hasItem("scheduled_jobs:1"));

            // another session waits until this transaction ends
            CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> other.begin(() -> {
                other.lockLocally("scheduled_jobs:1");
                return null;
            }));
            try {
                waiting.get(500, TimeUnit.MILLISECONDS);
                fail();
            }
            catch (TimeoutException ex) {
                // expected
            }
            return waiting;
        }, Exception.class).get(10, TimeUnit.SECONDS);
    }
}
