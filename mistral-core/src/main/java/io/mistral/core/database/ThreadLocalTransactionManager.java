package io.mistral.core.database;

import com.google.inject.Inject;
import io.mistral.commons.guava.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.stream.Collectors;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Locale.ENGLISH;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final ThreadLocal<LazyTransaction> threadLocalTransaction = new ThreadLocal<>();
    private final ThreadLocal<LazyTransaction> threadLocalAutoCommitTransaction = new ThreadLocal<>();
    private final Jdbi jdbi;
    private final int isolationLevel;
    private final LocalLockMap localLocks;  // null if the database supports row locks

    private static class LazyTransaction
            implements Transaction
    {
        private enum State
        {
            ACTIVE,
            ABORTED,
            COMMITTED;
        }

        private final Jdbi jdbi;
        private final int isolationLevel;
        private final boolean autoAutoCommit;
        private final LocalLockMap localLocks;
        private Handle handle;
        private State state = State.ACTIVE;
        private final StackTraceElement[] stackTrace;

        LazyTransaction(Jdbi jdbi, int isolationLevel, LocalLockMap localLocks, boolean autoAutoCommit)
        {
            this.jdbi = checkNotNull(jdbi);
            this.isolationLevel = isolationLevel;
            this.localLocks = localLocks;
            this.autoAutoCommit = autoAutoCommit;
            this.stackTrace = Thread.currentThread().getStackTrace();
        }

        @Override
        public Handle getHandle()
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Transaction is already " + state.name().toLowerCase(ENGLISH));
            }

            if (handle == null) {
                handle = jdbi.open();
                try {
                    handle.getConnection().setTransactionIsolation(isolationLevel);
                    handle.getConnection().setAutoCommit(autoAutoCommit);
                }
                catch (SQLException ex) {
                    handle.close();
                    handle = null;
                    throw new TransactionException("Failed to initialize a connection: autoCommit=" + autoAutoCommit, ex);
                }
                if (!autoAutoCommit) {
                    handle.begin();
                }
            }
            return handle;
        }

        void lockLocally(String key)
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Transaction is already " + state.name().toLowerCase(ENGLISH));
            }
            if (localLocks != null) {
                localLocks.acquire(key, this);
            }
        }

        @Override
        public void commit()
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Committing " + state.name().toLowerCase(ENGLISH) + " is not allowed");
            }

            if (handle != null && !autoAutoCommit) {
                // PostgreSQL runs ROLLBACK silently when COMMIT is issued after a statement failed
                // in the transaction. Connection.isValid returns false in that case.
                boolean isValid;
                try {
                    isValid = handle.getConnection().isValid(30);
                }
                catch (SQLException ex) {
                    throw new TransactionException(
                            "Can't validate a transaction before commit", ex);
                }
                if (!isValid) {
                    throw new TransactionException(
                            "Trying to commit a transaction that is already aborted. " +
                                    "Because current transaction is aborted, commands including " +
                                    "commit are ignored until end of transaction block.");
                }
                handle.commit();
            }

            state = State.COMMITTED;
            releaseLocalLocks();
        }

        @Override
        public void abort()
        {
            if (state == State.COMMITTED) {
                throw new IllegalStateException("Aborting committed transaction is not allowed");
            }
            try {
                if (handle != null && !autoAutoCommit && state == State.ACTIVE) {
                    handle.rollback();
                }
            }
            finally {
                state = State.ABORTED;
                releaseLocalLocks();
            }
        }

        boolean isActive()
        {
            return state == State.ACTIVE;
        }

        // the session stays open after commit or abort, and a new transaction begins on it
        void restart()
        {
            state = State.ACTIVE;
            if (handle != null && !autoAutoCommit) {
                handle.begin();
            }
        }

        void close()
        {
            try {
                releaseLocalLocks();
            }
            finally {
                if (handle != null) {
                    handle.close();
                    handle = null;
                }
            }
        }

        private void releaseLocalLocks()
        {
            if (localLocks != null) {
                localLocks.releaseAll(this);
            }
        }

        @Override
        public String toString()
        {
            return "LazyTransaction{" +
                    "autoAutoCommit=" + autoAutoCommit +
                    ", handle=" + handle +
                    ", state=" + state +
                    ", stackTrace=[\n" + Arrays.stream(stackTrace)
                            .map(st -> "  " + st.toString())
                            .collect(Collectors.joining("\n")) +
                    "\n]}";
        }
    }

    @Inject
    public ThreadLocalTransactionManager(DataSource ds, DatabaseConfig config, ConfigMapper configMapper, LocalLockMap localLocks)
    {
        this(DatabaseHelper.createJdbi(checkNotNull(ds), configMapper),
                DatabaseConfig.isolationLevelOf(config.getIsolationLevel()),
                config.getRowLocks() ? null : localLocks);
    }

    ThreadLocalTransactionManager(Jdbi jdbi, int isolationLevel, LocalLockMap localLocks)
    {
        this.jdbi = checkNotNull(jdbi);
        this.isolationLevel = isolationLevel;
        this.localLocks = localLocks;
        if (localLocks != null) {
            logger.debug("Database doesn't lock rows across connections. Using in-process locks instead");
        }
    }

    @Override
    public Handle getHandle()
    {
        Transaction transaction = currentTransaction();
        if (transaction == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return transaction.getHandle();
    }

    @Override
    public boolean isInTransaction()
    {
        return threadLocalTransaction.get() != null;
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        return begin(func, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T begin(SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return begin(func, e1, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        return runInNewTransaction(func, false, e1, e2);
    }

    @Override
    public <T> T beginReadOnly(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        return runInNewTransaction(func, true, RuntimeException.class, RuntimeException.class);
    }

    private <T, E1 extends Exception, E2 extends Exception>
    T runInNewTransaction(SupplierInTransaction<T, E1, E2> func, boolean readOnly, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        if (threadLocalTransaction.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed: " + threadLocalTransaction.get());
        }

        boolean completed = false;
        LazyTransaction transaction = newTransaction(false);
        try {
            threadLocalTransaction.set(transaction);
            T result = func.get();
            if (readOnly) {
                transaction.abort();
            }
            else {
                transaction.commit();
            }
            completed = true;
            return result;
        }
        catch (Exception e) {
            ThrowablesUtil.propagateIfInstanceOf(e, e1);
            ThrowablesUtil.propagateIfInstanceOf(e, e2);
            throw ThrowablesUtil.propagate(e);
        }
        finally {
            threadLocalTransaction.set(null);
            try {
                if (!completed && transaction.isActive()) {
                    transaction.abort();
                }
            }
            finally {
                transaction.close();
            }
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        return autoCommit(func, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T autoCommit(SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        try {
            if (currentTransaction() != null) {
                return func.get();
            }
            else {
                LazyTransaction transaction = newTransaction(true);
                threadLocalAutoCommitTransaction.set(transaction);
                try {
                    return func.get();
                }
                finally {
                    threadLocalAutoCommitTransaction.set(null);
                    transaction.close();
                }
            }
        }
        catch (Exception e) {
            ThrowablesUtil.propagateIfInstanceOf(e, e1);
            throw ThrowablesUtil.propagate(e);
        }
    }

    @Override
    public void startTransaction()
    {
        if (threadLocalTransaction.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed: " + threadLocalTransaction.get());
        }
        threadLocalTransaction.set(newTransaction(false));
    }

    @Override
    public void commitTransaction()
    {
        LazyTransaction transaction = requireTransaction();
        transaction.commit();
        transaction.restart();
    }

    @Override
    public void rollbackTransaction()
    {
        LazyTransaction transaction = requireTransaction();
        transaction.abort();
        transaction.restart();
    }

    @Override
    public void endTransaction()
    {
        LazyTransaction transaction = requireTransaction();
        threadLocalTransaction.set(null);
        try {
            if (transaction.isActive()) {
                transaction.abort();
            }
        }
        finally {
            transaction.close();
        }
    }

    @Override
    public void lockLocally(String key)
    {
        LazyTransaction transaction = currentTransaction();
        if (transaction == null) {
            throw new IllegalStateException("Not in transaction");
        }
        transaction.lockLocally(key);
    }

    private LazyTransaction newTransaction(boolean autoAutoCommit)
    {
        return new LazyTransaction(jdbi, isolationLevel, localLocks, autoAutoCommit);
    }

    private LazyTransaction currentTransaction()
    {
        LazyTransaction transaction = threadLocalTransaction.get();
        if (transaction == null) {
            transaction = threadLocalAutoCommitTransaction.get();
        }
        return transaction;
    }

    private LazyTransaction requireTransaction()
    {
        LazyTransaction transaction = threadLocalTransaction.get();
        if (transaction == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return transaction;
    }
}
