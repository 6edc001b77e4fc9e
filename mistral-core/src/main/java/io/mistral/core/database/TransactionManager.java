package io.mistral.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Binds database sessions to the calling thread.
 *
 * A session is either scoped ({@link #begin}, {@link #beginReadOnly}), joined or temporary
 * ({@link #autoCommit}), or driven manually with {@link #startTransaction},
 * {@link #commitTransaction}, {@link #rollbackTransaction} and {@link #endTransaction}.
 */
public interface TransactionManager
{
    /**
     * Return the handle of the current transaction.
     *
     * @throws IllegalStateException if the calling thread has no transaction
     */
    Handle getHandle();

    /**
     * Return true if a transaction started by {@link #begin} or {@link #startTransaction}
     * is active on the calling thread.
     */
    boolean isInTransaction();

    /**
     * Create a new transaction, set it as the current transaction, and commit it
     * when func returns normally.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    /**
     * Create a new transaction, set it as the current transaction, and commit it
     * when func returns normally.
     */
    <T, E1 extends Exception> T begin(
            SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
        throws E1;

    /**
     * Create a new transaction, set it as the current transaction, and commit it
     * when func returns normally.
     */
    <T, E1 extends Exception, E2 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    /**
     * Same as {@link #begin(SupplierInTransaction)} but the transaction is rolled back
     * even when func returns normally.
     */
    <T> T beginReadOnly(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    /**
     * Get the current transaction object if exists, otherwise uses a temporary transaction object with auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    /**
     * Get the current transaction object if exists, otherwise uses a temporary transaction object with auto-commit mode.
     */
    <T, E1 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
        throws E1;

    /**
     * Start a transaction bound to the calling thread until {@link #endTransaction} is called.
     *
     * @throws IllegalStateException if a transaction is already active
     */
    void startTransaction();

    /**
     * Commit the current transaction. The session stays open and a new transaction begins.
     */
    void commitTransaction();

    /**
     * Roll back the current transaction. The session stays open and a new transaction begins.
     */
    void rollbackTransaction();

    /**
     * Release the current session, rolling back uncommitted work first.
     */
    void endTransaction();

    /**
     * Acquire an in-process lock owned by the current transaction. The lock is
     * released when the transaction commits, rolls back or ends.
     * Does nothing if the database supports cross-connection row locks.
     */
    void lockLocally(String key);

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception>
    {
        T get()
                throws E1, E2;
    }
}
