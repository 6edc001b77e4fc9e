package io.mistral.core.lock;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Cluster-wide mutual exclusion by name, held for the rest of the current transaction.
 *
 * A lock is a row in named_locks whose name column is unique. Inserting it blocks while
 * another open transaction holds a row with the same name, and the row disappears when
 * the holder deletes it or its transaction rolls back.
 */
public interface NamedLockManager
{
    /**
     * Inserts a lock row and returns its id.
     *
     * @throws IllegalStateException if the calling thread has no transaction
     */
    String createNamedLock(String name);

    boolean deleteNamedLock(String id);

    List<StoredNamedLock> getNamedLocks();

    /**
     * Runs the action while holding the named lock.
     *
     * If the action throws, the lock row isn't deleted here. Rolling back the
     * enclosing transaction discards it.
     */
    <T> T namedLock(String name, Supplier<T> action);

    /**
     * Deletes lock rows abandoned by crashed processes. Returns the number of deleted rows.
     */
    int deleteNamedLocksCreatedBefore(Instant createdBefore);
}
