package io.mistral.core.queue;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.mistral.core.context.AuthContext;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Operations registered during one {@link PostTransactionQueue#run} call.
 *
 * The queue accepts operations only while the run is in progress.
 */
public class OperationQueue
{
    static class Entry
    {
        private final Operation operation;
        private final boolean inTransaction;

        Entry(Operation operation, boolean inTransaction)
        {
            this.operation = operation;
            this.inTransaction = inTransaction;
        }

        Operation getOperation()
        {
            return operation;
        }

        boolean isInTransaction()
        {
            return inTransaction;
        }
    }

    private Optional<AuthContext> authContext;
    private final List<Entry> entries = new ArrayList<>();
    private boolean closed = false;

    OperationQueue(Optional<AuthContext> authContext)
    {
        this.authContext = authContext;
    }

    /**
     * Registers an operation.
     *
     * @param inTransaction true to run the operation in a transaction shared with the
     *     other transactional operations of this queue.
     * @throws IllegalStateException if the run that created this queue has finished
     */
    public synchronized void register(Operation operation, boolean inTransaction)
    {
        checkNotNull(operation, "operation");
        if (closed) {
            throw new IllegalStateException("Operation queue is not active. Operations can be registered only within PostTransactionQueue.run");
        }
        entries.add(new Entry(operation, inTransaction));
    }

    /**
     * Context the operations run with, carried over to the drain thread.
     * Defaults to the context given to the run that created this queue.
     */
    public synchronized Optional<AuthContext> getAuthContext()
    {
        return authContext;
    }

    /**
     * Replaces the context the operations run with. Used by callers that learn
     * the context only inside the run, such as a job restored from its stored row.
     *
     * @throws IllegalStateException if the run that created this queue has finished
     */
    public synchronized void setAuthContext(Optional<AuthContext> authContext)
    {
        checkNotNull(authContext, "authContext");
        if (closed) {
            throw new IllegalStateException("Operation queue is not active");
        }
        this.authContext = authContext;
    }

    public synchronized boolean isEmpty()
    {
        return entries.isEmpty();
    }

    public synchronized int size()
    {
        return entries.size();
    }

    synchronized boolean isClosed()
    {
        return closed;
    }

    // returns the registered entries
    synchronized List<Entry> close()
    {
        closed = true;
        return ImmutableList.copyOf(entries);
    }

    synchronized void discardFrom(int index)
    {
        while (entries.size() > index) {
            entries.remove(entries.size() - 1);
        }
    }
}
