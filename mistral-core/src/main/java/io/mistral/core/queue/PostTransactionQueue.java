package io.mistral.core.queue;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.mistral.commons.guava.ThrowablesUtil;
import io.mistral.core.ErrorReporter;
import io.mistral.core.context.AuthContext;
import io.mistral.core.database.DatabaseRetry;
import io.mistral.core.database.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.mistral.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Defers operations until the work that registered them has completed.
 *
 * {@link #run} hands a fresh {@link OperationQueue} to the function. When the function
 * returns, the registered operations are drained on a new thread: transactional
 * operations first, all in one transaction that's retried on transient database errors,
 * then the other operations one by one. A failing transactional operation aborts the
 * drain. A failing non-transactional operation is only logged.
 *
 * Operations of a function that throws are discarded.
 */
public class PostTransactionQueue
{
    private static final Logger logger = LoggerFactory.getLogger(PostTransactionQueue.class);

    private final TransactionManager tm;
    private final ThreadFactory threadFactory;
    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public PostTransactionQueue(TransactionManager tm)
    {
        this.tm = tm;
        this.threadFactory = new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("post-tx-queue-%d")
            .build();
    }

    public <T> T run(Optional<AuthContext> authContext, Function<OperationQueue, T> func)
    {
        OperationQueue queue = new OperationQueue(authContext);
        T result;
        try {
            result = func.apply(queue);
        }
        catch (RuntimeException ex) {
            List<OperationQueue.Entry> discarded = queue.close();
            if (!discarded.isEmpty()) {
                logger.debug("Discarding {} operations registered by a failed function", discarded.size());
            }
            throw ex;
        }

        List<OperationQueue.Entry> entries = queue.close();
        if (!entries.isEmpty()) {
            startWorker(queue.getAuthContext(), entries);
        }
        return result;
    }

    private void startWorker(Optional<AuthContext> authContext, List<OperationQueue.Entry> entries)
    {
        Thread[] self = new Thread[1];
        Thread thread = threadFactory.newThread(() -> {
            try {
                drain(authContext, entries);
            }
            catch (Throwable t) {
                logger.warn("Aborted draining of post-transaction operations: {}", t.toString());
            }
            finally {
                workers.remove(self[0]);
            }
        });
        self[0] = thread;
        workers.add(thread);
        thread.start();
    }

    private void drain(Optional<AuthContext> authContext, List<OperationQueue.Entry> entries)
    {
        List<Operation> transactional = entries.stream()
            .filter(OperationQueue.Entry::isInTransaction)
            .map(OperationQueue.Entry::getOperation)
            .collect(Collectors.toList());
        List<Operation> nonTransactional = entries.stream()
            .filter(entry -> !entry.isInTransaction())
            .map(OperationQueue.Entry::getOperation)
            .collect(Collectors.toList());

        // operations may register follow-ups to the queue of this run
        run(authContext, queue -> {
            if (!transactional.isEmpty()) {
                int mark = queue.size();
                DatabaseRetry.run(() -> {
                    try {
                        return tm.begin(() -> {
                            for (Operation op : transactional) {
                                runTransactional(op, queue);
                            }
                            return null;
                        });
                    }
                    catch (RuntimeException ex) {
                        // follow-ups of a rolled back attempt are registered again by the next attempt
                        queue.discardFrom(mark);
                        throw ex;
                    }
                });
            }
            for (Operation op : nonTransactional) {
                runNonTransactional(op, queue);
            }
            return null;
        });
    }

    private void runTransactional(Operation op, OperationQueue queue)
    {
        try {
            op.run(queue);
        }
        catch (Exception ex) {
            logger.error(UNEXPECTED_SERVER_ERROR, "Failed to run a transactional post-transaction operation {}", op, ex);
            errorReporter.reportUncaughtError(ex);
            throw ThrowablesUtil.propagate(ex);
        }
    }

    private void runNonTransactional(Operation op, OperationQueue queue)
    {
        try {
            op.run(queue);
        }
        catch (Exception ex) {
            logger.error(UNEXPECTED_SERVER_ERROR, "Failed to run a non-transactional post-transaction operation {}", op, ex);
            errorReporter.reportUncaughtError(ex);
        }
    }

    /**
     * Waits until every started drain, and the drains of their follow-ups, have finished.
     * Returns false if the timeout elapsed first.
     */
    public boolean awaitDrained(Duration timeout)
            throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<Thread> running = ImmutableList.copyOf(workers);
            if (running.isEmpty()) {
                return true;
            }
            for (Thread thread : running) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                thread.join(Math.max(1, remaining / 1_000_000));
            }
        }
    }
}
