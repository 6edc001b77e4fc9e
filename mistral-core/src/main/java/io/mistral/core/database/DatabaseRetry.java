package io.mistral.core.database;

import io.mistral.commons.RetryExecutor;
import io.mistral.commons.RetryExecutor.RetryGiveupException;
import io.mistral.commons.guava.ThrowablesUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

import static io.mistral.commons.RetryExecutor.retryExecutor;

/**
 * Re-runs an operation when it fails with a transient database error.
 *
 * Up to 50 attempts. The wait grows linearly from 0 by 100 milliseconds per attempt,
 * up to 2 seconds. When retries are exhausted, or the error is not transient, the last
 * error is rethrown as is.
 */
public final class DatabaseRetry
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseRetry.class);

    static final int MAX_ATTEMPTS = 50;

    private static final RetryExecutor RETRY = retryExecutor()
        .withRetryLimit(MAX_ATTEMPTS - 1)
        .withInitialRetryWait(0)
        .withWaitGrowRate(1.0)
        .withWaitIncrement(100)
        .withMaxRetryWait(2000)
        .retryIf(TransientDatabaseErrors::isTransient)
        .onRetry((exception, retryCount, retryLimit, retryWait) ->
                logger.warn("Retrying a database operation after a transient error ({}/{}), wait {} ms: {}",
                    retryCount, retryLimit, retryWait, exception.toString()));

    private DatabaseRetry()
    { }

    public static <T> T run(Callable<T> op)
    {
        try {
            return RETRY.run(op);
        }
        catch (RetryGiveupException ex) {
            throw ThrowablesUtil.propagate(ex.getLastException());
        }
    }

    public static void run(Runnable op)
    {
        run(() -> {
            op.run();
            return (Void) null;
        });
    }
}
