package io.mistral.commons;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Runs an operation repeatedly until it succeeds, the retry predicate rejects
 * the failure, or the retry limit is reached.
 *
 * Wait time before the n-th retry is
 * {@code min(maxRetryWait, initialRetryWait * waitGrowRate^(n-1) + waitIncrement * (n-1))},
 * so a grow rate of 1.0 with a positive increment gives linear back-off.
 *
 * Instances are immutable. Each {@code with*} method returns a modified copy.
 */
public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    public static class RetryGiveupException
            extends ExecutionException
    {
        private final Exception lastException;

        public RetryGiveupException(String message, Exception cause)
        {
            super(message, cause);
            this.lastException = cause;
        }

        public RetryGiveupException(Exception firstException, Exception lastException)
        {
            super(firstException);
            this.lastException = lastException;
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }

        public Exception getLastException()
        {
            return lastException;
        }
    }

    public interface RetryPredicate
            extends Predicate<Exception>
    { }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, int retryWait)
            throws RetryGiveupException;
    }

    public interface GiveupAction
    {
        void onGiveup(Exception firstException, Exception lastException)
            throws RetryGiveupException;
    }

    private int retryLimit = 5;
    private int initialRetryWait = 1000;
    private int maxRetryWait = 30 * 60 * 1000;
    private double waitGrowRate = 3.0;
    private int waitIncrement = 0;
    private RetryPredicate retryPredicate = null;
    private RetryAction retryAction = null;
    private GiveupAction giveupAction = null;

    private RetryExecutor()
    { }

    private RetryExecutor copy()
    {
        RetryExecutor copy = new RetryExecutor();
        copy.retryLimit = retryLimit;
        copy.initialRetryWait = initialRetryWait;
        copy.maxRetryWait = maxRetryWait;
        copy.waitGrowRate = waitGrowRate;
        copy.waitIncrement = waitIncrement;
        copy.retryPredicate = retryPredicate;
        copy.retryAction = retryAction;
        copy.giveupAction = giveupAction;
        return copy;
    }

    public RetryExecutor withRetryLimit(int count)
    {
        RetryExecutor copy = copy();
        copy.retryLimit = count;
        return copy;
    }

    public RetryExecutor withInitialRetryWait(int msec)
    {
        RetryExecutor copy = copy();
        copy.initialRetryWait = msec;
        return copy;
    }

    public RetryExecutor withMaxRetryWait(int msec)
    {
        RetryExecutor copy = copy();
        copy.maxRetryWait = msec;
        return copy;
    }

    public RetryExecutor withWaitGrowRate(double rate)
    {
        RetryExecutor copy = copy();
        copy.waitGrowRate = rate;
        return copy;
    }

    public RetryExecutor withWaitIncrement(int msec)
    {
        RetryExecutor copy = copy();
        copy.waitIncrement = msec;
        return copy;
    }

    public RetryExecutor retryIf(RetryPredicate function)
    {
        RetryExecutor copy = copy();
        copy.retryPredicate = function;
        return copy;
    }

    public RetryExecutor onRetry(RetryAction function)
    {
        RetryExecutor copy = copy();
        copy.retryAction = function;
        return copy;
    }

    public RetryExecutor onGiveup(GiveupAction function)
    {
        RetryExecutor copy = copy();
        copy.giveupAction = function;
        return copy;
    }

    int retryWait(int retryCount)
    {
        double wait = initialRetryWait * Math.pow(waitGrowRate, retryCount) + (double) waitIncrement * retryCount;
        return (int) Math.min((double) maxRetryWait, wait);
    }

    /**
     * Runs the operation. An interruption while waiting for the next attempt gives up
     * with the interrupt flag of the thread set.
     */
    public <T> T run(Callable<T> op)
            throws RetryGiveupException
    {
        Exception firstException = null;
        for (int retryCount = 0; ; retryCount++) {
            try {
                return op.call();
            }
            catch (Exception exception) {
                if (firstException == null) {
                    firstException = exception;
                }
                if (retryCount >= retryLimit || retryPredicate == null || !retryPredicate.test(exception)) {
                    if (giveupAction != null) {
                        giveupAction.onGiveup(firstException, exception);
                    }
                    throw new RetryGiveupException(firstException, exception);
                }

                int retryWait = retryWait(retryCount);
                if (retryAction != null) {
                    retryAction.onRetry(exception, retryCount + 1, retryLimit, retryWait);
                }
                if (retryWait > 0) {
                    try {
                        Thread.sleep(retryWait);
                    }
                    catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        throw new RetryGiveupException("Interrupted while waiting for retry", exception);
                    }
                }
            }
        }
    }

    public void run(Runnable op)
            throws RetryGiveupException
    {
        run(() -> {
            op.run();
            return (Void) null;
        });
    }
}
