package io.mistral.commons;

import io.mistral.commons.RetryExecutor.RetryGiveupException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static io.mistral.commons.RetryExecutor.retryExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class RetryExecutorTest
{
    @Test
    public void retriesUntilSuccess()
            throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        String result = retryExecutor()
            .withRetryLimit(5)
            .withInitialRetryWait(0)
            .retryIf(ex -> ex instanceof IllegalStateException)
            .run(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("transient");
                }
                return "done";
            });

        assertThat(result, is("done"));
        assertThat(calls.get(), is(3));
    }

    @Test
    public void nonRetryableFailureGivesUpImmediately()
    {
        AtomicInteger calls = new AtomicInteger();
        IllegalArgumentException failure = new IllegalArgumentException("fatal");

        RetryGiveupException ex = assertThrows(RetryGiveupException.class, () ->
                retryExecutor()
                    .withRetryLimit(5)
                    .retryIf(e -> e instanceof IllegalStateException)
                    .run(() -> {
                        calls.incrementAndGet();
                        throw failure;
                    }));

        assertThat(calls.get(), is(1));
        assertThat(ex.getCause(), sameInstance((Exception) failure));
        assertThat(ex.getLastException(), sameInstance((Exception) failure));
    }

    @Test
    public void givesUpAfterRetryLimitWithLastException()
    {
        AtomicInteger calls = new AtomicInteger();

        RetryGiveupException ex = assertThrows(RetryGiveupException.class, () ->
                retryExecutor()
                    .withRetryLimit(2)
                    .withInitialRetryWait(0)
                    .retryIf(e -> true)
                    .run(() -> {
                        throw new IllegalStateException("attempt " + calls.incrementAndGet());
                    }));

        assertThat(calls.get(), is(3));
        assertThat(ex.getCause().getMessage(), is("attempt 1"));
        assertThat(ex.getLastException().getMessage(), is("attempt 3"));
    }

    @Test
    public void linearWaitIsCapped()
    {
        RetryExecutor executor = retryExecutor()
            .withInitialRetryWait(0)
            .withWaitGrowRate(1.0)
            .withWaitIncrement(100)
            .withMaxRetryWait(250);

        assertThat(executor.retryWait(0), is(0));
        assertThat(executor.retryWait(1), is(100));
        assertThat(executor.retryWait(2), is(200));
        assertThat(executor.retryWait(3), is(250));
    }

    @Test
    public void onRetryReportsAttempts()
            throws Exception
    {
        List<Integer> retries = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();

        retryExecutor()
            .withRetryLimit(3)
            .withInitialRetryWait(0)
            .retryIf(e -> true)
            .onRetry((exception, retryCount, retryLimit, retryWait) -> retries.add(retryCount))
            .run(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException();
                }
            });

        assertThat(retries, contains(1, 2));
    }
}
