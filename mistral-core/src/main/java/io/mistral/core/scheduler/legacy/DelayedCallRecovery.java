package io.mistral.core.scheduler.legacy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.mistral.core.ErrorReporter;
import io.mistral.core.database.DatabaseRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.mistral.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Periodically releases delayed calls whose processing flag has been set for longer
 * than the recovery timeout, so that a call captured by a crashed process runs again.
 */
public class DelayedCallRecovery
{
    private static final Logger logger = LoggerFactory.getLogger(DelayedCallRecovery.class);

    private final DelayedCallStoreManager store;
    private final DelayedCallRecoveryConfig config;
    private ScheduledExecutorService executor;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public DelayedCallRecovery(DelayedCallStoreManager store, DelayedCallRecoveryConfig config)
    {
        this.store = store;
        this.config = config;
    }

    public boolean isEnabled()
    {
        return config.getEnabled();
    }

    public synchronized void start()
    {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("delayed-call-recovery-%d")
                .build());
        executor.scheduleWithFixedDelay(this::recover,
                config.getInterval(), config.getInterval(), TimeUnit.SECONDS);
    }

    public synchronized void stop()
    {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private void recover()
    {
        try {
            recover(Instant.now());
        }
        catch (Throwable t) {
            logger.error(UNEXPECTED_SERVER_ERROR, "An uncaught exception is ignored. Delayed call recovery will be retried.", t);
            errorReporter.reportUncaughtError(t);
        }
    }

    /**
     * Returns the number of released calls.
     */
    @VisibleForTesting
    int recover(Instant now)
    {
        Instant updatedBefore = now.minusSeconds(config.getTimeout());
        int count = DatabaseRetry.run(() -> store.resetProcessingCalls(updatedBefore));
        if (count > 0) {
            logger.warn("Released {} delayed calls that were processing since before {}", count, updatedBefore);
        }
        return count;
    }
}
