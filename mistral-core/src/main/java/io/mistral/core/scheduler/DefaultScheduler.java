package io.mistral.core.scheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.mistral.commons.config.ConfigFactory;
import io.mistral.core.ErrorReporter;
import io.mistral.core.context.AuthContext;
import io.mistral.core.database.DatabaseRetry;
import io.mistral.core.database.TransactionManager;
import io.mistral.core.database.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.mistral.core.log.LogMarkers.FAILED_JOB;
import static io.mistral.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Scheduler backed by the scheduled_jobs table.
 *
 * A scheduled job is persisted and also armed as an in-memory timer on the instance
 * that scheduled it (fast path). Every instance polls the table as well, and runs jobs
 * that are overdue by pickup_job_after seconds, or that were captured more than
 * captured_job_timeout seconds ago and never finished (slow path).
 *
 * A job is captured by a compare-and-swap on captured_at, so only one instance runs it
 * per capture. The row is deleted after the function returns or throws.
 */
public class DefaultScheduler
        implements Scheduler
{
    private static final Logger logger = LoggerFactory.getLogger(DefaultScheduler.class);

    private final TransactionManager tm;
    private final ScheduledJobStoreManager store;
    private final JobFunctionRegistry registry;
    private final JobArguments arguments;
    private final ConfigFactory cf;
    private final SchedulerConfig config;

    private final ScheduledExecutorService timers;
    private final ExecutorService invokers;
    private final PollingLoop pollingLoop;

    // guarded by itself
    private final Set<MemoryJob> memoryJobs = new HashSet<>();

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public DefaultScheduler(TransactionManager tm, ScheduledJobStoreManager store,
            JobFunctionRegistry registry, ConfigFactory cf, SchedulerConfig config)
    {
        this.tm = tm;
        this.store = store;
        this.registry = registry;
        this.arguments = new JobArguments(registry, cf);
        this.cf = cf;
        this.config = config;
        this.timers = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("scheduler-timer-%d")
                .build());
        this.invokers = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("scheduler-job-%d")
                .build());
        this.pollingLoop = new PollingLoop("scheduler-poll-%d", config);
    }

    private static class MemoryJob
    {
        private final String id;
        private final Optional<String> key;
        private volatile boolean captured = false;

        MemoryJob(String id, Optional<String> key)
        {
            this.id = id;
            this.key = key;
        }
    }

    @Override
    public void schedule(Job job)
    {
        Instant executeAt = Instant.now().truncatedTo(ChronoUnit.MILLIS).plusSeconds(job.getRunAfter());

        ScheduledJob scheduledJob = ScheduledJob.scheduledJobBuilder()
            .runAfter(job.getRunAfter())
            .targetFactoryFuncName(job.getTargetFactoryName())
            .funcName(job.getFunctionName())
            .funcArgs(arguments.serialize(job.getFunctionArgs(), job.getArgumentSerializers()))
            .funcArgSerializers(arguments.serializerKeys(job.getArgumentSerializers()))
            .authContext(AuthContext.toConfig(job.getAuthContext(), cf))
            .executeAt(executeAt)
            .capturedAt(Optional.absent())
            .key(job.getKey())
            .build();

        StoredScheduledJob stored = store.createScheduledJob(scheduledJob);

        MemoryJob memoryJob = new MemoryJob(stored.getId(), stored.getKey());
        synchronized (memoryJobs) {
            memoryJobs.add(memoryJob);
        }
        try {
            timers.schedule(() -> invokers.execute(() -> runMemoryJob(memoryJob, stored)),
                    job.getRunAfter(), TimeUnit.SECONDS);
        }
        catch (RejectedExecutionException ex) {
            // closed. the row stays for the pollers of other instances
            logger.debug("Scheduler is closed. Scheduled job {} is left to polling", stored.getId());
            synchronized (memoryJobs) {
                memoryJobs.remove(memoryJob);
                memoryJobs.notifyAll();
            }
        }
    }

    @Override
    public boolean hasScheduledJobs(JobFilter filter)
    {
        synchronized (memoryJobs) {
            for (MemoryJob memoryJob : memoryJobs) {
                if (filter.matches(memoryJob.key, memoryJob.captured)) {
                    return true;
                }
            }
        }
        return store.countScheduledJobs(filter) > 0;
    }

    @Override
    public void start()
    {
        if (!config.getEnabled()) {
            logger.info("Scheduler is disabled");
            return;
        }
        if (pollingLoop.start(() -> runOnce(Instant.now()), errorReporter)) {
            logger.debug("Started polling scheduled jobs: fixed_delay={}, random_delay={}, batch_size={}",
                    config.getFixedDelay(), config.getRandomDelay(), config.getBatchSize());
        }
    }

    @Override
    public void stop(boolean graceful)
    {
        if (pollingLoop.stop(graceful) && graceful) {
            try {
                waitForMemoryJobs();
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close()
    {
        stop(true);
        // timers that haven't fired leave their rows to polling
        timers.shutdownNow();
        invokers.shutdown();
        synchronized (memoryJobs) {
            memoryJobs.removeIf(memoryJob -> !memoryJob.captured);
            memoryJobs.notifyAll();
        }
    }

    private void waitForMemoryJobs()
            throws InterruptedException
    {
        synchronized (memoryJobs) {
            while (memoryJobs.stream().anyMatch(memoryJob -> memoryJob.captured)) {
                memoryJobs.wait();
            }
        }
    }

    /**
     * Captures the jobs that are due as of now and runs them. Returns the number of jobs run.
     */
    @VisibleForTesting
    int runOnce(Instant now)
    {
        Instant currentTime = now.truncatedTo(ChronoUnit.MILLIS);
        Instant executeBefore = currentTime.minusSeconds(config.getPickupJobAfter());
        Instant capturedBefore = currentTime.minusSeconds(config.getCapturedJobTimeout());
        int limit = config.getBatchSize().or(Integer.MAX_VALUE);

        List<StoredScheduledJob> captured = DatabaseRetry.run(() -> tm.begin(() -> {
            List<StoredScheduledJob> list = new ArrayList<>();
            for (StoredScheduledJob candidate : store.getScheduledJobsToStart(executeBefore, capturedBefore, limit)) {
                UpdateResult<StoredScheduledJob> result =
                    store.updateCapturedAt(candidate.getId(), candidate.getCapturedAt(), currentTime);
                if (result.isUpdated()) {
                    list.add(result.getRow().get());
                }
                else {
                    logger.debug("Scheduled job {} is captured by another scheduler", candidate.getId());
                }
            }
            return list;
        }));

        for (StoredScheduledJob job : captured) {
            invokeJob(job);
            deleteJob(job);
        }
        return captured.size();
    }

    private void runMemoryJob(MemoryJob memoryJob, StoredScheduledJob job)
    {
        try {
            UpdateResult<StoredScheduledJob> result;
            try {
                result = store.updateCapturedAt(job.getId(), job.getCapturedAt(),
                        Instant.now().truncatedTo(ChronoUnit.MILLIS));
            }
            catch (RuntimeException ex) {
                logger.error(UNEXPECTED_SERVER_ERROR, "Failed to capture scheduled job {}. Polling will run it later", job.getId(), ex);
                errorReporter.reportUncaughtError(ex);
                return;
            }
            if (!result.isUpdated()) {
                logger.warn("Unable to capture scheduled job {}: {}", job.getId(), job.getFuncName());
                return;
            }

            memoryJob.captured = true;
            StoredScheduledJob capturedJob = result.getRow().get();
            invokeJob(capturedJob);
            deleteJob(capturedJob);
        }
        finally {
            synchronized (memoryJobs) {
                memoryJobs.remove(memoryJob);
                memoryJobs.notifyAll();
            }
        }
    }

    private void invokeJob(StoredScheduledJob job)
    {
        logger.debug("Running scheduled job {}: target_factory={}, function={}, arguments={}",
                job.getId(), job.getTargetFactoryFuncName().orNull(), job.getFuncName(), job.getFuncArgs());
        try {
            JobFunction function = registry.resolve(job.getTargetFactoryFuncName(), job.getFuncName());
            Map<String, Object> args = arguments.deserialize(job.getFuncArgs(), job.getFuncArgSerializers());
            Optional<AuthContext> authContext = AuthContext.fromConfig(job.getAuthContext());
            function.call(new JobInvocation(authContext, args));
        }
        catch (Exception ex) {
            logger.error(FAILED_JOB, "Scheduled job {} failed: function={}, arguments={}",
                    job.getId(), job.getFuncName(), job.getFuncArgs(), ex);
        }
    }

    private void deleteJob(StoredScheduledJob job)
    {
        try {
            DatabaseRetry.run(() -> store.deleteScheduledJob(job.getId()));
        }
        catch (RuntimeException ex) {
            logger.error(UNEXPECTED_SERVER_ERROR, "Failed to delete scheduled job {}", job.getId(), ex);
            errorReporter.reportUncaughtError(ex);
        }
    }
}
