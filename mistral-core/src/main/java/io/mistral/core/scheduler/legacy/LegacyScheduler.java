package io.mistral.core.scheduler.legacy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.mistral.commons.config.ConfigFactory;
import io.mistral.core.ErrorReporter;
import io.mistral.core.context.AuthContext;
import io.mistral.core.database.TransactionManager;
import io.mistral.core.database.UpdateResult;
import io.mistral.core.queue.OperationQueue;
import io.mistral.core.queue.PostTransactionQueue;
import io.mistral.core.scheduler.Job;
import io.mistral.core.scheduler.JobArguments;
import io.mistral.core.scheduler.JobFilter;
import io.mistral.core.scheduler.JobFunction;
import io.mistral.core.scheduler.JobFunctionRegistry;
import io.mistral.core.scheduler.JobInvocation;
import io.mistral.core.scheduler.PollingLoop;
import io.mistral.core.scheduler.Scheduler;
import io.mistral.core.scheduler.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static io.mistral.core.log.LogMarkers.FAILED_JOB;

/**
 * Scheduler backed by the delayed_calls table, for callers that manage their own
 * transaction boundaries.
 *
 * Each call runs in a transaction of its own that captures the call by setting its
 * processing flag, invokes the function with a skip_tx argument set to true, and
 * deletes the call if the function returned normally. A call whose function threw
 * stays in processing state until {@link DelayedCallRecovery} releases it, so this
 * scheduler refuses to start without recovery.
 */
public class LegacyScheduler
        implements Scheduler
{
    private static final Logger logger = LoggerFactory.getLogger(LegacyScheduler.class);

    public static final String SKIP_TX_ARGUMENT = "skip_tx";

    // calls due within this margin are picked up by the current poll
    private static final long CAPTURE_AHEAD_SECONDS = 1;

    private final TransactionManager tm;
    private final DelayedCallStoreManager store;
    private final JobFunctionRegistry registry;
    private final JobArguments arguments;
    private final ConfigFactory cf;
    private final SchedulerConfig config;
    private final DelayedCallRecovery recovery;
    private final PostTransactionQueue postTxQueue;
    private final PollingLoop pollingLoop;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public LegacyScheduler(TransactionManager tm, DelayedCallStoreManager store,
            JobFunctionRegistry registry, ConfigFactory cf, SchedulerConfig config,
            DelayedCallRecovery recovery, PostTransactionQueue postTxQueue)
    {
        this.tm = tm;
        this.store = store;
        this.registry = registry;
        this.arguments = new JobArguments(registry, cf);
        this.cf = cf;
        this.config = config;
        this.recovery = recovery;
        this.postTxQueue = postTxQueue;
        this.pollingLoop = new PollingLoop("legacy-scheduler-poll-%d", config);
    }

    @Override
    public void schedule(Job job)
    {
        schedule(job, false);
    }

    /**
     * Persists the job as a delayed call.
     *
     * @param skipTransaction true to write into the caller's transaction, which must exist.
     *     Otherwise the caller's transaction is joined if there's one, or a new one is used.
     * @throws IllegalStateException if skipTransaction is true and the calling thread has
     *     no transaction
     */
    public void schedule(Job job, boolean skipTransaction)
    {
        DelayedCall call = DelayedCall.delayedCallBuilder()
            .factoryMethodPath(job.getTargetFactoryName())
            .targetMethodName(job.getFunctionName())
            .methodArguments(arguments.serialize(job.getFunctionArgs(), job.getArgumentSerializers()))
            .serializers(arguments.serializerKeys(job.getArgumentSerializers()))
            .authContext(AuthContext.toConfig(job.getAuthContext(), cf))
            .executionTime(Instant.now().truncatedTo(ChronoUnit.MILLIS).plusSeconds(job.getRunAfter()))
            .processing(false)
            .key(job.getKey())
            .build();

        if (skipTransaction) {
            if (!tm.isInTransaction()) {
                throw new IllegalStateException("skipTransaction is set but the caller has no transaction");
            }
            store.createDelayedCall(call);
        }
        else if (tm.isInTransaction()) {
            store.createDelayedCall(call);
        }
        else {
            tm.begin(() -> store.createDelayedCall(call));
        }
    }

    @Override
    public boolean hasScheduledJobs(JobFilter filter)
    {
        return store.countDelayedCalls(filter) > 0;
    }

    @Override
    public void start()
    {
        if (!config.getEnabled()) {
            logger.info("Legacy scheduler is disabled");
            return;
        }
        if (!recovery.isEnabled()) {
            throw new IllegalStateException(
                    "Legacy scheduler requires delayed call recovery. Set scheduler.delayed_call_recovery.enabled to true");
        }
        if (pollingLoop.start(this::runOnce, errorReporter)) {
            recovery.start();
            logger.debug("Started polling delayed calls: fixed_delay={}, random_delay={}, batch_size={}",
                    config.getFixedDelay(), config.getRandomDelay(), config.getBatchSize());
        }
    }

    @Override
    public void stop(boolean graceful)
    {
        if (pollingLoop.stop(graceful)) {
            recovery.stop();
        }
    }

    /**
     * Runs due calls one at a time until batch_size calls are handled or none is left.
     * Returns the number of handled calls.
     */
    @VisibleForTesting
    public int runOnce()
    {
        int limit = config.getBatchSize().or(Integer.MAX_VALUE);
        int handled = 0;
        while (handled < limit) {
            boolean found = postTxQueue.run(Optional.absent(), this::processSingleCall);
            if (!found) {
                break;
            }
            handled++;
        }
        return handled;
    }

    // returns false if no call is due
    private boolean processSingleCall(OperationQueue queue)
    {
        return tm.begin(() -> {
            Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            List<StoredDelayedCall> due = store.getDelayedCallsToStart(now.plusSeconds(CAPTURE_AHEAD_SECONDS), 1);
            if (due.isEmpty()) {
                return false;
            }

            StoredDelayedCall call = due.get(0);
            UpdateResult<StoredDelayedCall> captured = store.captureDelayedCall(call.getId(), now);
            if (!captured.isUpdated()) {
                logger.debug("Delayed call {} is captured by another scheduler", call.getId());
                return true;
            }

            if (invokeCall(captured.getRow().get(), queue)) {
                store.deleteDelayedCall(call.getId());
            }
            return true;
        });
    }

    private boolean invokeCall(StoredDelayedCall call, OperationQueue queue)
    {
        logger.debug("Running delayed call {}: factory={}, method={}, arguments={}",
                call.getId(), call.getFactoryMethodPath().orNull(), call.getTargetMethodName(), call.getMethodArguments());
        try {
            JobFunction function = registry.resolve(call.getFactoryMethodPath(), call.getTargetMethodName());
            Map<String, Object> args = arguments.deserialize(call.getMethodArguments(), call.getSerializers());
            args.put(SKIP_TX_ARGUMENT, true);
            Optional<AuthContext> authContext = AuthContext.fromConfig(call.getAuthContext());
            // operations registered by the call run with the context it was scheduled with
            queue.setAuthContext(authContext);
            function.call(new JobInvocation(authContext, args, Optional.of(queue)));
            return true;
        }
        catch (Exception ex) {
            logger.error(FAILED_JOB, "Delayed call {} failed: method={}, arguments={}. It stays processing until recovery releases it",
                    call.getId(), call.getTargetMethodName(), call.getMethodArguments(), ex);
            return false;
        }
    }
}
