package io.mistral.core.scheduler.legacy;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.mistral.commons.config.ConfigFactory;
import io.mistral.core.context.AuthContext;
import io.mistral.core.database.DatabaseFactory;
import io.mistral.core.database.DatabaseTestingUtils;
import io.mistral.core.database.TransactionManager;
import io.mistral.core.queue.PostTransactionQueue;
import io.mistral.core.scheduler.ImmutableSchedulerConfig;
import io.mistral.core.scheduler.Job;
import io.mistral.core.scheduler.JobFilter;
import io.mistral.core.scheduler.JobFunctionRegistry;
import io.mistral.core.scheduler.JobInvocation;
import io.mistral.core.scheduler.SchedulerConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class LegacySchedulerTest
{
    private DatabaseFactory factory;
    private TransactionManager tm;
    private ConfigFactory cf;
    private JobFunctionRegistry registry;
    private DelayedCallStoreManager store;
    private PostTransactionQueue postTxQueue;
    private DelayedCallRecovery recovery;
    private List<JobInvocation> invocations;
    private List<String> operations;
    private LegacyScheduler scheduler;

    @Before
    public void setUp()
    {
        factory = DatabaseTestingUtils.setupDatabase();
        tm = factory.get();
        cf = DatabaseTestingUtils.createConfigFactory();
        registry = new JobFunctionRegistry();
        store = factory.getDelayedCallStoreManager();
        postTxQueue = new PostTransactionQueue(tm);
        invocations = new CopyOnWriteArrayList<>();
        operations = new CopyOnWriteArrayList<>();

        registry.registerFunction("record", invocation -> invocations.add(invocation));
        registry.registerFunction("fail", invocation -> {
            invocations.add(invocation);
            throw new IllegalStateException("call failure");
        });
        registry.registerFunction("continue", invocation -> {
            invocations.add(invocation);
            invocation.getOperationQueue().get().register(queue -> operations.add("next step"), false);
        });

        recovery = new DelayedCallRecovery(store, recoveryConfig(true));
        scheduler = newScheduler(schedulerConfig().build(), recovery);
    }

    @After
    public void tearDown()
            throws Exception
    {
        scheduler.stop(true);
        postTxQueue.awaitDrained(Duration.ofSeconds(10));
        factory.close();
    }

    private static ImmutableSchedulerConfig.Builder schedulerConfig()
    {
        return SchedulerConfig.builder()
            .enabled(true)
            .type("legacy")
            .fixedDelay(1)
            .randomDelay(0)
            .pickupJobAfter(60)
            .capturedJobTimeout(30);
    }

    private static DelayedCallRecoveryConfig recoveryConfig(boolean enabled)
    {
        return DelayedCallRecoveryConfig.builder()
            .enabled(enabled)
            .interval(60)
            .timeout(600)
            .build();
    }

    private LegacyScheduler newScheduler(SchedulerConfig config, DelayedCallRecovery recovery)
    {
        return new LegacyScheduler(tm, store, registry, cf, config, recovery, postTxQueue);
    }

    @Test
    public void callIsInvokedWithSkipTx()
    {
        scheduler.schedule(Job.builder()
                .functionName("record")
                .functionArgs(ImmutableMap.of("id", "321"))
                .build());

        assertThat(scheduler.runOnce(), is(1));
        assertThat(invocations.size(), is(1));
        assertThat(invocations.get(0).getArgument("id"), is("321"));
        assertThat(invocations.get(0).getArgument(LegacyScheduler.SKIP_TX_ARGUMENT), is(true));
        assertThat(invocations.get(0).getOperationQueue().isPresent(), is(true));
        assertThat(store.getDelayedCalls().isEmpty(), is(true));
    }

    @Test
    public void failedCallStaysProcessingUntilRecovery()
    {
        scheduler.schedule(Job.builder()
                .functionName("fail")
                .key("k")
                .build());

        assertThat(scheduler.runOnce(), is(1));
        assertThat(invocations.size(), is(1));

        List<StoredDelayedCall> calls = store.getDelayedCalls();
        assertThat(calls.size(), is(1));
        assertThat(calls.get(0).getProcessing(), is(true));
        assertThat(scheduler.hasScheduledJobs(JobFilter.all().withKey("k").withProcessing(true)), is(true));

        // not picked up again while processing
        assertThat(scheduler.runOnce(), is(0));
        assertThat(invocations.size(), is(1));

        assertThat(recovery.recover(Instant.now()), is(0));
        assertThat(recovery.recover(Instant.now().plusSeconds(601)), is(1));
        assertThat(scheduler.hasScheduledJobs(JobFilter.all().withProcessing(false)), is(true));

        assertThat(scheduler.runOnce(), is(1));
        assertThat(invocations.size(), is(2));
    }

    @Test
    public void futureCallIsNotRun()
    {
        scheduler.schedule(Job.builder()
                .runAfter(60)
                .functionName("record")
                .build());

        assertThat(scheduler.runOnce(), is(0));
        assertThat(scheduler.hasScheduledJobs(), is(true));
        assertThat(scheduler.hasScheduledJobs(JobFilter.all().withProcessing(true)), is(false));
    }

    @Test
    public void runOnceRespectsBatchSize()
    {
        scheduler = newScheduler(schedulerConfig().batchSize(2).build(), recovery);
        for (int i = 0; i < 3; i++) {
            scheduler.schedule(Job.builder().functionName("record").build());
        }

        assertThat(scheduler.runOnce(), is(2));
        assertThat(scheduler.runOnce(), is(1));
        assertThat(scheduler.runOnce(), is(0));
        assertThat(invocations.size(), is(3));
    }

    @Test
    public void skipTransactionRequiresTransaction()
    {
        try {
            scheduler.schedule(Job.builder().functionName("record").build(), true);
            fail();
        }
        catch (IllegalStateException ex) {
            // expected
        }
        assertThat(scheduler.hasScheduledJobs(), is(false));
    }

    @Test
    public void skipTransactionWritesIntoCallersTransaction()
    {
        try {
            tm.begin(() -> {
                scheduler.schedule(Job.builder().functionName("record").build(), true);
                assertThat(scheduler.hasScheduledJobs(), is(true));
                throw new IllegalArgumentException("rollback");
            });
            fail();
        }
        catch (IllegalArgumentException ex) {
            // expected
        }
        assertThat(scheduler.hasScheduledJobs(), is(false));

        tm.begin(() -> {
            scheduler.schedule(Job.builder().functionName("record").build(), true);
            return null;
        });
        assertThat(scheduler.hasScheduledJobs(), is(true));
    }

    @Test
    public void operationsRegisteredByCallRunAfterCommit()
            throws Exception
    {
        scheduler.schedule(Job.builder().functionName("continue").build());

        assertThat(scheduler.runOnce(), is(1));
        assertThat(postTxQueue.awaitDrained(Duration.ofSeconds(10)), is(true));
        assertThat(operations.size(), is(1));
        assertThat(operations.get(0), is("next step"));
    }

    @Test
    public void operationsRegisteredByCallRunWithItsAuthContext()
            throws Exception
    {
        List<Optional<AuthContext>> seen = new CopyOnWriteArrayList<>();
        registry.registerFunction("continue-as-caller", invocation -> {
            seen.add(invocation.getAuthContext());
            invocation.getOperationQueue().get().register(queue -> seen.add(queue.getAuthContext()), false);
        });

        AuthContext authContext = AuthContext.builder()
            .userId("u1")
            .projectId("p1")
            .build();
        scheduler.schedule(Job.builder()
                .functionName("continue-as-caller")
                .authContext(authContext)
                .build());

        assertThat(scheduler.runOnce(), is(1));
        assertThat(postTxQueue.awaitDrained(Duration.ofSeconds(10)), is(true));
        assertThat(seen.size(), is(2));
        assertThat(seen.get(0), is(Optional.of(authContext)));
        assertThat(seen.get(1), is(Optional.of(authContext)));
    }

    @Test
    public void startIsRefusedWithoutRecovery()
    {
        scheduler = newScheduler(schedulerConfig().build(),
                new DelayedCallRecovery(store, recoveryConfig(false)));
        try {
            scheduler.start();
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage().contains("delayed_call_recovery"), is(true));
        }
    }

    @Test
    public void pollerRunsDueCalls()
            throws Exception
    {
        scheduler.start();
        scheduler.schedule(Job.builder()
                .functionName("record")
                .build());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (invocations.isEmpty() || scheduler.hasScheduledJobs()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out");
            }
            Thread.sleep(50);
        }
        assertThat(invocations.size(), is(1));
    }
}
