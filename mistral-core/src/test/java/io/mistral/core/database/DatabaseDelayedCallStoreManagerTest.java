package io.mistral.core.database;

import com.google.common.base.Optional;
import io.mistral.core.scheduler.JobFilter;
import io.mistral.core.scheduler.legacy.DelayedCall;
import io.mistral.core.scheduler.legacy.DelayedCallStoreManager;
import io.mistral.core.scheduler.legacy.StoredDelayedCall;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static io.mistral.core.database.DatabaseTestingUtils.assertNotFound;
import static io.mistral.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DatabaseDelayedCallStoreManagerTest
{
    private DatabaseFactory factory;
    private DelayedCallStoreManager store;
    private Instant now;

    @Before
    public void setUp()
    {
        factory = DatabaseTestingUtils.setupDatabase();
        store = factory.getDelayedCallStoreManager();
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @After
    public void tearDown()
    {
        factory.close();
    }

    private StoredDelayedCall createCall(Instant executionTime, Optional<String> key)
    {
        return store.createDelayedCall(DelayedCall.delayedCallBuilder()
                .targetMethodName("run")
                .methodArguments(createConfig().set("id", "1"))
                .serializers(createConfig())
                .authContext(createConfig())
                .executionTime(executionTime)
                .key(key)
                .build());
    }

    @Test
    public void captureFlipsProcessingOnce()
            throws Exception
    {
        StoredDelayedCall call = createCall(now, Optional.absent());
        assertThat(call.getProcessing(), is(false));

        UpdateResult<StoredDelayedCall> first = store.captureDelayedCall(call.getId(), now.plusSeconds(1));
        assertThat(first.isUpdated(), is(true));
        assertThat(first.getRow().get().getProcessing(), is(true));
        assertThat(first.getRow().get().getUpdatedAt(), is(now.plusSeconds(1)));

        assertThat(store.captureDelayedCall(call.getId(), now.plusSeconds(2)).isUpdated(), is(false));
        assertThat(store.getDelayedCallById(call.getId()).getProcessing(), is(true));
    }

    @Test
    public void callsToStartExcludeProcessingAndFuture()
    {
        StoredDelayedCall due = createCall(now.minusSeconds(10), Optional.absent());
        StoredDelayedCall captured = createCall(now.minusSeconds(20), Optional.absent());
        createCall(now.plusSeconds(60), Optional.absent());
        store.captureDelayedCall(captured.getId(), now);

        List<StoredDelayedCall> calls = store.getDelayedCallsToStart(now, 10);
        assertThat(calls.size(), is(1));
        assertThat(calls.get(0).getId(), is(due.getId()));
    }

    @Test
    public void countWithFilter()
    {
        StoredDelayedCall call = createCall(now, Optional.of("k"));
        createCall(now, Optional.absent());
        store.captureDelayedCall(call.getId(), now);

        assertThat(store.countDelayedCalls(JobFilter.all()), is(2L));
        assertThat(store.countDelayedCalls(JobFilter.all().withKey("k")), is(1L));
        assertThat(store.countDelayedCalls(JobFilter.all().withKey(null)), is(1L));
        assertThat(store.countDelayedCalls(JobFilter.all().withProcessing(true)), is(1L));
        assertThat(store.countDelayedCalls(JobFilter.all().withKey(null).withProcessing(true)), is(0L));
    }

    @Test
    public void resetProcessingCallsReleasesOnlyStaleCalls()
            throws Exception
    {
        StoredDelayedCall stale = createCall(now, Optional.absent());
        StoredDelayedCall recent = createCall(now, Optional.absent());
        store.captureDelayedCall(stale.getId(), now.minusSeconds(700));
        store.captureDelayedCall(recent.getId(), now);

        assertThat(store.resetProcessingCalls(now.minusSeconds(600)), is(1));
        assertThat(store.getDelayedCallById(stale.getId()).getProcessing(), is(false));
        assertThat(store.getDelayedCallById(recent.getId()).getProcessing(), is(true));
    }

    @Test
    public void delete()
    {
        StoredDelayedCall call = createCall(now, Optional.absent());
        assertThat(store.deleteDelayedCall(call.getId()), is(true));
        assertNotFound(() -> store.getDelayedCallById(call.getId()));
    }
}
