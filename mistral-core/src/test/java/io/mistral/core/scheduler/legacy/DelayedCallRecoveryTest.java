package io.mistral.core.scheduler.legacy;

import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import io.mistral.core.database.DatabaseTestingUtils;
import org.junit.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DelayedCallRecoveryTest
{
    private static DelayedCallRecoveryConfig config(int timeout)
    {
        return DelayedCallRecoveryConfig.builder()
            .enabled(true)
            .interval(60)
            .timeout(timeout)
            .build();
    }

    @Test
    public void recoverReleasesCallsOlderThanTimeout()
    {
        DelayedCallStoreManager store = mock(DelayedCallStoreManager.class);
        Instant now = Instant.parse("2025-03-10T09:30:00Z");
        when(store.resetProcessingCalls(now.minusSeconds(120))).thenReturn(3);

        DelayedCallRecovery recovery = new DelayedCallRecovery(store, config(120));
        assertThat(recovery.recover(now), is(3));
        verify(store).resetProcessingCalls(now.minusSeconds(120));
    }

    @Test
    public void stopWithoutStartIsNoop()
    {
        DelayedCallStoreManager store = mock(DelayedCallStoreManager.class);
        DelayedCallRecovery recovery = new DelayedCallRecovery(store, config(600));
        recovery.stop();
        recovery.start();
        recovery.stop();
        verify(store, never()).resetProcessingCalls(any());
    }

    @Test
    public void configDefaults()
    {
        DelayedCallRecoveryConfig config = DelayedCallRecoveryConfig.convertFrom(DatabaseTestingUtils.createConfig());
        assertThat(config.getEnabled(), is(true));
        assertThat(config.getInterval(), is(60));
        assertThat(config.getTimeout(), is(600));
    }

    @Test
    public void configFromSystemConfig()
    {
        Config system = DatabaseTestingUtils.createConfig()
            .set("scheduler.delayed_call_recovery.enabled", false)
            .set("scheduler.delayed_call_recovery.interval", 5)
            .set("scheduler.delayed_call_recovery.timeout", 30);
        DelayedCallRecoveryConfig config = DelayedCallRecoveryConfig.convertFrom(system);
        assertThat(config.getEnabled(), is(false));
        assertThat(config.getInterval(), is(5));
        assertThat(config.getTimeout(), is(30));
    }

    @Test(expected = ConfigException.class)
    public void rejectNonPositiveTimeout()
    {
        DelayedCallRecoveryConfig.convertFrom(DatabaseTestingUtils.createConfig()
                .set("scheduler.delayed_call_recovery.timeout", 0));
    }
}
