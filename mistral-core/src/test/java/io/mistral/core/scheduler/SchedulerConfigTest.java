package io.mistral.core.scheduler;

import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import org.junit.Test;

import static io.mistral.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class SchedulerConfigTest
{
    @Test
    public void defaults()
    {
        SchedulerConfig config = SchedulerConfig.convertFrom(createConfig());
        assertThat(config.getEnabled(), is(true));
        assertThat(config.getType(), is("default"));
        assertThat(config.getFixedDelay(), is(1));
        assertThat(config.getRandomDelay(), is(0));
        assertThat(config.getBatchSize().isPresent(), is(false));
        assertThat(config.getPickupJobAfter(), is(60));
        assertThat(config.getCapturedJobTimeout(), is(30));
    }

    @Test
    public void configured()
    {
        Config system = createConfig()
            .set("scheduler.type", "legacy")
            .set("scheduler.fixed_delay", 3)
            .set("scheduler.random_delay", 2)
            .set("scheduler.batch_size", 100);
        SchedulerConfig config = SchedulerConfig.convertFrom(system);
        assertThat(config.getType(), is("legacy"));
        assertThat(config.getFixedDelay(), is(3));
        assertThat(config.getRandomDelay(), is(2));
        assertThat(config.getBatchSize().get(), is(100));
    }

    @Test(expected = ConfigException.class)
    public void unknownType()
    {
        SchedulerConfig.convertFrom(createConfig().set("scheduler.type", "cron"));
    }

    @Test(expected = ConfigException.class)
    public void nonPositiveBatchSize()
    {
        SchedulerConfig.convertFrom(createConfig().set("scheduler.batch_size", 0));
    }
}
