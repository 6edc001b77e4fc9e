package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface SchedulerConfig
{
    boolean getEnabled();

    /**
     * "default" or "legacy".
     */
    String getType();

    int getFixedDelay();  // seconds

    int getRandomDelay();  // seconds

    /**
     * Maximum number of jobs a poll picks up. Unlimited if absent.
     */
    Optional<Integer> getBatchSize();

    int getPickupJobAfter();  // seconds

    int getCapturedJobTimeout();  // seconds

    static ImmutableSchedulerConfig.Builder builder()
    {
        return ImmutableSchedulerConfig.builder();
    }

    static SchedulerConfig convertFrom(Config config)
    {
        String type = config.get("scheduler.type", String.class, "default");
        if (!type.equals("default") && !type.equals("legacy")) {
            throw new ConfigException("Unknown scheduler.type: " + type);
        }
        SchedulerConfig converted = builder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .type(type)
            .fixedDelay(config.get("scheduler.fixed_delay", int.class, 1))
            .randomDelay(config.get("scheduler.random_delay", int.class, 0))
            .batchSize(config.getOptional("scheduler.batch_size", Integer.class))
            .pickupJobAfter(config.get("scheduler.pickup_job_after", int.class, 60))
            .capturedJobTimeout(config.get("scheduler.captured_job_timeout", int.class, 30))
            .build();
        if (converted.getFixedDelay() < 0 || converted.getRandomDelay() < 0) {
            throw new ConfigException("scheduler.fixed_delay and scheduler.random_delay must not be negative");
        }
        if (converted.getBatchSize().isPresent() && converted.getBatchSize().get() <= 0) {
            throw new ConfigException("scheduler.batch_size must be positive: " + converted.getBatchSize().get());
        }
        return converted;
    }
}
