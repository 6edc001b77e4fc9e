package io.mistral.core.scheduler.legacy;

import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface DelayedCallRecoveryConfig
{
    boolean getEnabled();

    int getInterval();  // seconds

    /**
     * A call that has been processing for longer than this is considered abandoned.
     */
    int getTimeout();  // seconds

    static ImmutableDelayedCallRecoveryConfig.Builder builder()
    {
        return ImmutableDelayedCallRecoveryConfig.builder();
    }

    static DelayedCallRecoveryConfig convertFrom(Config config)
    {
        DelayedCallRecoveryConfig converted = builder()
            .enabled(config.get("scheduler.delayed_call_recovery.enabled", boolean.class, true))
            .interval(config.get("scheduler.delayed_call_recovery.interval", int.class, 60))
            .timeout(config.get("scheduler.delayed_call_recovery.timeout", int.class, 600))
            .build();
        if (converted.getInterval() <= 0) {
            throw new ConfigException("scheduler.delayed_call_recovery.interval must be positive: " + converted.getInterval());
        }
        if (converted.getTimeout() <= 0) {
            throw new ConfigException("scheduler.delayed_call_recovery.timeout must be positive: " + converted.getTimeout());
        }
        return converted;
    }
}
