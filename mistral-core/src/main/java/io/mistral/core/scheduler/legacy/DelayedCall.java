package io.mistral.core.scheduler.legacy;

import com.google.common.base.Optional;
import io.mistral.commons.config.Config;
import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
public abstract class DelayedCall
{
    public abstract Optional<String> getFactoryMethodPath();

    public abstract String getTargetMethodName();

    public abstract Config getMethodArguments();

    public abstract Config getSerializers();

    public abstract Config getAuthContext();

    public abstract Instant getExecutionTime();

    /**
     * True while a scheduler instance holds the call. Reset by {@link DelayedCallRecovery}
     * if the holder never finishes.
     */
    @Value.Default
    public boolean getProcessing()
    {
        return false;
    }

    public abstract Optional<String> getKey();

    public static ImmutableDelayedCall.Builder delayedCallBuilder()
    {
        return ImmutableDelayedCall.builder();
    }
}
