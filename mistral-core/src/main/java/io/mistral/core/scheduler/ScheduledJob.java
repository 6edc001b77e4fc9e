package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import io.mistral.commons.config.Config;
import org.immutables.value.Value;

import java.time.Instant;

/**
 * Persistent form of a {@link Job}: arguments already serialized and the auth
 * context already captured.
 */
@Value.Immutable
public abstract class ScheduledJob
{
    public abstract long getRunAfter();

    public abstract Optional<String> getTargetFactoryFuncName();

    public abstract String getFuncName();

    public abstract Config getFuncArgs();

    /**
     * Argument name to serializer key.
     */
    public abstract Config getFuncArgSerializers();

    public abstract Config getAuthContext();

    public abstract Instant getExecuteAt();

    /**
     * Set when a scheduler instance picks up the job. A job captured longer ago than
     * the captured-job timeout may be captured again.
     */
    public abstract Optional<Instant> getCapturedAt();

    public abstract Optional<String> getKey();

    public static ImmutableScheduledJob.Builder scheduledJobBuilder()
    {
        return ImmutableScheduledJob.builder();
    }
}
