package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import io.mistral.core.context.AuthContext;
import org.immutables.value.Value;

import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * A unit of deferred work: which function to call, with which arguments, and when.
 *
 * The function is looked up by name in {@link JobFunctionRegistry} when the job runs.
 * If a target factory name is set, the factory creates a {@link JobTarget} and the
 * function name selects one of its methods instead.
 *
 * Arguments listed in {@link #getArgumentSerializers()} are converted by the named
 * {@link ArgumentSerializer} before they're stored and after they're loaded. Other
 * arguments must be plain JSON values. Arguments can't be null; an omitted argument
 * reads as null.
 */
@Value.Immutable
public abstract class Job
{
    /**
     * Seconds to wait before the job becomes eligible to run.
     */
    @Value.Default
    public long getRunAfter()
    {
        return 0L;
    }

    public abstract Optional<String> getTargetFactoryName();

    public abstract String getFunctionName();

    public abstract Map<String, Object> getFunctionArgs();

    /**
     * Argument name to serializer key.
     */
    public abstract Map<String, String> getArgumentSerializers();

    /**
     * Caller-defined tag used by {@link Scheduler#hasScheduledJobs(JobFilter)}.
     */
    public abstract Optional<String> getKey();

    /**
     * Context restored when the job runs.
     */
    public abstract Optional<AuthContext> getAuthContext();

    @Value.Check
    protected void check()
    {
        checkState(!getFunctionName().isEmpty(), "Job function name must be set");
        checkState(getRunAfter() >= 0, "runAfter must not be negative");
    }

    public static ImmutableJob.Builder builder()
    {
        return ImmutableJob.builder();
    }
}
