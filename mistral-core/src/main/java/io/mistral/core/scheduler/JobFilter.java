package io.mistral.core.scheduler;

import com.google.common.base.Objects;
import com.google.common.base.Optional;

/**
 * Condition of {@link Scheduler#hasScheduledJobs(JobFilter)}.
 *
 * A key filter of null matches jobs without a key. The processing filter matches
 * jobs that some scheduler has (true) or hasn't (false) picked up for execution yet.
 */
public final class JobFilter
{
    private static final JobFilter ALL = new JobFilter(false, null, Optional.absent());

    private final boolean keyFiltered;
    private final String key;
    private final Optional<Boolean> processing;

    private JobFilter(boolean keyFiltered, String key, Optional<Boolean> processing)
    {
        this.keyFiltered = keyFiltered;
        this.key = key;
        this.processing = processing;
    }

    public static JobFilter all()
    {
        return ALL;
    }

    public JobFilter withKey(String key)
    {
        return new JobFilter(true, key, processing);
    }

    public JobFilter withProcessing(boolean processing)
    {
        return new JobFilter(keyFiltered, key, Optional.of(processing));
    }

    public boolean isKeyFiltered()
    {
        return keyFiltered;
    }

    /**
     * Valid only if {@link #isKeyFiltered()}. Absent means jobs without a key.
     */
    public Optional<String> getKey()
    {
        return Optional.fromNullable(key);
    }

    public Optional<Boolean> getProcessing()
    {
        return processing;
    }

    public boolean matches(Optional<String> jobKey, boolean jobProcessing)
    {
        if (keyFiltered && !Objects.equal(key, jobKey.orNull())) {
            return false;
        }
        if (processing.isPresent() && processing.get() != jobProcessing) {
            return false;
        }
        return true;
    }

    @Override
    public String toString()
    {
        return "JobFilter{" +
                (keyFiltered ? "key=" + key + ", " : "") +
                "processing=" + processing +
                "}";
    }
}
