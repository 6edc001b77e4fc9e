package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import io.mistral.core.database.UpdateResult;

import java.time.Instant;
import java.util.List;

/**
 * Persistence of scheduled jobs.
 *
 * Every method joins the caller's transaction, or runs in auto-commit mode if
 * the caller has none.
 */
public interface ScheduledJobStoreManager
{
    StoredScheduledJob createScheduledJob(ScheduledJob job);

    List<StoredScheduledJob> getScheduledJobs();

    Optional<StoredScheduledJob> getScheduledJobById(String id);

    /**
     * Jobs with execute_at at or before executeBefore that are either not captured
     * or were captured at or before capturedBefore, oldest first.
     */
    List<StoredScheduledJob> getScheduledJobsToStart(Instant executeBefore, Instant capturedBefore, int limit);

    /**
     * Sets captured_at if it still holds the previous value. Exactly one of concurrent
     * callers passing the same previous value gets an updated result.
     */
    UpdateResult<StoredScheduledJob> updateCapturedAt(String id, Optional<Instant> previous, Instant capturedAt);

    long countScheduledJobs(JobFilter filter);

    boolean deleteScheduledJob(String id);
}
