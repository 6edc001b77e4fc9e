package io.mistral.core.scheduler.legacy;

import io.mistral.core.ResourceNotFoundException;
import io.mistral.core.database.UpdateResult;
import io.mistral.core.scheduler.JobFilter;

import java.time.Instant;
import java.util.List;

/**
 * Persistence of delayed calls.
 *
 * Every method joins the caller's transaction, or runs in auto-commit mode if
 * the caller has none.
 */
public interface DelayedCallStoreManager
{
    StoredDelayedCall createDelayedCall(DelayedCall call);

    List<StoredDelayedCall> getDelayedCalls();

    StoredDelayedCall getDelayedCallById(String id)
        throws ResourceNotFoundException;

    /**
     * Calls not being processed with execution_time at or before executeBefore,
     * oldest first.
     */
    List<StoredDelayedCall> getDelayedCallsToStart(Instant executeBefore, int limit);

    /**
     * Flips processing from false to true. Exactly one of concurrent callers gets
     * an updated result.
     */
    UpdateResult<StoredDelayedCall> captureDelayedCall(String id, Instant capturedAt);

    long countDelayedCalls(JobFilter filter);

    boolean deleteDelayedCall(String id);

    /**
     * Sets processing back to false on calls that have been processing since
     * before updatedBefore. Returns the number of reset calls.
     */
    int resetProcessingCalls(Instant updatedBefore);
}
