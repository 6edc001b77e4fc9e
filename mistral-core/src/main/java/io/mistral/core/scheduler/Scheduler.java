package io.mistral.core.scheduler;

public interface Scheduler
{
    /**
     * Persists the job so that it runs once, after its run-after delay, on any
     * scheduler instance sharing the database. Joins the caller's transaction if
     * there is one.
     */
    void schedule(Job job);

    boolean hasScheduledJobs(JobFilter filter);

    default boolean hasScheduledJobs()
    {
        return hasScheduledJobs(JobFilter.all());
    }

    void start();

    /**
     * Stops polling. If graceful, waits until the polling thread and running jobs finish.
     */
    void stop(boolean graceful);

    /**
     * Stops gracefully and releases the threads of this scheduler. A closed scheduler
     * can't be started again.
     */
    default void close()
    {
        stop(true);
    }
}
