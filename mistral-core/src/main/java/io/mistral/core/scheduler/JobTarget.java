package io.mistral.core.scheduler;

import com.google.common.base.Optional;

/**
 * An object whose named methods can be called by scheduled jobs.
 */
public interface JobTarget
{
    Optional<JobFunction> getFunction(String name);
}
