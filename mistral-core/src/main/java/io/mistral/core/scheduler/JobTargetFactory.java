package io.mistral.core.scheduler;

@FunctionalInterface
public interface JobTargetFactory
{
    JobTarget create();
}
