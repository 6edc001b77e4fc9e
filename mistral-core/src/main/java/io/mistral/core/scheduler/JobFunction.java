package io.mistral.core.scheduler;

@FunctionalInterface
public interface JobFunction
{
    void call(JobInvocation invocation)
        throws Exception;
}
