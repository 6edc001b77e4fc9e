package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.mistral.core.context.AuthContext;
import io.mistral.core.queue.OperationQueue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments and context of one execution of a scheduled job.
 */
public class JobInvocation
{
    private final Optional<AuthContext> authContext;
    private final Map<String, Object> arguments;
    private final Optional<OperationQueue> operationQueue;

    public JobInvocation(Optional<AuthContext> authContext, Map<String, Object> arguments)
    {
        this(authContext, arguments, Optional.absent());
    }

    public JobInvocation(Optional<AuthContext> authContext, Map<String, Object> arguments,
            Optional<OperationQueue> operationQueue)
    {
        this.authContext = authContext;
        // values may be null
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.operationQueue = operationQueue;
    }

    public Optional<AuthContext> getAuthContext()
    {
        return authContext;
    }

    public Map<String, Object> getArguments()
    {
        return arguments;
    }

    public Object getArgument(String name)
    {
        return arguments.get(name);
    }

    public <T> T getArgument(String name, Class<T> type)
    {
        return type.cast(arguments.get(name));
    }

    /**
     * The post-transaction operation queue of the transaction the job runs in,
     * if the scheduler runs jobs inside one.
     */
    public Optional<OperationQueue> getOperationQueue()
    {
        return operationQueue;
    }

    @Override
    public String toString()
    {
        return "JobInvocation{arguments=" + arguments + "}";
    }
}
