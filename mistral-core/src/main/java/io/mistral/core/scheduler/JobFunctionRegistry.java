package io.mistral.core.scheduler;

import com.google.common.base.Optional;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves the string keys stored with scheduled jobs to code.
 *
 * Jobs outlive the process that scheduled them, so functions, target factories and
 * argument serializers are registered under stable names at startup, before any
 * scheduler starts.
 */
public class JobFunctionRegistry
{
    private final ConcurrentMap<String, JobFunction> functions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, JobTargetFactory> targetFactories = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ArgumentSerializer<?>> serializers = new ConcurrentHashMap<>();

    public JobFunctionRegistry registerFunction(String name, JobFunction function)
    {
        register(functions, name, function, "function");
        return this;
    }

    public JobFunctionRegistry registerTargetFactory(String name, JobTargetFactory factory)
    {
        register(targetFactories, name, factory, "target factory");
        return this;
    }

    public JobFunctionRegistry registerSerializer(String name, ArgumentSerializer<?> serializer)
    {
        register(serializers, name, serializer, "argument serializer");
        return this;
    }

    /**
     * Returns the function to call for a job.
     *
     * @throws IllegalArgumentException if a name isn't registered
     */
    public JobFunction resolve(Optional<String> targetFactoryName, String functionName)
    {
        if (targetFactoryName.isPresent()) {
            JobTargetFactory factory = targetFactories.get(targetFactoryName.get());
            checkArgument(factory != null, "Unknown job target factory: %s", targetFactoryName.get());
            JobTarget target = factory.create();
            Optional<JobFunction> function = target.getFunction(functionName);
            checkArgument(function.isPresent(), "Job target %s has no function %s", targetFactoryName.get(), functionName);
            return function.get();
        }
        JobFunction function = functions.get(functionName);
        checkArgument(function != null, "Unknown job function: %s", functionName);
        return function;
    }

    /**
     * @throws IllegalArgumentException if the name isn't registered
     */
    @SuppressWarnings("unchecked")
    public ArgumentSerializer<Object> getSerializer(String name)
    {
        ArgumentSerializer<?> serializer = serializers.get(name);
        checkArgument(serializer != null, "Unknown argument serializer: %s", name);
        return (ArgumentSerializer<Object>) serializer;
    }

    private static <T> void register(ConcurrentMap<String, T> map, String name, T value, String kind)
    {
        checkNotNull(name, "name");
        checkNotNull(value, kind);
        T existing = map.putIfAbsent(name, value);
        checkArgument(existing == null, "%s is already registered as a %s", name, kind);
    }
}
