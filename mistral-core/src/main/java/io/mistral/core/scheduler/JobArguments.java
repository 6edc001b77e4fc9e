package io.mistral.core.scheduler;

import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Converts job arguments to and from their stored form using the registered
 * {@link ArgumentSerializer}s.
 */
public class JobArguments
{
    private final JobFunctionRegistry registry;
    private final ConfigFactory cf;

    public JobArguments(JobFunctionRegistry registry, ConfigFactory cf)
    {
        this.registry = registry;
        this.cf = cf;
    }

    /**
     * @throws IllegalArgumentException if a serializer is listed for an argument that
     *     isn't given, or if a serializer isn't registered
     */
    public Config serialize(Map<String, Object> args, Map<String, String> serializers)
    {
        for (String name : serializers.keySet()) {
            checkArgument(args.containsKey(name),
                    "Serializer is set for argument '%s' but the argument is missing", name);
        }
        Config stored = cf.create();
        for (Map.Entry<String, Object> pair : args.entrySet()) {
            String serializer = serializers.get(pair.getKey());
            if (serializer != null) {
                stored.set(pair.getKey(), registry.getSerializer(serializer).serialize(pair.getValue()));
            }
            else {
                stored.set(pair.getKey(), pair.getValue());
            }
        }
        return stored;
    }

    public Config serializerKeys(Map<String, String> serializers)
    {
        return cf.fromMap(serializers);
    }

    public Map<String, Object> deserialize(Config stored, Config serializerKeys)
    {
        Map<String, Object> args = new LinkedHashMap<>();
        for (String name : stored.getKeys()) {
            Object value = stored.getValue(name);
            if (serializerKeys.has(name)) {
                String serializer = serializerKeys.get(name, String.class);
                value = registry.getSerializer(serializer).deserialize(value);
            }
            args.put(name, value);
        }
        return args;
    }
}
