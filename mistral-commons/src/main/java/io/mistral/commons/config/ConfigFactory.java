package io.mistral.commons.config;

import java.io.IOException;
import java.util.Map;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;

public class ConfigFactory
{
    public static ObjectMapper defaultObjectMapper()
    {
        return new ObjectMapper().registerModule(new GuavaModule());
    }

    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config create(Object other)
    {
        return create().set("_", other).getNested("_");
    }

    public Config fromMap(Map<String, ?> map)
    {
        Config config = create();
        for (Map.Entry<String, ?> pair : map.entrySet()) {
            config.set(pair.getKey(), pair.getValue());
        }
        return config;
    }

    public Config fromJsonString(String json)
    {
        try {
            return new Config(objectMapper, objectMapper.readTree(json));
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
        catch (ClassCastException ex) {
            throw new ConfigException("Expected a JSON object but got " + json, ex);
        }
    }
}
