package io.dagexec.client.config;

import java.util.Map;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
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

    public Config create(Map<String, ?> values)
    {
        Config config = create();
        for (Map.Entry<String, ?> pair : values.entrySet()) {
            config.set(pair.getKey(), pair.getValue());
        }
        return config;
    }
}
