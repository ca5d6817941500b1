package io.dagexec.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.dagexec.client.config.Config;
import io.dagexec.client.config.ConfigFactory;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    // keys stay flat: "executor.logging-level" is a single key, not a nested object
    public static Config toConfig(ConfigFactory cf, Properties props)
    {
        Config config = cf.create();
        for (String key : props.stringPropertyNames()) {
            config.set(key, props.getProperty(key));
        }
        return config;
    }
}
