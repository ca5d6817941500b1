package io.dagexec.core.config;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.dagexec.client.config.Config;
import io.dagexec.client.config.ConfigException;
import io.dagexec.core.isolation.IsolationMode;
import io.dagexec.core.log.LogLevel;
import org.immutables.value.Value;

/**
 * Options of a serial executor.
 *
 * Holds plain values only, so it can be serialized and sent elsewhere. Loggers
 * are obtained by the classes that use them.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableExecutorConfig.class)
@JsonDeserialize(as = ImmutableExecutorConfig.class)
public interface ExecutorConfig
{
    LogLevel DEFAULT_LOGGING_LEVEL = LogLevel.INFO;
    boolean DEFAULT_BUILD_IN_SUBPROCESS = true;
    IsolationMode DEFAULT_ISOLATION_MODE = IsolationMode.PROCESS;

    Optional<String> getLoggingDirectory();

    LogLevel getLoggingLevel();

    boolean getBuildInSubprocess();

    IsolationMode getIsolationMode();

    List<String> getIsolationJvmOptions();

    static ImmutableExecutorConfig.Builder defaultBuilder()
    {
        return ImmutableExecutorConfig.builder()
            .loggingLevel(DEFAULT_LOGGING_LEVEL)
            .buildInSubprocess(DEFAULT_BUILD_IN_SUBPROCESS)
            .isolationMode(DEFAULT_ISOLATION_MODE);
    }

    static ExecutorConfig convertFrom(Config config)
    {
        try {
            return defaultBuilder()
                .loggingDirectory(config.getOptional("executor.logging-directory", String.class))
                .loggingLevel(LogLevel.of(config.get("executor.logging-level", String.class, DEFAULT_LOGGING_LEVEL.getName())))
                .buildInSubprocess(config.get("executor.build-in-subprocess", boolean.class, DEFAULT_BUILD_IN_SUBPROCESS))
                .isolationMode(IsolationMode.of(config.get("executor.isolation-mode", String.class, DEFAULT_ISOLATION_MODE.getType())))
                .isolationJvmOptions(splitJvmOptions(config.get("executor.isolation.jvm-options", String.class, "")))
                .build();
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException(ex.getMessage(), ex);
        }
    }

    static List<String> splitJvmOptions(String options)
    {
        return ImmutableList.copyOf(Splitter.on(' ')
                .trimResults()
                .omitEmptyStrings()
                .split(options));
    }
}
