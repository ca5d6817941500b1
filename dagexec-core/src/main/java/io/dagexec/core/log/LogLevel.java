package io.dagexec.core.log;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum LogLevel
{
    ERROR(Level.ERROR),
    WARN(Level.WARN),
    INFO(Level.INFO),
    DEBUG(Level.DEBUG),
    TRACE(Level.TRACE);

    private final Level level;

    private LogLevel(Level level)
    {
        this.level = level;
    }

    public Level toLogbackLevel()
    {
        return level;
    }

    @JsonValue
    public String getName()
    {
        return name().toLowerCase(ENGLISH);
    }

    @JsonCreator
    public static LogLevel of(String name)
    {
        for (LogLevel level : values()) {
            if (level.getName().equals(name.toLowerCase(ENGLISH))) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: " + name);
    }
}
