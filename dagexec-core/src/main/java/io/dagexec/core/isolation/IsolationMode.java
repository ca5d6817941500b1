package io.dagexec.core.isolation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum IsolationMode
{
    PROCESS,
    THREAD;

    @JsonValue
    public String getType()
    {
        return name().toLowerCase(ENGLISH);
    }

    @JsonCreator
    public static IsolationMode of(String type)
    {
        for (IsolationMode mode : values()) {
            if (mode.getType().equals(type.toLowerCase(ENGLISH))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown isolation mode: " + type);
    }
}
