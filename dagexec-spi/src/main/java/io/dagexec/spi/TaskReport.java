package io.dagexec.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.dagexec.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableTaskReport.class)
@JsonDeserialize(as = ImmutableTaskReport.class)
public interface TaskReport
{
    String getTaskName();

    boolean getRan();

    long getElapsedMillis();

    Config getOutput();

    static ImmutableTaskReport.Builder builder()
    {
        return ImmutableTaskReport.builder();
    }
}
