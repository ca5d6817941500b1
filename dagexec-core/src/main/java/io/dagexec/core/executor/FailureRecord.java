package io.dagexec.core.executor;

import org.immutables.value.Value;

@Value.Immutable
public interface FailureRecord
{
    String getTaskIdentity();

    String getTrace();

    static FailureRecord of(String taskIdentity, String trace)
    {
        return ImmutableFailureRecord.builder()
            .taskIdentity(taskIdentity)
            .trace(trace)
            .build();
    }
}
