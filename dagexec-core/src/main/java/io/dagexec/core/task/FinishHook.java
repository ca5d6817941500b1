package io.dagexec.core.task;

import io.dagexec.spi.Task;

@FunctionalInterface
public interface FinishHook
{
    void onFinish(Task task);
}
