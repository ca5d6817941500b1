package io.dagexec.spi;

import static java.util.Locale.ENGLISH;

public class TaskStatusException
        extends IllegalStateException
{
    public TaskStatusException(String taskName, TaskStatus from, TaskStatus to)
    {
        super(String.format(ENGLISH, "Task '%s' can't change status from %s to %s", taskName, from, to));
    }
}
