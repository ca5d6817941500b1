package io.dagexec.core.task;

import io.dagexec.spi.Task;
import io.dagexec.spi.TaskStatus;
import io.dagexec.spi.TaskStatusException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public abstract class AbstractTask
    implements Task
{
    private final String name;
    private TaskStatus status;

    protected AbstractTask(String name, TaskStatus entryStatus)
    {
        this.name = checkNotNull(name, "name");
        this.status = checkEntryStatus(entryStatus);
    }

    @Override
    public String getName()
    {
        return name;
    }

    @Override
    public TaskStatus getStatus()
    {
        return status;
    }

    @Override
    public void setStatus(TaskStatus next)
    {
        if (!status.canTransitionTo(next)) {
            throw new TaskStatusException(name, status, next);
        }
        TaskStatus previous = status;
        status = next;
        onStatusChanged(previous, next);
    }

    /**
     * Used by whoever plans a run to mark a task to skip or abort before
     * the run starts.
     */
    public void setEntryStatus(TaskStatus entryStatus)
    {
        if (status == TaskStatus.EXECUTED || status == TaskStatus.ERRORED) {
            throw new TaskStatusException(name, status, entryStatus);
        }
        this.status = checkEntryStatus(entryStatus);
    }

    // called after the status changed; an exception thrown here fails setStatus
    protected void onStatusChanged(TaskStatus previous, TaskStatus next)
    { }

    private static TaskStatus checkEntryStatus(TaskStatus status)
    {
        checkArgument(status == TaskStatus.WAITING || status.isTerminalAtEntry(),
                "Entry status must be WAITING, SKIPPED or ABORTED: %s", status);
        return status;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + ": " + name;
    }
}
