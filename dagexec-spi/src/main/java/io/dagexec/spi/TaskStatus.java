package io.dagexec.spi;

public enum TaskStatus
{
    WAITING,
    SKIPPED,
    ABORTED,
    EXECUTED,
    ERRORED;

    /**
     * SKIPPED and ABORTED are decided before a run starts. Tasks in
     * one of these states are never built.
     */
    public boolean isTerminalAtEntry()
    {
        return this == SKIPPED || this == ABORTED;
    }

    public boolean canTransitionTo(TaskStatus next)
    {
        return this == WAITING && (next == EXECUTED || next == ERRORED);
    }
}
