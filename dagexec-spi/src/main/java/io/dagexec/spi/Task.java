package io.dagexec.spi;

import io.dagexec.client.config.Config;

/**
 * A unit of build work owned by a {@link Dag}.
 *
 * <p>
 * Executors only read and write the status and call {@link #build(Config)}.
 * Setting the status may run hooks of the task, so {@link #setStatus(TaskStatus)}
 * is allowed to throw.
 * </p>
 */
public interface Task
{
    String getName();

    TaskStatus getStatus();

    void setStatus(TaskStatus status);

    SourceKind getSourceKind();

    TaskReport build(Config params);
}
