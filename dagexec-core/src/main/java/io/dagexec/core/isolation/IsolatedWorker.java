package io.dagexec.core.isolation;

import io.dagexec.client.config.Config;
import io.dagexec.spi.Task;
import io.dagexec.spi.TaskReport;

/**
 * A disposable execution context that builds exactly one task.
 *
 * {@link #submit(Task, Config)} blocks until the build finishes and either
 * returns its report or throws an exception equivalent to what the build
 * threw. {@link #close()} releases the context whether or not the build
 * succeeded.
 */
public interface IsolatedWorker
        extends AutoCloseable
{
    TaskReport submit(Task task, Config params);

    @Override
    void close();
}
