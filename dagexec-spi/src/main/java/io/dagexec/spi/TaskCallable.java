package io.dagexec.spi;

import io.dagexec.client.config.Config;

/**
 * In-memory logic of a task.
 *
 * <p>
 * An implementation built in an isolated JVM is instantiated there by class
 * name, so it must be a public top-level or static nested class with a public
 * no-argument constructor.
 * </p>
 */
public interface TaskCallable
{
    /**
     * @return output parameters of the task, never null
     */
    Config call(String taskName, Config params);
}
