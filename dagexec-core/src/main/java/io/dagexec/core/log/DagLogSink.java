package io.dagexec.core.log;

import java.nio.file.Path;

/**
 * Destination of log messages produced while one DAG is built.
 */
public interface DagLogSink
{
    LogSinkHandle attach(String dagName, Path directory, LogLevel level);

    interface LogSinkHandle
    {
        void detach();
    }
}
