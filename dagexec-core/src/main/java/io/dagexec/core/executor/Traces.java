package io.dagexec.core.executor;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import io.dagexec.core.isolation.IsolatedBuildException;
import io.dagexec.spi.Task;

class Traces
{
    private Traces()
    { }

    // a failure of an isolated build is reported with the trace of the original exception
    static String format(Throwable ex)
    {
        if (ex instanceof IsolatedBuildException) {
            return ((IsolatedBuildException) ex).getRemoteTrace();
        }
        return Throwables.getStackTraceAsString(ex);
    }

    static String describe(Task task)
    {
        String kind = task.getClass().getSimpleName();
        if (Strings.isNullOrEmpty(kind)) {
            kind = Task.class.getSimpleName();
        }
        return kind + ": " + task.getName();
    }
}
