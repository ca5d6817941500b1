package io.dagexec.core.executor;

import java.util.List;
import io.dagexec.client.config.Config;
import io.dagexec.spi.Dag;
import io.dagexec.spi.TaskReport;

public interface DagExecutor
{
    /**
     * Builds the tasks of a DAG in the given order.
     *
     * @param showProgress report the task being built through a {@link ProgressReporter}
     * @param taskParams parameters passed unchanged to every task
     * @return reports of the tasks built successfully, in build order
     * @throws DagBuildException if one or more tasks failed
     */
    List<TaskReport> execute(Dag dag, boolean showProgress, Config taskParams);
}
