package io.dagexec.core.isolation;

import com.google.inject.Inject;
import io.dagexec.client.config.Config;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.spi.SourceKind;
import io.dagexec.spi.Task;
import io.dagexec.spi.TaskReport;

/**
 * Builds a task either in the calling thread or in a single-use
 * {@link IsolatedWorker}.
 *
 * Only tasks whose logic lives in memory are isolated. Tasks that delegate to
 * an external process already free their memory when that process exits.
 */
public class IsolationStrategy
{
    private final boolean enabled;
    private final IsolatedWorkerFactory workerFactory;

    @Inject
    public IsolationStrategy(ExecutorConfig config, IsolatedWorkerFactory workerFactory)
    {
        this(config.getBuildInSubprocess(), workerFactory);
    }

    public IsolationStrategy(boolean enabled, IsolatedWorkerFactory workerFactory)
    {
        this.enabled = enabled;
        this.workerFactory = workerFactory;
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    public boolean isIsolated(Task task)
    {
        return enabled && task.getSourceKind() == SourceKind.IN_MEMORY_CALLABLE;
    }

    public TaskReport build(Task task, Config params)
    {
        if (!isIsolated(task)) {
            return task.build(params);
        }
        try (IsolatedWorker worker = workerFactory.acquire()) {
            return worker.submit(task, params);
        }
    }
}
