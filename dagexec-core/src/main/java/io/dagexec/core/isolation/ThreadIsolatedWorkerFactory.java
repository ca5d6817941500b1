package io.dagexec.core.isolation;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.dagexec.client.config.Config;
import io.dagexec.spi.Task;
import io.dagexec.spi.TaskReport;

import static com.google.common.base.Preconditions.checkState;

/**
 * Builds each task on a new thread that is discarded afterwards.
 *
 * Thread-local state of a task doesn't leak into the next one, but the heap
 * is shared with the caller. Use {@link ProcessIsolatedWorkerFactory} when
 * memory must be returned to the operating system.
 */
public class ThreadIsolatedWorkerFactory
    implements IsolatedWorkerFactory
{
    private final ThreadFactory threadFactory;

    @Inject
    public ThreadIsolatedWorkerFactory()
    {
        this.threadFactory = new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("isolated-build-%d")
            .build();
    }

    @Override
    public IsolationMode getType()
    {
        return IsolationMode.THREAD;
    }

    @Override
    public IsolatedWorker acquire()
    {
        return new ThreadIsolatedWorker(Executors.newSingleThreadExecutor(threadFactory));
    }

    static class ThreadIsolatedWorker
        implements IsolatedWorker
    {
        private final ExecutorService executor;
        private boolean submitted = false;

        ThreadIsolatedWorker(ExecutorService executor)
        {
            this.executor = executor;
        }

        @Override
        public TaskReport submit(Task task, Config params)
        {
            checkState(!submitted, "An isolated worker builds only one task");
            submitted = true;

            Future<TaskReport> future = executor.submit(() -> task.build(params));
            try {
                return future.get();
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while waiting for task " + task.getName(), ex);
            }
            catch (ExecutionException ex) {
                // rethrow what the task threw so that it looks the same as an in-process failure
                Throwable cause = ex.getCause();
                Throwables.throwIfUnchecked(cause);
                throw new RuntimeException(cause);
            }
        }

        boolean isShutdown()
        {
            return executor.isShutdown();
        }

        @Override
        public void close()
        {
            executor.shutdownNow();
        }
    }
}
