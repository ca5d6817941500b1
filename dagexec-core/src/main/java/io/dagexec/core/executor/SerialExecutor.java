package io.dagexec.core.executor;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.dagexec.client.config.Config;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.core.isolation.IsolationStrategy;
import io.dagexec.core.log.DagLogSink;
import io.dagexec.core.log.DagLogSink.LogSinkHandle;
import io.dagexec.spi.Dag;
import io.dagexec.spi.ResourceClient;
import io.dagexec.spi.Task;
import io.dagexec.spi.TaskReport;
import io.dagexec.spi.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the tasks of a DAG one at a time, in the order they are given.
 *
 * <p>
 * A failing task doesn't stop the run. Every task that isn't SKIPPED or
 * ABORTED is attempted, failures are collected, and a single
 * {@link DagBuildException} listing all of them is thrown at the end.
 * Deciding which downstream tasks to skip or abort is done before the run
 * and is not changed here.
 * </p>
 *
 * <p>
 * When the run succeeds, the log sink is detached and, if isolation is
 * disabled, the clients of the DAG are closed. When the run fails, neither
 * happens.
 * </p>
 */
public class SerialExecutor
    implements DagExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(SerialExecutor.class);

    private final ExecutorConfig config;
    private final IsolationStrategy isolation;
    private final DagLogSink logSink;
    private final ProgressReporter progressReporter;

    @Inject
    public SerialExecutor(ExecutorConfig config, IsolationStrategy isolation,
            DagLogSink logSink, ProgressReporter progressReporter)
    {
        this.config = config;
        this.isolation = isolation;
        this.logSink = logSink;
        this.progressReporter = progressReporter;
    }

    @Override
    public List<TaskReport> execute(Dag dag, boolean showProgress, Config taskParams)
    {
        Optional<LogSinkHandle> sink = attachLogSink(dag);

        ProgressReporter progress = showProgress ? progressReporter : ProgressReporter.empty();
        FailureCollector failures = new FailureCollector();
        List<TaskReport> reports = new ArrayList<>();

        List<Task> tasks = dag.getTasks();
        logger.debug("Starting serial build of {} with {} tasks (isolation: {})",
                dag.getName(), tasks.size(), isolation.isEnabled());
        progress.start(dag.getName(), tasks.size());

        int position = 0;
        for (Task task : tasks) {
            position++;
            if (task.getStatus().isTerminalAtEntry()) {
                logger.debug("Skipping task {} ({})", task.getName(), task.getStatus());
                continue;
            }

            progress.building(task.getName(), position, tasks.size());

            TaskReport report;
            try {
                report = isolation.build(task, taskParams);
            }
            catch (Exception | AssertionError ex) {
                logger.error("Task {} failed: {}", task.getName(), ex.toString());
                failures.append(Traces.describe(task), Traces.format(ex));
                setStatusOrRecord(task, TaskStatus.ERRORED, failures);
                continue;
            }

            logger.debug("Task {} finished in {} ms", task.getName(), report.getElapsedMillis());
            setStatusOrRecord(task, TaskStatus.EXECUTED, failures);
            reports.add(report);
        }

        progress.finish();

        if (!failures.isEmpty()) {
            logger.error("Build of {} failed: {} task(s) crashed", dag.getName(), failures.size());
            // the log sink stays attached and clients stay open on this path
            throw new DagBuildException(failures);
        }

        if (sink.isPresent()) {
            sink.get().detach();
        }

        // isolated builds release their resources when their worker exits
        if (!config.getBuildInSubprocess()) {
            closeClients(dag);
        }

        logger.info("Built {} task(s) of {}", reports.size(), dag.getName());
        return ImmutableList.copyOf(reports);
    }

    private Optional<LogSinkHandle> attachLogSink(Dag dag)
    {
        if (!config.getLoggingDirectory().isPresent()) {
            return Optional.absent();
        }
        return Optional.of(logSink.attach(dag.getName(),
                    Paths.get(config.getLoggingDirectory().get()),
                    config.getLoggingLevel()));
    }

    // a failing status change is recorded like a failing build; the run continues
    private static void setStatusOrRecord(Task task, TaskStatus status, FailureCollector failures)
    {
        try {
            task.setStatus(status);
        }
        catch (Exception | AssertionError ex) {
            logger.error("Failed to set status of task {} to {}: {}", task.getName(), status, ex.toString());
            failures.append(Traces.describe(task), Traces.format(ex));
        }
    }

    private static void closeClients(Dag dag)
    {
        RuntimeException first = null;
        for (Map.Entry<String, ResourceClient> client : dag.getClients().entrySet()) {
            logger.debug("Closing client {} of {}", client.getKey(), dag.getName());
            try {
                client.getValue().close();
            }
            catch (RuntimeException ex) {
                if (first == null) {
                    first = ex;
                }
                else {
                    first.addSuppressed(ex);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
