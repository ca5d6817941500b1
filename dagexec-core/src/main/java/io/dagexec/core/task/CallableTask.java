package io.dagexec.core.task;

import java.util.concurrent.TimeUnit;
import com.google.common.base.Optional;
import com.google.common.base.Stopwatch;
import io.dagexec.client.config.Config;
import io.dagexec.spi.SourceKind;
import io.dagexec.spi.TaskCallable;
import io.dagexec.spi.TaskReport;
import io.dagexec.spi.TaskStatus;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A task whose logic is a {@link TaskCallable} held in memory.
 *
 * {@link #build(Config)} is final: when the task is built in another JVM only
 * the callable is sent there, so all of the build logic has to live in it.
 */
public class CallableTask
    extends AbstractTask
{
    private final TaskCallable callable;
    private final Optional<FinishHook> onFinish;

    public CallableTask(String name, TaskCallable callable)
    {
        this(name, callable, TaskStatus.WAITING, Optional.absent());
    }

    public CallableTask(String name, TaskCallable callable, TaskStatus entryStatus, Optional<FinishHook> onFinish)
    {
        super(name, entryStatus);
        this.callable = checkNotNull(callable, "callable");
        this.onFinish = onFinish;
    }

    public TaskCallable getCallable()
    {
        return callable;
    }

    @Override
    public SourceKind getSourceKind()
    {
        return SourceKind.IN_MEMORY_CALLABLE;
    }

    @Override
    public final TaskReport build(Config params)
    {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Config output = callable.call(getName(), params);
        if (output == null) {
            output = params.getFactory().create();
        }
        return TaskReport.builder()
            .taskName(getName())
            .ran(true)
            .elapsedMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
            .output(output)
            .build();
    }

    @Override
    protected void onStatusChanged(TaskStatus previous, TaskStatus next)
    {
        if (next == TaskStatus.EXECUTED && onFinish.isPresent()) {
            onFinish.get().onFinish(this);
        }
    }
}
