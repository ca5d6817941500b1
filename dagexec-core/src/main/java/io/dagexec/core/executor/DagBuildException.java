package io.dagexec.core.executor;

import java.util.List;
import com.google.common.collect.ImmutableList;

/**
 * Thrown once at the end of a run when at least one task failed.
 */
public class DagBuildException
        extends RuntimeException
{
    static final String MESSAGE_PREFIX = "DAG build failed, the following tasks crashed " +
            "(corresponding downstream tasks aborted execution):\n";

    private final List<FailureRecord> failures;

    public DagBuildException(FailureCollector collector)
    {
        super(MESSAGE_PREFIX + collector.render());
        this.failures = collector.getRecords();
    }

    public List<FailureRecord> getFailures()
    {
        return ImmutableList.copyOf(failures);
    }
}
