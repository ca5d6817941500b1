package io.dagexec.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressReporter
    implements ProgressReporter
{
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressReporter.class);

    private String dagName;

    @Override
    public void start(String dagName, int total)
    {
        this.dagName = dagName;
        logger.info("Building {} tasks of {}", total, dagName);
    }

    @Override
    public void building(String taskName, int position, int total)
    {
        logger.info("Building task \"{}\" ({}/{})", taskName, position, total);
    }

    @Override
    public void finish()
    {
        logger.info("Finished building {}", dagName);
    }
}
