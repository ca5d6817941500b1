package io.dagexec.core.isolation;

import com.google.common.base.Optional;

/**
 * A failure raised by task logic running in another JVM.
 *
 * The stack trace of this exception points to the parent process. The trace
 * of the original failure is kept as text in {@link #getRemoteTrace()}.
 */
public class IsolatedBuildException
        extends RuntimeException
{
    private final String remoteClassName;
    private final Optional<String> remoteMessage;
    private final String remoteTrace;

    public IsolatedBuildException(String remoteClassName, Optional<String> remoteMessage, String remoteTrace)
    {
        super(remoteMessage.isPresent() ? remoteClassName + ": " + remoteMessage.get() : remoteClassName);
        this.remoteClassName = remoteClassName;
        this.remoteMessage = remoteMessage;
        this.remoteTrace = remoteTrace;
    }

    public String getRemoteClassName()
    {
        return remoteClassName;
    }

    public Optional<String> getRemoteMessage()
    {
        return remoteMessage;
    }

    public String getRemoteTrace()
    {
        return remoteTrace;
    }
}
