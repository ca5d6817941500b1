package io.dagexec.core;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.dagexec.client.config.ConfigFactory;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.core.executor.DagExecutor;
import io.dagexec.core.executor.LoggingProgressReporter;
import io.dagexec.core.executor.ProgressReporter;
import io.dagexec.core.executor.SerialExecutor;
import io.dagexec.core.isolation.IsolatedWorkerFactory;
import io.dagexec.core.isolation.IsolatedWorkerFactoryProvider;
import io.dagexec.core.isolation.IsolationStrategy;
import io.dagexec.core.isolation.ProcessIsolatedWorkerFactory;
import io.dagexec.core.isolation.ThreadIsolatedWorkerFactory;
import io.dagexec.core.log.DagLogSink;
import io.dagexec.core.log.LogbackFileLogSink;

public class ExecutorModule
    implements Module
{
    private final ExecutorConfig config;

    public ExecutorModule(ExecutorConfig config)
    {
        this.config = config;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(ExecutorConfig.class).toInstance(config);

        Multibinder<IsolatedWorkerFactory> workerFactoryBinder = Multibinder.newSetBinder(binder, IsolatedWorkerFactory.class);
        workerFactoryBinder.addBinding().to(ProcessIsolatedWorkerFactory.class).in(Scopes.SINGLETON);
        workerFactoryBinder.addBinding().to(ThreadIsolatedWorkerFactory.class).in(Scopes.SINGLETON);
        binder.bind(IsolatedWorkerFactory.class).toProvider(IsolatedWorkerFactoryProvider.class).in(Scopes.SINGLETON);

        binder.bind(IsolationStrategy.class).in(Scopes.SINGLETON);
        binder.bind(DagLogSink.class).to(LogbackFileLogSink.class).in(Scopes.SINGLETON);
        binder.bind(ProgressReporter.class).to(LoggingProgressReporter.class);
        binder.bind(DagExecutor.class).to(SerialExecutor.class);
    }
}
