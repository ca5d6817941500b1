package io.dagexec.core.isolation;

import java.util.Set;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.dagexec.client.config.ConfigException;
import io.dagexec.core.config.ExecutorConfig;

public class IsolatedWorkerFactoryProvider
        implements Provider<IsolatedWorkerFactory>
{
    private final IsolatedWorkerFactory factory;

    @Inject
    public IsolatedWorkerFactoryProvider(Set<IsolatedWorkerFactory> injectedFactories, ExecutorConfig config)
    {
        IsolationMode mode = config.getIsolationMode();
        this.factory = injectedFactories.stream()
                .filter(candidate -> candidate.getType() == mode)
                .findFirst()
                .orElseThrow(() -> new ConfigException("Configured isolation mode is not available: " + mode.getType()));
    }

    @Override
    public IsolatedWorkerFactory get()
    {
        return factory;
    }
}
