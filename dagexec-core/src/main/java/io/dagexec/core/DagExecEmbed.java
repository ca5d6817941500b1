package io.dagexec.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import io.dagexec.client.ObjectMappers;
import io.dagexec.client.config.Config;
import io.dagexec.client.config.ConfigFactory;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.core.config.PropertyUtils;
import io.dagexec.core.executor.DagExecutor;

public class DagExecEmbed
{
    public static class Bootstrap
    {
        private final List<Module> modules = new ArrayList<>();
        private Properties systemProps = new Properties();

        public Bootstrap setSystemConfig(Properties props)
        {
            this.systemProps = props;
            return this;
        }

        public Bootstrap addModules(Module... additional)
        {
            modules.addAll(ImmutableList.copyOf(additional));
            return this;
        }

        public DagExecEmbed initialize()
        {
            Config systemConfig = PropertyUtils.toConfig(new ConfigFactory(ObjectMappers.objectMapper()), systemProps);
            ImmutableList<Module> all = ImmutableList.<Module>builder()
                .add(new ObjectMapperModule().registerModule(new GuavaModule()))
                .add(new ExecutorModule(ExecutorConfig.convertFrom(systemConfig)))
                .addAll(modules)
                .build();
            return new DagExecEmbed(Guice.createInjector(all));
        }
    }

    private final Injector injector;

    DagExecEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public DagExecutor getExecutor()
    {
        return injector.getInstance(DagExecutor.class);
    }
}
