package io.ingestdesk.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.util.Modules;
import io.ingestdesk.client.api.JacksonTimeModule;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigFactory;
import io.ingestdesk.core.api.IngestResource;
import io.ingestdesk.core.config.ConfigModule;
import io.ingestdesk.core.config.PropertyUtils;
import io.ingestdesk.core.memory.MemoryStoreModule;
import io.ingestdesk.core.run.RunModule;
import io.ingestdesk.core.schedule.ScheduleModule;

public class IngestdeskEmbed
{
    public static class Bootstrap
    {
        private final List<Module> overridingModules = new ArrayList<>();
        private Properties systemProperties = new Properties();
        private Clock clock = Clock.systemUTC();

        /**
         * Replaces bindings of the standard modules, for example to plug
         * in a persistent store in place of the in-memory one.
         */
        public Bootstrap overrideModulesWith(Module... modules)
        {
            overridingModules.addAll(Arrays.asList(modules));
            return this;
        }

        public Bootstrap setSystemProperties(Properties systemProperties)
        {
            this.systemProperties = systemProperties;
            return this;
        }

        public Bootstrap setClock(Clock clock)
        {
            this.clock = clock;
            return this;
        }

        public IngestdeskEmbed initialize()
        {
            Module modules = Modules.override(standardModules()).with(overridingModules);
            return new IngestdeskEmbed(Guice.createInjector(modules));
        }

        private List<Module> standardModules()
        {
            final Properties props = systemProperties;
            final Clock systemClock = clock;
            return ImmutableList.of(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JacksonTimeModule()),
                    new ConfigModule(),
                    new ScheduleModule(),
                    new RunModule(),
                    new MemoryStoreModule(),
                    (binder) -> {
                        binder.bind(Properties.class).toInstance(props);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                        binder.bind(Clock.class).toInstance(systemClock);
                        binder.bind(IngestResource.class);
                    });
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(Properties props, ConfigFactory cf)
        {
            this.systemConfig = PropertyUtils.toConfig(props, cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;

    IngestdeskEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public IngestResource getResource()
    {
        return injector.getInstance(IngestResource.class);
    }
}
