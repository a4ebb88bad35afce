package io.ingestdesk.core.config;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.ingestdesk.client.config.ConfigFactory;
import io.ingestdesk.core.IngestConfig;
import io.ingestdesk.core.IngestConfigProvider;

public class ConfigModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(IngestConfig.class).toProvider(IngestConfigProvider.class).in(Scopes.SINGLETON);
    }
}
