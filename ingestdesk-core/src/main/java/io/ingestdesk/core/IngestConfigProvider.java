package io.ingestdesk.core;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.ingestdesk.client.config.Config;

public class IngestConfigProvider
    implements Provider<IngestConfig>
{
    private final IngestConfig config;

    @Inject
    public IngestConfigProvider(Config systemConfig)
    {
        this.config = IngestConfig.convertFrom(systemConfig);
    }

    @Override
    public IngestConfig get()
    {
        return config;
    }
}
