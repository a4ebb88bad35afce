package io.ingestdesk.core.run;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.ingestdesk.core.job.JobDefinitionRegistry;
import io.ingestdesk.core.job.JobStatusService;

public class RunModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(JobDefinitionRegistry.class).in(Scopes.SINGLETON);
        binder.bind(RunService.class).in(Scopes.SINGLETON);
        binder.bind(JobStatusService.class).in(Scopes.SINGLETON);
    }
}
