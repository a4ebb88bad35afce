package io.ingestdesk.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleTranslator.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleService.class).in(Scopes.SINGLETON);
    }
}
