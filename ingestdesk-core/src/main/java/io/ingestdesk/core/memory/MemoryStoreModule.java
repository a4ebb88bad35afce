package io.ingestdesk.core.memory;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.ingestdesk.core.run.RunStore;
import io.ingestdesk.core.schedule.ScheduleStore;

public class MemoryStoreModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleStore.class).to(MemoryScheduleStore.class).in(Scopes.SINGLETON);
        binder.bind(RunStore.class).to(MemoryRunStore.class).in(Scopes.SINGLETON);
    }
}
