package io.ingestdesk.core.run;

import io.ingestdesk.core.repository.ResourceNotFoundException;

public interface RunControlStore
{
    StoredRun insertRun(Run run);

    StoredRun getRunById(long runId)
        throws ResourceNotFoundException;

    // replaces every lifecycle attribute of the run with the given one
    void updateRun(StoredRun run)
        throws ResourceNotFoundException;
}
