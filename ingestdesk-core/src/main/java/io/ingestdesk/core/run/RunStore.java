package io.ingestdesk.core.run;

import java.util.List;
import com.google.common.base.Optional;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;

public interface RunStore
{
    /**
     * Returns runs matching the filter, newest first: started_at descending
     * with runs that never started last, then created_at descending.
     */
    List<StoredRun> getRuns(long projectId, RunFilter filter, int limit);

    StoredRun getRunById(long projectId, long runId)
        throws ResourceNotFoundException;

    Optional<StoredRun> getActiveRun(long projectId, String marketplaceCode, String jobCode);

    Optional<StoredRun> getLastRun(long projectId, String marketplaceCode, String jobCode);

    interface RunLockAction <T>
    {
        T call(RunControlStore store, StoredRun storedRun)
            throws ResourceNotFoundException, IllegalRunTransitionException;
    }

    <T> T lockRunById(long projectId, long runId, RunLockAction<T> func)
        throws ResourceNotFoundException, IllegalRunTransitionException;

    interface JobLockAction <T>
    {
        T call(RunControlStore store, Optional<StoredRun> activeRun)
            throws ResourceNotFoundException, ResourceConflictException, IllegalRunTransitionException;
    }

    /**
     * Runs the action while no other caller can create or update runs of the
     * same job. Used to keep at most one active run per job.
     */
    <T> T lockJob(long projectId, String marketplaceCode, String jobCode, JobLockAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException, IllegalRunTransitionException;
}
