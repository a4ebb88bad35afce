package io.ingestdesk.core.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.run.IllegalRunTransitionException;
import io.ingestdesk.core.run.ImmutableStoredRun;
import io.ingestdesk.core.run.Run;
import io.ingestdesk.core.run.RunControlStore;
import io.ingestdesk.core.run.RunFilter;
import io.ingestdesk.core.run.RunStatus;
import io.ingestdesk.core.run.RunStore;
import io.ingestdesk.core.run.StoredRun;

/**
 * Run store kept in process memory. A single monitor guards every run, which
 * makes {@link #lockJob} exclusive across jobs as well.
 */
public class MemoryRunStore
        implements RunStore
{
    static final Comparator<StoredRun> NEWEST_FIRST = Comparator
        .comparing((StoredRun run) -> run.getStartedAt().orNull(), Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(StoredRun::getCreatedAt, Comparator.reverseOrder())
        .thenComparing(StoredRun::getId, Comparator.reverseOrder());

    private final Clock clock;
    private final Map<Long, StoredRun> runs = new HashMap<>();
    private long lastId = 0L;

    @Inject
    public MemoryRunStore(Clock clock)
    {
        this.clock = clock;
    }

    @Override
    public synchronized List<StoredRun> getRuns(long projectId, RunFilter filter, int limit)
    {
        return runs.values().stream()
            .filter(run -> run.getProjectId() == projectId)
            .filter(filter::matches)
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized StoredRun getRunById(long projectId, long runId)
        throws ResourceNotFoundException
    {
        StoredRun run = runs.get(runId);
        if (run == null || run.getProjectId() != projectId) {
            throw new ResourceNotFoundException(String.format("run id=%d", runId));
        }
        return run;
    }

    @Override
    public synchronized Optional<StoredRun> getActiveRun(long projectId, String marketplaceCode, String jobCode)
    {
        return Optional.fromJavaUtil(runsOfJob(projectId, marketplaceCode, jobCode)
                .filter(StoredRun::isActive)
                .min(Comparator.comparing(StoredRun::getCreatedAt)));
    }

    @Override
    public synchronized Optional<StoredRun> getLastRun(long projectId, String marketplaceCode, String jobCode)
    {
        return Optional.fromJavaUtil(runsOfJob(projectId, marketplaceCode, jobCode)
                .sorted(NEWEST_FIRST)
                .findFirst());
    }

    private Stream<StoredRun> runsOfJob(long projectId, String marketplaceCode, String jobCode)
    {
        return runs.values().stream()
            .filter(run -> run.getProjectId() == projectId)
            .filter(run -> run.getMarketplaceCode().equals(marketplaceCode) && run.getJobCode().equals(jobCode));
    }

    @Override
    public synchronized <T> T lockRunById(long projectId, long runId, RunLockAction<T> func)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        StoredRun run = getRunById(projectId, runId);
        return func.call(new MemoryRunControlStore(), run);
    }

    @Override
    public synchronized <T> T lockJob(long projectId, String marketplaceCode, String jobCode, JobLockAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException, IllegalRunTransitionException
    {
        return func.call(new MemoryRunControlStore(), getActiveRun(projectId, marketplaceCode, jobCode));
    }

    private class MemoryRunControlStore
            implements RunControlStore
    {
        @Override
        public StoredRun insertRun(Run run)
        {
            synchronized (MemoryRunStore.this) {
                Instant now = clock.instant();
                StoredRun stored = ImmutableStoredRun.builder()
                    .from(run)
                    .id(++lastId)
                    .status(RunStatus.QUEUED)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
                runs.put(stored.getId(), stored);
                return stored;
            }
        }

        @Override
        public StoredRun getRunById(long runId)
            throws ResourceNotFoundException
        {
            synchronized (MemoryRunStore.this) {
                StoredRun run = runs.get(runId);
                if (run == null) {
                    throw new ResourceNotFoundException(String.format("run id=%d", runId));
                }
                return run;
            }
        }

        @Override
        public void updateRun(StoredRun run)
            throws ResourceNotFoundException
        {
            synchronized (MemoryRunStore.this) {
                StoredRun current = getRunById(run.getId());
                // identity and creation time are owned by the store
                runs.put(run.getId(), ImmutableStoredRun.builder()
                        .from(run)
                        .projectId(current.getProjectId())
                        .createdAt(current.getCreatedAt())
                        .build());
            }
        }
    }
}
