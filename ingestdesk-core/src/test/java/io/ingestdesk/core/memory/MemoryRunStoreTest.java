package io.ingestdesk.core.memory;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.core.IngestTestingUtils.TestingClock;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.run.ImmutableStoredRun;
import io.ingestdesk.core.run.Run;
import io.ingestdesk.core.run.RunStatus;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.run.TriggerSource;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MemoryRunStoreTest
{
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private TestingClock clock;
    private MemoryRunStore store;

    @Before
    public void setUp()
    {
        clock = new TestingClock(NOW);
        store = new MemoryRunStore(clock);
    }

    @Test
    public void activeAndLastRun()
            throws Exception
    {
        StoredRun first = insert(1, "stocks");
        clock.advance(Duration.ofMinutes(1));
        StoredRun second = insert(1, "stocks");

        assertThat(store.getActiveRun(1, "wildberries", "stocks"), is(Optional.of(first)));
        assertThat(store.getLastRun(1, "wildberries", "stocks"), is(Optional.of(second)));
        assertThat(store.getActiveRun(1, "wildberries", "prices").isPresent(), is(false));
        assertThat(store.getLastRun(2, "wildberries", "stocks").isPresent(), is(false));
    }

    @Test
    public void lockJobSeesActiveRun()
            throws Exception
    {
        StoredRun first = insert(1, "stocks");
        Optional<StoredRun> seen = store.lockJob(1, "wildberries", "stocks", (controlStore, active) -> active);
        assertThat(seen, is(Optional.of(first)));
    }

    @Test
    public void updateKeepsIdentity()
            throws Exception
    {
        StoredRun run = insert(1, "stocks");
        clock.advance(Duration.ofMinutes(1));
        Instant later = clock.instant();

        store.lockRunById(1, run.getId(), (controlStore, storedRun) -> {
            controlStore.updateRun(ImmutableStoredRun.builder()
                    .from(storedRun)
                    .projectId(99)
                    .createdAt(later)
                    .status(RunStatus.RUNNING)
                    .startedAt(later)
                    .updatedAt(later)
                    .build());
            return true;
        });

        StoredRun updated = store.getRunById(1, run.getId());
        assertThat(updated.getStatus(), is(RunStatus.RUNNING));
        assertThat(updated.getProjectId(), is(1L));
        assertThat(updated.getCreatedAt(), is(NOW));
        assertThat(updated.getUpdatedAt(), is(later));
    }

    @Test(expected = ResourceNotFoundException.class)
    public void runOfAnotherProjectIsNotFound()
            throws Exception
    {
        StoredRun run = insert(1, "stocks");
        store.getRunById(2, run.getId());
    }

    private StoredRun insert(long projectId, String jobCode)
            throws Exception
    {
        return store.lockJob(projectId, "wildberries", jobCode, (controlStore, active) ->
                controlStore.insertRun(Run.builder()
                    .projectId(projectId)
                    .marketplaceCode("wildberries")
                    .jobCode(jobCode)
                    .triggeredBy(TriggerSource.API)
                    .build()));
    }
}
