package io.ingestdesk.core.run;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigFactory;
import io.ingestdesk.core.repository.ResourceNotFoundException;

/**
 * Lifecycle transitions of a single run.
 *
 * Every transition is checked against {@link RunStatus#canTransitionTo(RunStatus)}
 * before anything is written, so a rejected transition leaves the stored
 * run as it was.
 */
public class RunControl
{
    public static final int MAX_ERROR_MESSAGE_LENGTH = 500;
    public static final int MAX_ERROR_TRACE_LENGTH = 50000;

    private final RunControlStore store;
    private final ConfigFactory cf;
    private StoredRun run;

    public RunControl(RunControlStore store, ConfigFactory cf, StoredRun run)
    {
        this.store = store;
        this.cf = cf;
        this.run = run;
    }

    public StoredRun get()
    {
        return run;
    }

    public StoredRun start(Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        checkTransition(RunStatus.RUNNING);
        return save(ImmutableStoredRun.builder()
                .from(run)
                .status(RunStatus.RUNNING)
                .startedAt(now)
                .updatedAt(now)
                .build());
    }

    /**
     * Records a liveness signal. Ignored unless the run is running.
     */
    public boolean heartbeat(Instant now)
        throws ResourceNotFoundException
    {
        if (run.getStatus() != RunStatus.RUNNING) {
            return false;
        }
        save(ImmutableStoredRun.builder()
                .from(run)
                .heartbeatAt(now)
                .updatedAt(now)
                .build());
        return true;
    }

    /**
     * Replaces the progress stats. Ignored unless the run is running.
     */
    public boolean reportProgress(Config stats, Instant now)
        throws ResourceNotFoundException
    {
        if (run.getStatus() != RunStatus.RUNNING) {
            return false;
        }
        save(ImmutableStoredRun.builder()
                .from(run)
                .stats(stats.deepCopy())
                .heartbeatAt(now)
                .updatedAt(now)
                .build());
        return true;
    }

    public StoredRun finishSuccess(Optional<Config> stats, Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        checkRunning(RunStatus.SUCCESS);
        ImmutableStoredRun.Builder builder = finishBuilder(RunStatus.SUCCESS, now);
        if (stats.isPresent()) {
            builder.stats(stats.get().deepCopy());
        }
        return save(builder.build());
    }

    public StoredRun finishFailed(String errorMessage, Optional<String> errorTrace, Optional<Config> stats, Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        checkRunning(RunStatus.FAILED);
        ImmutableStoredRun.Builder builder = finishBuilder(RunStatus.FAILED, now)
            .errorMessage(truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH))
            .errorTrace(errorTrace.transform(trace -> truncate(trace, MAX_ERROR_TRACE_LENGTH)));
        if (stats.isPresent()) {
            builder.stats(stats.get().deepCopy());
        }
        return save(builder.build());
    }

    /**
     * Administrative termination of an active run. Nothing tells the worker
     * to stop, so the underlying task may keep running after this.
     */
    public StoredRun markTimeout(String reasonCode, String reasonText, String actor, Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return markSystemAction(RunStatus.TIMEOUT, "timeout", reasonCode, reasonText, actor, now);
    }

    public StoredRun markSkipped(String reasonCode, String reasonText, String actor, Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return markSystemAction(RunStatus.SKIPPED, "skipped", reasonCode, reasonText, actor, now);
    }

    private StoredRun markSystemAction(RunStatus status, String type, String reasonCode, String reasonText, String actor, Instant now)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        checkTransition(status);

        Config meta = run.getMeta().transform(Config::deepCopy).or(cf.create());
        meta.set("system_action", ImmutableMap.of(
                    "type", type,
                    "reason_code", reasonCode,
                    "actor", actor,
                    "at", now.toString()));

        return save(finishBuilder(status, now)
                .errorMessage(truncate(reasonText, MAX_ERROR_MESSAGE_LENGTH))
                .meta(meta)
                .build());
    }

    private ImmutableStoredRun.Builder finishBuilder(RunStatus status, Instant now)
    {
        ImmutableStoredRun.Builder builder = ImmutableStoredRun.builder()
            .from(run)
            .status(status)
            .finishedAt(now)
            .updatedAt(now);
        if (run.getStartedAt().isPresent()) {
            long ms = Duration.between(run.getStartedAt().get(), now).toMillis();
            builder.durationMs(Math.max(0L, ms));
        }
        else {
            // finished straight from queued
            builder.startedAt(now);
        }
        return builder;
    }

    private void checkTransition(RunStatus next)
        throws IllegalRunTransitionException
    {
        if (!run.getStatus().canTransitionTo(next)) {
            throw new IllegalRunTransitionException(run.getId(), run.getStatus(), next);
        }
    }

    // executors can only finish runs they have started
    private void checkRunning(RunStatus next)
        throws IllegalRunTransitionException
    {
        if (run.getStatus() != RunStatus.RUNNING) {
            throw new IllegalRunTransitionException(run.getId(), run.getStatus(), next);
        }
    }

    private StoredRun save(StoredRun updated)
        throws ResourceNotFoundException
    {
        store.updateRun(updated);
        run = store.getRunById(run.getId());
        return run;
    }

    static String truncate(String text, int maxLength)
    {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
