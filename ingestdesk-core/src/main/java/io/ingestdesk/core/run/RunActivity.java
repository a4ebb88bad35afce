package io.ingestdesk.core.run;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;

/**
 * Liveness and timing of runs as shown in run lists.
 */
public class RunActivity
{
    private RunActivity()
    { }

    /**
     * heartbeat_at if the executor has sent one, otherwise updated_at.
     */
    public static Instant lastActivity(StoredRun run)
    {
        return run.getHeartbeatAt().or(run.getUpdatedAt());
    }

    /**
     * Whole minutes between the two instants, rounded down. "just now" under
     * a minute, "1 min ago" for one minute, "{n} min ago" otherwise.
     */
    public static String formatRelativeAge(Instant at, Instant now)
    {
        long minutes = Math.max(0L, Duration.between(at, now).getSeconds() / 60);
        if (minutes < 1) {
            return "just now";
        }
        else if (minutes == 1) {
            return "1 min ago";
        }
        else {
            return minutes + " min ago";
        }
    }

    public static String formatLastActivity(StoredRun run, Instant now)
    {
        return formatRelativeAge(lastActivity(run), now);
    }

    public static String formatDuration(Optional<Long> durationMs)
    {
        if (!durationMs.isPresent() || durationMs.get() <= 0) {
            return "-";
        }
        long seconds = Math.round(durationMs.get() / 1000.0);
        if (seconds < 60) {
            return seconds + " sec";
        }
        return (seconds / 60) + " min " + (seconds % 60) + " sec";
    }

    /**
     * An active run is stuck when nothing was heard from it for longer than
     * the ttl. Terminal runs are never stuck.
     */
    public static boolean isStuck(StoredRun run, Instant now, Duration ttl)
    {
        if (!run.isActive()) {
            return false;
        }
        return Duration.between(lastActivity(run), now).compareTo(ttl) > 0;
    }
}
