package io.ingestdesk.core;

import java.time.Duration;
import java.util.Map;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableMap;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableIngestConfig.class)
@JsonDeserialize(as = ImmutableIngestConfig.class)
public interface IngestConfig
{
    String DEFAULT_TIMEZONE = "Europe/Istanbul";
    String DEFAULT_CRON = "0 3 * * *";
    int DEFAULT_STUCK_TTL_SECONDS = 1800;
    int DEFAULT_RUNS_LIMIT = 100;
    int MAX_RUNS_LIMIT = 500;

    String STUCK_TTL_KEY = "ingest.stuck_ttl_seconds";

    String getDefaultTimezone();

    String getDefaultCron();

    int getStuckTtlSeconds();

    // "<marketplace_code>.<job_code>" -> seconds
    Map<String, Integer> getStuckTtlOverrides();

    int getRunsDefaultLimit();

    int getRunsMaxLimit();

    default Duration getStuckTtl(String marketplaceCode, String jobCode)
    {
        Integer seconds = getStuckTtlOverrides().get(marketplaceCode + "." + jobCode);
        return Duration.ofSeconds(seconds != null ? seconds : getStuckTtlSeconds());
    }

    @Value.Check
    default void check()
    {
        if (getStuckTtlSeconds() <= 0) {
            throw new ConfigException(STUCK_TTL_KEY + " must be positive but got " + getStuckTtlSeconds());
        }
        if (getRunsDefaultLimit() < 1 || getRunsDefaultLimit() > getRunsMaxLimit()) {
            throw new ConfigException("ingest.runs.default_limit must be between 1 and " + getRunsMaxLimit());
        }
    }

    static ImmutableIngestConfig.Builder defaultBuilder()
    {
        return ImmutableIngestConfig.builder()
            .defaultTimezone(DEFAULT_TIMEZONE)
            .defaultCron(DEFAULT_CRON)
            .stuckTtlSeconds(DEFAULT_STUCK_TTL_SECONDS)
            .runsDefaultLimit(DEFAULT_RUNS_LIMIT)
            .runsMaxLimit(MAX_RUNS_LIMIT);
    }

    static IngestConfig defaultConfig()
    {
        return defaultBuilder().build();
    }

    static IngestConfig convertFrom(Config config)
    {
        ImmutableMap.Builder<String, Integer> overrides = ImmutableMap.builder();
        String prefix = STUCK_TTL_KEY + ".";
        for (String key : config.getKeys()) {
            if (key.startsWith(prefix)) {
                overrides.put(key.substring(prefix.length()), config.get(key, int.class));
            }
        }
        return defaultBuilder()
            .defaultTimezone(config.get("ingest.default_timezone", String.class, DEFAULT_TIMEZONE))
            .defaultCron(config.get("ingest.default_cron", String.class, DEFAULT_CRON))
            .stuckTtlSeconds(config.get(STUCK_TTL_KEY, int.class, DEFAULT_STUCK_TTL_SECONDS))
            .stuckTtlOverrides(overrides.build())
            .runsDefaultLimit(config.get("ingest.runs.default_limit", int.class, DEFAULT_RUNS_LIMIT))
            .runsMaxLimit(config.get("ingest.runs.max_limit", int.class, MAX_RUNS_LIMIT))
            .build();
    }
}
