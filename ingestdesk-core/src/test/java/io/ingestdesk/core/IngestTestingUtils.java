package io.ingestdesk.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigFactory;

import static io.ingestdesk.client.ObjectMappers.objectMapper;

public class IngestTestingUtils
{
    private IngestTestingUtils()
    { }

    public static final ConfigFactory configFactory = new ConfigFactory(objectMapper());

    public static Config newConfig()
    {
        return configFactory.create();
    }

    public static Config loadJson(String json)
    {
        return configFactory.fromJsonString(json);
    }

    /**
     * Clock that only moves when told to.
     */
    public static class TestingClock
            extends Clock
    {
        private Instant now;

        public TestingClock(Instant now)
        {
            this.now = now;
        }

        public void advance(Duration duration)
        {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone()
        {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone)
        {
            return this;
        }

        @Override
        public Instant instant()
        {
            return now;
        }
    }
}
