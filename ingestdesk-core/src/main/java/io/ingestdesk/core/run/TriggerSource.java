package io.ingestdesk.core.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.ingestdesk.client.config.ConfigException;

public enum TriggerSource
{
    SCHEDULE("schedule"),
    MANUAL("manual"),
    API("api");

    private final String name;

    TriggerSource(String name)
    {
        this.name = name;
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    @JsonCreator
    public static TriggerSource fromName(String name)
    {
        for (TriggerSource source : values()) {
            if (source.name.equals(name)) {
                return source;
            }
        }
        throw new ConfigException("Unknown trigger source: " + name);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
