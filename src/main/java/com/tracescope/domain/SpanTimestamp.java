package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Start and end of one span as seen by one service.
 */
public class SpanTimestamp {
    
    @JsonProperty("name")
    private final String name;
    
    @JsonProperty("start_timestamp")
    private final long startTimestamp;
    
    @JsonProperty("end_timestamp")
    private final long endTimestamp;
    
    public SpanTimestamp(String name, long startTimestamp, long endTimestamp) {
        this.name = name;
        this.startTimestamp = startTimestamp;
        this.endTimestamp = endTimestamp;
    }
    
    public String getName() {
        return name;
    }
    
    public long getStartTimestamp() {
        return startTimestamp;
    }
    
    public long getEndTimestamp() {
        return endTimestamp;
    }
    
    public long getDuration() {
        return endTimestamp - startTimestamp;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpanTimestamp)) return false;
        SpanTimestamp that = (SpanTimestamp) o;
        return startTimestamp == that.startTimestamp
            && endTimestamp == that.endTimestamp
            && Objects.equals(name, that.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, startTimestamp, endTimestamp);
    }
}
