package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A timestamped event recorded on a span, such as "cs" or "sr".
 */
public class Annotation {
    
    @JsonProperty("timestamp")
    private final long timestamp;
    
    @JsonProperty("value")
    private final String value;
    
    @JsonProperty("host")
    private final Endpoint host;
    
    @JsonProperty("duration")
    private final Integer duration;
    
    public Annotation(long timestamp, String value, Endpoint host) {
        this(timestamp, value, host, null);
    }
    
    public Annotation(long timestamp, String value, Endpoint host, Integer duration) {
        this.timestamp = timestamp;
        this.value = value;
        this.host = host;
        this.duration = duration;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    public String getValue() {
        return value;
    }
    
    /**
     * @return the recording endpoint, or null when the annotation carries none
     */
    public Endpoint getHost() {
        return host;
    }
    
    public Integer getDuration() {
        return duration;
    }
    
    @JsonIgnore
    public String getServiceName() {
        return host != null ? host.getServiceName() : null;
    }
    
    /**
     * Copy of this annotation at a different timestamp.
     */
    public Annotation withTimestamp(long newTimestamp) {
        return new Annotation(newTimestamp, value, host, duration);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Annotation)) return false;
        Annotation that = (Annotation) o;
        return timestamp == that.timestamp
            && Objects.equals(value, that.value)
            && Objects.equals(host, that.host)
            && Objects.equals(duration, that.duration);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, host, duration);
    }
    
    @Override
    public String toString() {
        return "Annotation{timestamp=" + timestamp + ", value='" + value + "', host=" + host + '}';
    }
}
