package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Service dependency graph aggregated over a time range (epoch microseconds).
 */
public class Dependencies {
    
    @JsonProperty("start_time")
    private final long startTime;
    
    @JsonProperty("end_time")
    private final long endTime;
    
    @JsonProperty("links")
    private final List<DependencyLink> links;
    
    public Dependencies(long startTime, long endTime, List<DependencyLink> links) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }
    
    public static Dependencies empty() {
        return new Dependencies(0L, 0L, List.of());
    }
    
    public long getStartTime() {
        return startTime;
    }
    
    public long getEndTime() {
        return endTime;
    }
    
    public List<DependencyLink> getLinks() {
        return links;
    }
}
