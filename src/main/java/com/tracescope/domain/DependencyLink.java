package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Aggregated calls from one service to another.
 */
public class DependencyLink {
    
    @JsonProperty("parent")
    private final String parent;
    
    @JsonProperty("child")
    private final String child;
    
    @JsonProperty("call_count")
    private final long callCount;
    
    public DependencyLink(String parent, String child, long callCount) {
        this.parent = parent;
        this.child = child;
        this.callCount = callCount;
    }
    
    public String getParent() {
        return parent;
    }
    
    public String getChild() {
        return child;
    }
    
    public long getCallCount() {
        return callCount;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyLink)) return false;
        DependencyLink that = (DependencyLink) o;
        return callCount == that.callCount
            && Objects.equals(parent, that.parent)
            && Objects.equals(child, that.child);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(parent, child, callCount);
    }
}
