package com.tracescope.domain;

import java.util.Objects;

/**
 * One hit from a trace id index: the trace matched the index predicate at
 * the given time (epoch microseconds).
 */
public class IndexedTraceId {
    
    private final long traceId;
    private final long timestamp;
    
    public IndexedTraceId(long traceId, long timestamp) {
        this.traceId = traceId;
        this.timestamp = timestamp;
    }
    
    public long getTraceId() {
        return traceId;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexedTraceId)) return false;
        IndexedTraceId that = (IndexedTraceId) o;
        return traceId == that.traceId && timestamp == that.timestamp;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(traceId, timestamp);
    }
    
    @Override
    public String toString() {
        return "IndexedTraceId{traceId=" + traceId + ", timestamp=" + timestamp + '}';
    }
}
