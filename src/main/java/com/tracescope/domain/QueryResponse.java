package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trace ids matching a search, with the time range the matches span.
 */
public class QueryResponse {
    
    @JsonProperty("trace_ids")
    private final List<Long> traceIds;
    
    @JsonProperty("start_ts")
    private final long startTs;
    
    @JsonProperty("end_ts")
    private final long endTs;
    
    public QueryResponse(List<Long> traceIds, long startTs, long endTs) {
        this.traceIds = Collections.unmodifiableList(new ArrayList<>(traceIds));
        this.startTs = startTs;
        this.endTs = endTs;
    }
    
    /**
     * Build a response from index hits, keeping their order.
     * The time range is 0..0 when there are no hits.
     */
    public static QueryResponse of(List<IndexedTraceId> ids) {
        List<Long> traceIds = new ArrayList<>(ids.size());
        long start = Long.MAX_VALUE;
        long end = Long.MIN_VALUE;
        for (IndexedTraceId id : ids) {
            traceIds.add(id.getTraceId());
            start = Math.min(start, id.getTimestamp());
            end = Math.max(end, id.getTimestamp());
        }
        if (ids.isEmpty()) {
            start = 0L;
            end = 0L;
        }
        return new QueryResponse(traceIds, start, end);
    }
    
    public List<Long> getTraceIds() {
        return traceIds;
    }
    
    public long getStartTs() {
        return startTs;
    }
    
    public long getEndTs() {
        return endTs;
    }
}
