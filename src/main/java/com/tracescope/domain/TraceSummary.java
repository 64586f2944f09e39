package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Condensed view of a trace used by search result listings.
 */
public class TraceSummary {
    
    @JsonProperty("trace_id")
    private final long traceId;
    
    @JsonProperty("start_timestamp")
    private final long startTimestamp;
    
    @JsonProperty("end_timestamp")
    private final long endTimestamp;
    
    @JsonProperty("duration_micro")
    private final long durationMicro;
    
    @JsonProperty("span_timestamps")
    private final List<SpanTimestamp> spanTimestamps;
    
    @JsonProperty("endpoints")
    private final List<Endpoint> endpoints;
    
    public TraceSummary(long traceId, long startTimestamp, long endTimestamp,
                        List<SpanTimestamp> spanTimestamps, List<Endpoint> endpoints) {
        this.traceId = traceId;
        this.startTimestamp = startTimestamp;
        this.endTimestamp = endTimestamp;
        this.durationMicro = endTimestamp - startTimestamp;
        this.spanTimestamps = Collections.unmodifiableList(new ArrayList<>(spanTimestamps));
        this.endpoints = Collections.unmodifiableList(new ArrayList<>(endpoints));
    }
    
    /**
     * Summarize a trace. A trace without spans or without any annotation
     * timestamps has nothing to summarize and yields an empty result.
     *
     * @param trace the trace to summarize
     * @return the summary, or empty if the trace cannot be summarized
     */
    public static Optional<TraceSummary> from(Trace trace) {
        Long traceId = trace.getId();
        Long start = trace.getStartTimestamp();
        Long end = trace.getEndTimestamp();
        if (traceId == null || start == null || end == null) {
            return Optional.empty();
        }
        
        List<SpanTimestamp> spanTimestamps = new ArrayList<>();
        for (Span span : trace.getSpans()) {
            Long first = span.getFirstTimestamp();
            Long last = span.getLastTimestamp();
            if (first == null) {
                continue;
            }
            for (String service : span.getServiceNames()) {
                spanTimestamps.add(new SpanTimestamp(service, first, last));
            }
        }
        return Optional.of(new TraceSummary(traceId, start, end, spanTimestamps, trace.getEndpoints()));
    }
    
    public long getTraceId() {
        return traceId;
    }
    
    public long getStartTimestamp() {
        return startTimestamp;
    }
    
    public long getEndTimestamp() {
        return endTimestamp;
    }
    
    public long getDurationMicro() {
        return durationMicro;
    }
    
    public List<SpanTimestamp> getSpanTimestamps() {
        return spanTimestamps;
    }
    
    public List<Endpoint> getEndpoints() {
        return endpoints;
    }
}
