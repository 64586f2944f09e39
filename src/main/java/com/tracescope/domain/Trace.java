package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All spans sharing one trace id, ordered by their first annotation.
 * Spans without annotations sort last.
 */
public class Trace {
    
    private static final Comparator<Span> BY_FIRST_TIMESTAMP = Comparator.comparing(
        Span::getFirstTimestamp, Comparator.nullsLast(Comparator.<Long>naturalOrder()));
    
    @JsonProperty("spans")
    private final List<Span> spans;
    
    public Trace(List<Span> spans) {
        List<Span> sorted = new ArrayList<>(spans != null ? spans : List.of());
        sorted.sort(BY_FIRST_TIMESTAMP);
        this.spans = Collections.unmodifiableList(sorted);
    }
    
    public List<Span> getSpans() {
        return spans;
    }
    
    /**
     * @return the trace id, or null for a trace without spans
     */
    @JsonIgnore
    public Long getId() {
        return spans.isEmpty() ? null : spans.get(0).getTraceId();
    }
    
    /**
     * @return the first span without a parent, or null if none exists
     */
    @JsonIgnore
    public Span getRootSpan() {
        for (Span span : spans) {
            if (span.isRoot()) {
                return span;
            }
        }
        return null;
    }
    
    @JsonIgnore
    public Long getStartTimestamp() {
        Long start = null;
        for (Span span : spans) {
            Long first = span.getFirstTimestamp();
            if (first != null && (start == null || first < start)) {
                start = first;
            }
        }
        return start;
    }
    
    @JsonIgnore
    public Long getEndTimestamp() {
        Long end = null;
        for (Span span : spans) {
            Long last = span.getLastTimestamp();
            if (last != null && (end == null || last > end)) {
                end = last;
            }
        }
        return end;
    }
    
    @JsonIgnore
    public long getDuration() {
        Long start = getStartTimestamp();
        Long end = getEndTimestamp();
        return start != null && end != null ? end - start : 0L;
    }
    
    @JsonIgnore
    public Set<String> getServices() {
        Set<String> services = new LinkedHashSet<>();
        for (Span span : spans) {
            services.addAll(span.getServiceNames());
        }
        return services;
    }
    
    @JsonIgnore
    public List<Endpoint> getEndpoints() {
        Set<Endpoint> endpoints = new LinkedHashSet<>();
        for (Span span : spans) {
            endpoints.addAll(span.getEndpoints());
        }
        return new ArrayList<>(endpoints);
    }
    
    /**
     * Depth of every span in the span tree, keyed by span id. Root spans have
     * depth 1. Spans whose parent is missing from the trace are treated as roots.
     */
    @JsonIgnore
    public Map<Long, Integer> getSpanDepths() {
        Map<Long, Span> byId = new HashMap<>();
        for (Span span : spans) {
            byId.put(span.getId(), span);
        }
        Map<Long, Integer> depths = new LinkedHashMap<>();
        for (Span span : spans) {
            depths.put(span.getId(), depthOf(span, byId, depths, 0));
        }
        return depths;
    }
    
    private int depthOf(Span span, Map<Long, Span> byId, Map<Long, Integer> known, int guard) {
        Integer cached = known.get(span.getId());
        if (cached != null) {
            return cached;
        }
        Span parent = span.getParentId() != null ? byId.get(span.getParentId()) : null;
        // a self-referencing or cyclic parent chain stops at the trace size
        if (parent == null || parent == span || guard > byId.size()) {
            return 1;
        }
        return depthOf(parent, byId, known, guard + 1) + 1;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trace)) return false;
        return spans.equals(((Trace) o).spans);
    }
    
    @Override
    public int hashCode() {
        return spans.hashCode();
    }
    
    @Override
    public String toString() {
        return "Trace{id=" + getId() + ", spans=" + spans.size() + '}';
    }
}
