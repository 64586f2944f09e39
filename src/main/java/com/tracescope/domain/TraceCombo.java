package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

/**
 * A trace bundled with the views the trace detail page needs.
 */
public class TraceCombo {
    
    @JsonProperty("trace")
    private final Trace trace;
    
    @JsonProperty("summary")
    private final TraceSummary summary;
    
    @JsonProperty("span_depths")
    private final Map<Long, Integer> spanDepths;
    
    public TraceCombo(Trace trace, TraceSummary summary, Map<Long, Integer> spanDepths) {
        this.trace = trace;
        this.summary = summary;
        this.spanDepths = Collections.unmodifiableMap(spanDepths);
    }
    
    public static TraceCombo from(Trace trace) {
        return new TraceCombo(trace, TraceSummary.from(trace).orElse(null), trace.getSpanDepths());
    }
    
    public Trace getTrace() {
        return trace;
    }
    
    /**
     * @return the summary, or null when the trace could not be summarized
     */
    public TraceSummary getSummary() {
        return summary;
    }
    
    public Map<Long, Integer> getSpanDepths() {
        return spanDepths;
    }
}
