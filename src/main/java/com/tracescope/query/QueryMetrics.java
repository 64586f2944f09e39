package com.tracescope.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for query service operations
 * 
 * Tracks, per operation name:
 * - Execution latency (tracescope.query.method)
 * - Failures (tracescope.query.errors)
 * - Failures by exception type (tracescope.query.errors.by.type)
 */
@Component
public class QueryMetrics {
    
    static final String METHOD_TIMER = "tracescope.query.method";
    static final String ERRORS = "tracescope.query.errors";
    static final String ERRORS_BY_TYPE = "tracescope.query.errors.by.type";
    
    private final MeterRegistry meterRegistry;
    
    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }
    
    public void recordLatency(Timer.Sample sample, String method) {
        sample.stop(methodTimer(method));
    }
    
    /**
     * Count a failure once for the operation and once for the operation and
     * exception type.
     */
    public void recordError(String method, Throwable error) {
        Counter.builder(ERRORS)
            .description("Failed query service operations")
            .tag("method", method)
            .register(meterRegistry)
            .increment();
        
        Counter.builder(ERRORS_BY_TYPE)
            .description("Failed query service operations by exception type")
            .tag("method", method)
            .tag("exception", error.getClass().getName())
            .register(meterRegistry)
            .increment();
    }
    
    public Timer methodTimer(String method) {
        return Timer.builder(METHOD_TIMER)
            .description("Latency of query service operations")
            .tag("method", method)
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }
    
    // Lookup methods for testing and diagnostics
    
    public long getCallCount(String method) {
        Timer timer = meterRegistry.find(METHOD_TIMER).tag("method", method).timer();
        return timer != null ? timer.count() : 0L;
    }
    
    public double getErrorCount(String method) {
        Counter counter = meterRegistry.find(ERRORS).tag("method", method).counter();
        return counter != null ? counter.count() : 0.0;
    }
    
    public double getErrorCount(String method, Class<? extends Throwable> type) {
        Counter counter = meterRegistry.find(ERRORS_BY_TYPE)
            .tag("method", method)
            .tag("exception", type.getName())
            .counter();
        return counter != null ? counter.count() : 0.0;
    }
}
