package com.tracescope.query;

import com.tracescope.adjuster.AdjusterRegistry;
import com.tracescope.domain.Adjust;
import com.tracescope.domain.BinaryAnnotation;
import com.tracescope.domain.Dependencies;
import com.tracescope.domain.QueryRequest;
import com.tracescope.domain.QueryResponse;
import com.tracescope.domain.Trace;
import com.tracescope.domain.TraceCombo;
import com.tracescope.domain.TraceSummary;
import com.tracescope.storage.Aggregates;
import com.tracescope.storage.SpanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trace query service
 * 
 * Public entry point for trace search and retrieval. Every operation runs
 * inside the {@link QueryHandler} envelope, so callers only ever see
 * {@link QueryException} (or its {@link InvalidQueryException} subtype) on
 * failure.
 * 
 * Operations:
 * - Search for trace ids by service, span name, annotations and binary annotations
 * - Fetch traces, trace summaries or trace combos by id, with optional adjustments
 * - List service names and span names
 * - Fetch the service dependency graph
 */
public class TraceQueryService {
    
    private static final Logger log = LoggerFactory.getLogger(TraceQueryService.class);
    
    private final SpanStore spanStore;
    private final Aggregates aggregates;
    private final AdjusterRegistry adjusterRegistry;
    private final TraceIdQueryEngine queryEngine;
    private final QueryHandler handler;
    private final int traceDurationFetchBatchSize;
    
    /**
     * @param spanStore Indexed span storage
     * @param aggregates Dependency graph storage
     * @param adjusterRegistry Adjusters available to fetch operations
     * @param queryEngine Trace id search engine over the span store
     * @param handler Validation and instrumentation envelope
     * @param traceDurationFetchBatchSize Batch size reserved for duration lookups
     */
    public TraceQueryService(
            SpanStore spanStore,
            Aggregates aggregates,
            AdjusterRegistry adjusterRegistry,
            TraceIdQueryEngine queryEngine,
            QueryHandler handler,
            int traceDurationFetchBatchSize) {
        this.spanStore = spanStore;
        this.aggregates = aggregates;
        this.adjusterRegistry = adjusterRegistry;
        this.queryEngine = queryEngine;
        this.handler = handler;
        this.traceDurationFetchBatchSize = traceDurationFetchBatchSize;
        
        log.info("TraceQueryService initialized (traceDurationFetchBatchSize={})", traceDurationFetchBatchSize);
    }
    
    /**
     * Find trace ids matching every filter of the request.
     * 
     * @param request Search request; the service name is required
     * @return Mono containing at most {@code limit} trace ids
     */
    public Mono<QueryResponse> getTraceIds(QueryRequest request) {
        return handler.handleQuery("getTraceIds", request, () ->
            queryEngine.findTraceIds(request).map(QueryResponse::of));
    }
    
    public Mono<List<Long>> getTraceIdsBySpanName(String serviceName, String spanName, long endTs, int limit) {
        QueryRequest request = new QueryRequest(serviceName, endTs, limit).spanName(spanName);
        return handler.handleQuery("getTraceIdsBySpanName", request, () ->
            queryEngine.findTraceIds(request).map(ids -> QueryResponse.of(ids).getTraceIds()));
    }
    
    public Mono<List<Long>> getTraceIdsByServiceName(String serviceName, long endTs, int limit) {
        QueryRequest request = new QueryRequest(serviceName, endTs, limit);
        return handler.handleQuery("getTraceIdsByServiceName", request, () ->
            queryEngine.findTraceIds(request).map(ids -> QueryResponse.of(ids).getTraceIds()));
    }
    
    /**
     * Find trace ids by a single annotation.
     * 
     * @param value Binary annotation value, or null to match a plain annotation
     */
    public Mono<List<Long>> getTraceIdsByAnnotation(String serviceName, String annotation, byte[] value,
                                                    long endTs, int limit) {
        QueryRequest request = new QueryRequest(serviceName, endTs, limit);
        if (value != null) {
            request.binaryAnnotation(new BinaryAnnotation(annotation, value));
        } else {
            request.annotation(annotation);
        }
        return handler.handleQuery("getTraceIdsByAnnotation", request, () ->
            queryEngine.findTraceIds(request).map(ids -> QueryResponse.of(ids).getTraceIds()));
    }
    
    /**
     * @return Mono containing the subset of the ids the store holds spans for
     */
    public Mono<Set<Long>> tracesExist(List<Long> traceIds) {
        return handler.handle("tracesExist", () -> {
            log.debug("tracesExist numIds={}", traceIds.size());
            return spanStore.tracesExist(traceIds);
        });
    }
    
    public Mono<List<Trace>> getTracesByIds(List<Long> traceIds, List<Adjust> adjusts) {
        return handler.handle("getTracesByIds", () -> {
            log.debug("getTracesByIds numIds={}", traceIds.size());
            return spanStore.getSpansByTraceIds(traceIds)
                .map(traces -> adjusterRegistry.adjustedTraces(traces, adjusts));
        });
    }
    
    /**
     * Fetch summaries. Traces that cannot be summarized are left out of the
     * result rather than failing the call.
     */
    public Mono<List<TraceSummary>> getTraceSummariesByIds(List<Long> traceIds, List<Adjust> adjusts) {
        return handler.handle("getTraceSummariesByIds", () -> {
            log.debug("getTraceSummariesByIds numIds={}", traceIds.size());
            return spanStore.getSpansByTraceIds(traceIds)
                .map(traces -> adjusterRegistry.adjustedTraces(traces, adjusts).stream()
                    .map(TraceSummary::from)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toList()));
        });
    }
    
    public Mono<List<TraceCombo>> getTraceCombosByIds(List<Long> traceIds, List<Adjust> adjusts) {
        return handler.handle("getTraceCombosByIds", () -> {
            log.debug("getTraceCombosByIds numIds={}", traceIds.size());
            return spanStore.getSpansByTraceIds(traceIds)
                .map(traces -> {
                    List<TraceCombo> combos = new ArrayList<>(traces.size());
                    for (Trace trace : adjusterRegistry.adjustedTraces(traces, adjusts)) {
                        combos.add(TraceCombo.from(trace));
                    }
                    return combos;
                });
        });
    }
    
    public Mono<Set<String>> getServiceNames() {
        return handler.handle("getServiceNames", spanStore::getAllServiceNames);
    }
    
    public Mono<Set<String>> getSpanNames(String serviceName) {
        return handler.handle("getSpanNames", () -> spanStore.getSpanNames(serviceName));
    }
    
    /**
     * @param startTime Range start in epoch microseconds, or null
     * @param endTime Range end in epoch microseconds, or null
     */
    public Mono<Dependencies> getDependencies(Long startTime, Long endTime) {
        return handler.handle("getDependencies", () ->
            aggregates.getDependencies(fromMicros(startTime), fromMicros(endTime)));
    }
    
    public int getTraceDurationFetchBatchSize() {
        return traceDurationFetchBatchSize;
    }
    
    private static Instant fromMicros(Long micros) {
        return micros != null ? Instant.EPOCH.plus(micros, ChronoUnit.MICROS) : null;
    }
}
