package com.tracescope.storage;

import com.tracescope.domain.IndexedTraceId;
import com.tracescope.domain.Span;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * SpanStore defines the indexed span storage the query service reads from.
 * 
 * Every index lookup answers a single predicate for one service and returns
 * hits ordered by recency (descending timestamp), strictly before
 * {@code endTs}, bounded by {@code limit}. A trace may appear more than once
 * in a result if it matched at several timestamps.
 * 
 * All methods are non-blocking; failures are signalled through the returned Mono.
 */
public interface SpanStore {
    
    /**
     * Look up trace ids for a service, optionally narrowed to a span name.
     * 
     * @param serviceName The service the spans were recorded by
     * @param spanName The span name, or null for any span of the service
     * @param endTs Exclusive upper bound, epoch microseconds
     * @param limit Maximum number of hits
     * @return Mono containing the hits, most recent first
     */
    Mono<List<IndexedTraceId>> getTraceIdsByName(String serviceName, String spanName, long endTs, int limit);
    
    /**
     * Look up trace ids for a service by annotation.
     * 
     * @param serviceName The service the spans were recorded by
     * @param annotation The annotation value, or the binary annotation key when {@code value} is set
     * @param value The binary annotation value, or null to match a plain annotation
     * @param endTs Exclusive upper bound, epoch microseconds
     * @param limit Maximum number of hits
     * @return Mono containing the hits, most recent first
     */
    Mono<List<IndexedTraceId>> getTraceIdsByAnnotation(String serviceName, String annotation, byte[] value,
                                                       long endTs, int limit);
    
    /**
     * Fetch the spans of each requested trace. Traces the store does not know
     * are omitted.
     * 
     * @param traceIds The trace ids to fetch
     * @return Mono containing one span list per found trace
     */
    Mono<List<List<Span>>> getSpansByTraceIds(List<Long> traceIds);
    
    /**
     * @param traceIds Candidate trace ids
     * @return Mono containing the subset of ids the store holds spans for
     */
    Mono<Set<Long>> tracesExist(List<Long> traceIds);
    
    Mono<Set<String>> getAllServiceNames();
    
    Mono<Set<String>> getSpanNames(String serviceName);
}
