package com.tracescope.query;

import com.tracescope.domain.IndexedTraceId;
import com.tracescope.domain.QueryRequest;
import com.tracescope.storage.SpanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Finds the trace ids matching every filter of a search request.
 * 
 * The index answers one filter at a time, each answer bounded by its own
 * limit and time window. With two or more secondary filters the engine
 * therefore runs two passes:
 * 
 * 1. Probe: every slice with limit 1 and the request's endTs, to find the
 *    most recent hit per slice.
 * 2. Fetch: every slice again with the request's limit and an endTs equal to
 *    the oldest probe hit plus a fixed padding, then intersect.
 * 
 * The padded window is a heuristic. It assumes matches for all filters fall
 * within the padding of each other and can miss traces that do not.
 */
public class TraceIdQueryEngine {
    
    private static final Logger log = LoggerFactory.getLogger(TraceIdQueryEngine.class);
    
    private final SpanStore spanStore;
    private final SliceQueryExecutor sliceQueryExecutor;
    private final Duration traceTimestampPadding;
    
    /**
     * @param spanStore Store answering the index lookups
     * @param traceTimestampPadding Skew tolerated between independently indexed filters
     */
    public TraceIdQueryEngine(SpanStore spanStore, Duration traceTimestampPadding) {
        this.spanStore = spanStore;
        this.sliceQueryExecutor = new SliceQueryExecutor(spanStore);
        this.traceTimestampPadding = traceTimestampPadding;
        log.info("TraceIdQueryEngine initialized (padding={}ms)", traceTimestampPadding.toMillis());
    }
    
    /**
     * @param request A request with a non-empty service name
     * @return Mono containing at most {@code limit} hits
     */
    public Mono<List<IndexedTraceId>> findTraceIds(QueryRequest request) {
        if (request.getLimit() <= 0) {
            return Mono.error(new IllegalArgumentException("Limit must be positive, was " + request.getLimit()));
        }
        
        String serviceName = request.getServiceName();
        long endTs = request.getEndTs();
        int limit = request.getLimit();
        List<SliceQuery> slices = SliceQuery.fromRequest(request);
        
        switch (slices.size()) {
            case 0:
                return Mono.defer(() -> spanStore.getTraceIdsByName(serviceName, null, endTs, limit))
                    .defaultIfEmpty(List.of())
                    .map(ids -> truncate(ids, limit));
            
            case 1:
                return sliceQueryExecutor.execute(slices, serviceName, endTs, limit)
                    .map(results -> truncate(results.get(0), limit));
            
            default:
                // endTs is a misnomer for the fetch pass: it bounds a window
                // anchored on the oldest probe hit, not the request's end time
                return sliceQueryExecutor.execute(slices, serviceName, endTs, 1)
                    .flatMap(probes -> {
                        long fetchEndTs = widenedEndTs(probes);
                        log.debug("Probed {} slices for service {}, fetching with endTs={}",
                            slices.size(), serviceName, fetchEndTs);
                        return sliceQueryExecutor.execute(slices, serviceName, fetchEndTs, limit);
                    })
                    .map(results -> truncate(TraceIdIntersector.intersect(results), limit));
        }
    }
    
    /**
     * The fetch pass bound: the oldest probe hit, or 0 if no slice had a hit,
     * plus the padding.
     */
    long widenedEndTs(List<List<IndexedTraceId>> probes) {
        long oldest = Long.MAX_VALUE;
        boolean found = false;
        for (List<IndexedTraceId> probe : probes) {
            for (IndexedTraceId id : probe) {
                oldest = Math.min(oldest, id.getTimestamp());
                found = true;
            }
        }
        return padTimestamp(found ? oldest : 0L);
    }
    
    long padTimestamp(long timestamp) {
        return timestamp + traceTimestampPadding.toNanos() / 1000L;
    }
    
    public Duration getTraceTimestampPadding() {
        return traceTimestampPadding;
    }
    
    private static List<IndexedTraceId> truncate(List<IndexedTraceId> ids, int limit) {
        return ids.size() > limit ? List.copyOf(ids.subList(0, limit)) : List.copyOf(ids);
    }
}
