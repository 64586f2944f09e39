package com.tracescope.query;

import com.tracescope.domain.IndexedTraceId;
import com.tracescope.storage.SpanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs a batch of slice queries against the span store.
 * 
 * Every slice in a batch is subscribed without waiting for the others; the
 * batch completes once all of them have completed, with results aligned
 * positionally to the input slices. The first failing slice fails the batch.
 */
public class SliceQueryExecutor {
    
    private static final Logger log = LoggerFactory.getLogger(SliceQueryExecutor.class);
    
    private final SpanStore spanStore;
    
    public SliceQueryExecutor(SpanStore spanStore) {
        this.spanStore = spanStore;
    }
    
    /**
     * @param slices The slices to run
     * @param serviceName The service every slice is scoped to
     * @param endTs Exclusive upper bound passed to each lookup
     * @param limit Per-slice hit limit
     * @return Mono containing one hit list per slice
     */
    public Mono<List<List<IndexedTraceId>>> execute(List<SliceQuery> slices, String serviceName,
                                                    long endTs, int limit) {
        log.debug("Executing {} slice queries for service {} (endTs={}, limit={})",
            slices.size(), serviceName, endTs, limit);
        return Flux.fromIterable(slices)
            .flatMapSequential(slice -> query(slice, serviceName, endTs, limit), Math.max(1, slices.size()))
            .collectList();
    }
    
    private Mono<List<IndexedTraceId>> query(SliceQuery slice, String serviceName, long endTs, int limit) {
        if (slice instanceof SpanSliceQuery) {
            SpanSliceQuery spanSlice = (SpanSliceQuery) slice;
            return Mono.defer(() -> spanStore.getTraceIdsByName(serviceName, spanSlice.getName(), endTs, limit))
                .defaultIfEmpty(List.of());
        }
        if (slice instanceof AnnotationSliceQuery) {
            AnnotationSliceQuery annotationSlice = (AnnotationSliceQuery) slice;
            return Mono.defer(() -> spanStore.getTraceIdsByAnnotation(
                    serviceName, annotationSlice.getKey(), annotationSlice.getValue(), endTs, limit))
                .defaultIfEmpty(List.of());
        }
        return Mono.error(new IllegalArgumentException("Unknown SliceQuery: " + slice));
    }
}
