package com.tracescope.storage;

import com.tracescope.domain.Dependencies;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Aggregation store holding precomputed service dependency graphs.
 */
public interface Aggregates {
    
    /**
     * @param startTime Start of the range, or null for the store's default
     * @param endTime End of the range, or null for the store's default
     * @return Mono containing the dependency graph for the range
     */
    Mono<Dependencies> getDependencies(Instant startTime, Instant endTime);
}
