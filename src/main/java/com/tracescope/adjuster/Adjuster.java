package com.tracescope.adjuster;

import com.tracescope.domain.Trace;

/**
 * Adjuster transforms a fetched trace before it is returned, for example to
 * correct clock skew between hosts. Implementations must not mutate the
 * input trace.
 */
@FunctionalInterface
public interface Adjuster {
    
    /**
     * @param trace The trace to adjust
     * @return The adjusted trace
     */
    Trace adjust(Trace trace);
}
