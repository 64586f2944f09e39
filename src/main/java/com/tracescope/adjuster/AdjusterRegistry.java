package com.tracescope.adjuster;

import com.tracescope.domain.Adjust;
import com.tracescope.domain.Span;
import com.tracescope.domain.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves requested {@link Adjust} tags to adjusters and applies them.
 * 
 * A tag with no registered adjuster is skipped. Adjusters run in the order
 * the tags were requested, each one receiving the previous one's output.
 */
public class AdjusterRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(AdjusterRegistry.class);
    
    private final Map<Adjust, Adjuster> adjusters;
    
    public AdjusterRegistry(Map<Adjust, Adjuster> adjusters) {
        if (adjusters.isEmpty()) {
            this.adjusters = Collections.emptyMap();
        } else {
            this.adjusters = Collections.unmodifiableMap(new EnumMap<Adjust, Adjuster>(adjusters));
        }
        log.info("AdjusterRegistry initialized with adjusters for {}", this.adjusters.keySet());
    }
    
    public static AdjusterRegistry empty() {
        return new AdjusterRegistry(Collections.emptyMap());
    }
    
    /**
     * @param tags The requested tags, possibly null
     * @return The adjusters registered for the tags, in request order
     */
    public List<Adjuster> resolve(List<Adjust> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        List<Adjuster> resolved = new ArrayList<>(tags.size());
        for (Adjust tag : tags) {
            Adjuster adjuster = tag != null ? adjusters.get(tag) : null;
            if (adjuster != null) {
                resolved.add(adjuster);
            } else {
                log.debug("No adjuster registered for {}, skipping", tag);
            }
        }
        return resolved;
    }
    
    /**
     * Build a trace from each span list and fold the requested adjusters over it.
     * 
     * @param traces Raw span lists, one per trace
     * @param tags The requested adjustments
     * @return Adjusted traces in input order
     */
    public List<Trace> adjustedTraces(List<List<Span>> traces, List<Adjust> tags) {
        List<Adjuster> chain = resolve(tags);
        List<Trace> adjusted = new ArrayList<>(traces.size());
        for (List<Span> spans : traces) {
            Trace trace = new Trace(spans);
            for (Adjuster adjuster : chain) {
                trace = adjuster.adjust(trace);
            }
            adjusted.add(trace);
        }
        return adjusted;
    }
    
    public boolean isRegistered(Adjust tag) {
        return adjusters.containsKey(tag);
    }
}
