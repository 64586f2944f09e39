package com.tracescope.storage;

import com.tracescope.domain.Annotation;
import com.tracescope.domain.BinaryAnnotation;
import com.tracescope.domain.IndexedTraceId;
import com.tracescope.domain.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * SpanStore backed by process memory, for development and tests.
 * 
 * Lookups are linear scans over every stored span, so this store only suits
 * small data sets. Span name and binary annotation hits are timestamped with
 * the span's last annotation; plain annotation hits with the matching
 * annotation's own timestamp.
 */
public class InMemorySpanStore implements SpanStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemorySpanStore.class);
    
    private static final Comparator<IndexedTraceId> MOST_RECENT_FIRST =
        Comparator.comparingLong(IndexedTraceId::getTimestamp).reversed();
    
    private final Map<Long, List<Span>> spansByTraceId = new ConcurrentHashMap<>();
    
    /**
     * Store spans. Spans are appended to their trace in arrival order.
     * 
     * @param spans The spans to store
     */
    public void apply(List<Span> spans) {
        for (Span span : spans) {
            spansByTraceId
                .computeIfAbsent(span.getTraceId(), id -> new CopyOnWriteArrayList<>())
                .add(span);
        }
        log.debug("Stored {} spans, {} traces held", spans.size(), spansByTraceId.size());
    }
    
    public void clear() {
        spansByTraceId.clear();
    }
    
    @Override
    public Mono<List<IndexedTraceId>> getTraceIdsByName(String serviceName, String spanName, long endTs, int limit) {
        return Mono.fromCallable(() -> lookup(serviceName, endTs, limit, span -> {
            if (spanName != null && !spanName.equalsIgnoreCase(span.getName())) {
                return List.of();
            }
            return lastTimestampOf(span);
        }));
    }
    
    @Override
    public Mono<List<IndexedTraceId>> getTraceIdsByAnnotation(String serviceName, String annotation, byte[] value,
                                                              long endTs, int limit) {
        return Mono.fromCallable(() -> lookup(serviceName, endTs, limit, span -> {
            if (value != null) {
                for (BinaryAnnotation binaryAnnotation : span.getBinaryAnnotations()) {
                    if (binaryAnnotation.matches(annotation, value)) {
                        return lastTimestampOf(span);
                    }
                }
                return List.of();
            }
            List<Long> timestamps = new ArrayList<>();
            for (Annotation candidate : span.getAnnotations()) {
                if (annotation.equals(candidate.getValue())) {
                    timestamps.add(candidate.getTimestamp());
                }
            }
            return timestamps;
        }));
    }
    
    @Override
    public Mono<List<List<Span>>> getSpansByTraceIds(List<Long> traceIds) {
        return Mono.fromCallable(() -> {
            List<List<Span>> traces = new ArrayList<>();
            for (Long traceId : traceIds) {
                List<Span> spans = spansByTraceId.get(traceId);
                if (spans != null && !spans.isEmpty()) {
                    traces.add(new ArrayList<>(spans));
                }
            }
            return traces;
        });
    }
    
    @Override
    public Mono<Set<Long>> tracesExist(List<Long> traceIds) {
        return Mono.fromCallable(() -> {
            Set<Long> existing = new LinkedHashSet<>();
            for (Long traceId : traceIds) {
                if (spansByTraceId.containsKey(traceId)) {
                    existing.add(traceId);
                }
            }
            return existing;
        });
    }
    
    @Override
    public Mono<Set<String>> getAllServiceNames() {
        return Mono.fromCallable(() -> {
            Set<String> names = new TreeSet<>();
            spansByTraceId.values().forEach(spans -> spans.forEach(span -> names.addAll(span.getServiceNames())));
            return names;
        });
    }
    
    @Override
    public Mono<Set<String>> getSpanNames(String serviceName) {
        return Mono.fromCallable(() -> {
            String service = normalize(serviceName);
            Set<String> names = new TreeSet<>();
            spansByTraceId.values().forEach(spans -> spans.stream()
                .filter(span -> span.getServiceNames().contains(service))
                .forEach(span -> names.add(span.getName())));
            return names;
        });
    }
    
    private List<IndexedTraceId> lookup(String serviceName, long endTs, int limit,
                                        Function<Span, List<Long>> matchTimestamps) {
        String service = normalize(serviceName);
        List<IndexedTraceId> hits = new ArrayList<>();
        for (List<Span> spans : spansByTraceId.values()) {
            for (Span span : spans) {
                if (!span.getServiceNames().contains(service)) {
                    continue;
                }
                for (Long timestamp : matchTimestamps.apply(span)) {
                    if (timestamp < endTs) {
                        hits.add(new IndexedTraceId(span.getTraceId(), timestamp));
                    }
                }
            }
        }
        hits.sort(MOST_RECENT_FIRST);
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }
    
    private static List<Long> lastTimestampOf(Span span) {
        Long last = span.getLastTimestamp();
        return last != null ? List.of(last) : List.of();
    }
    
    private static String normalize(String serviceName) {
        return serviceName != null ? serviceName.toLowerCase(Locale.ROOT) : "";
    }
}
