package com.tracescope.config;

import com.tracescope.adjuster.Adjuster;
import com.tracescope.adjuster.AdjusterRegistry;
import com.tracescope.domain.Adjust;
import com.tracescope.query.QueryHandler;
import com.tracescope.query.TraceIdQueryEngine;
import com.tracescope.query.TraceQueryService;
import com.tracescope.storage.Aggregates;
import com.tracescope.storage.SpanStore;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Wiring for the query service.
 * 
 * SpanStore and Aggregates come from the deployment, or from
 * {@link TraceQueryStorageAutoConfiguration} when it defines none.
 * 
 * Adjusters are bound to tags through {@code tracescope.query.adjusters},
 * a comma separated list of {@code TAG=beanName} entries, e.g.
 * {@code TIME_SKEW=timeSkewAdjuster}.
 */
@Configuration
public class TraceQueryConfig {
    
    @Value("${tracescope.query.trace-timestamp-padding.ms:60000}")
    private long traceTimestampPaddingMs;
    
    @Value("${tracescope.query.trace-duration-fetch-batch-size:500}")
    private int traceDurationFetchBatchSize;
    
    @Value("${tracescope.query.adjusters:}")
    private String adjusterBindings;
    
    @Bean
    public AdjusterRegistry adjusterRegistry(ListableBeanFactory beanFactory) {
        Map<Adjust, Adjuster> adjusters = new EnumMap<>(Adjust.class);
        Map<String, Adjuster> available = beanFactory.getBeansOfType(Adjuster.class);
        for (Map.Entry<Adjust, String> binding : parseAdjusterBindings(adjusterBindings).entrySet()) {
            Adjuster adjuster = available.get(binding.getValue());
            if (adjuster == null) {
                throw new IllegalStateException(String.format(
                    "No Adjuster bean named '%s' for %s", binding.getValue(), binding.getKey()));
            }
            adjusters.put(binding.getKey(), adjuster);
        }
        return new AdjusterRegistry(adjusters);
    }
    
    @Bean
    public TraceIdQueryEngine traceIdQueryEngine(SpanStore spanStore) {
        return new TraceIdQueryEngine(spanStore, Duration.ofMillis(traceTimestampPaddingMs));
    }
    
    @Bean
    public TraceQueryService traceQueryService(
            SpanStore spanStore,
            Aggregates aggregates,
            AdjusterRegistry adjusterRegistry,
            TraceIdQueryEngine traceIdQueryEngine,
            QueryHandler queryHandler) {
        return new TraceQueryService(spanStore, aggregates, adjusterRegistry,
            traceIdQueryEngine, queryHandler, traceDurationFetchBatchSize);
    }
    
    /**
     * Parse {@code TAG=beanName} entries.
     * 
     * @param bindings Comma separated bindings, possibly blank
     * @return Bean name per tag, in declaration order
     * @throws IllegalArgumentException if an entry is malformed or names an unknown tag
     */
    static Map<Adjust, String> parseAdjusterBindings(String bindings) {
        Map<Adjust, String> parsed = new LinkedHashMap<>();
        if (bindings == null || bindings.isBlank()) {
            return parsed;
        }
        for (String entry : bindings.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new IllegalArgumentException("Malformed adjuster binding: " + trimmed);
            }
            String tag = trimmed.substring(0, separator).trim().toUpperCase(Locale.ROOT);
            String beanName = trimmed.substring(separator + 1).trim();
            try {
                parsed.put(Adjust.valueOf(tag), beanName);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown adjust tag in binding: " + trimmed, e);
            }
        }
        return parsed;
    }
}
