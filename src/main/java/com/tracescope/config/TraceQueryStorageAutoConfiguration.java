package com.tracescope.config;

import com.tracescope.storage.Aggregates;
import com.tracescope.storage.InMemorySpanStore;
import com.tracescope.storage.NullAggregates;
import com.tracescope.storage.SpanStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Fallback storage and metrics beans.
 * 
 * Runs after every user configuration has been registered, so a SpanStore,
 * Aggregates or MeterRegistry bean defined by the deployment always wins.
 */
@AutoConfiguration
public class TraceQueryStorageAutoConfiguration {
    
    private static final Logger log = LoggerFactory.getLogger(TraceQueryStorageAutoConfiguration.class);
    
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
    
    @Bean
    @ConditionalOnMissingBean(SpanStore.class)
    public SpanStore spanStore() {
        log.warn("No SpanStore configured, using in-memory span store");
        return new InMemorySpanStore();
    }
    
    @Bean
    @ConditionalOnMissingBean(Aggregates.class)
    public Aggregates aggregates() {
        return new NullAggregates();
    }
}
