package com.tracescope.query;

import com.tracescope.adjuster.Adjuster;
import com.tracescope.adjuster.AdjusterRegistry;
import com.tracescope.domain.Adjust;
import com.tracescope.domain.Annotation;
import com.tracescope.domain.Dependencies;
import com.tracescope.domain.DependencyLink;
import com.tracescope.domain.Endpoint;
import com.tracescope.domain.IndexedTraceId;
import com.tracescope.domain.QueryRequest;
import com.tracescope.domain.Span;
import com.tracescope.domain.Trace;
import com.tracescope.domain.TraceSummary;
import com.tracescope.storage.Aggregates;
import com.tracescope.storage.SpanStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TraceQueryService
 */
@ExtendWith(MockitoExtension.class)
class TraceQueryServiceTest {
    
    private static final Endpoint WEB = new Endpoint(127 << 24 | 1, 8080, "web");
    
    @Mock
    private SpanStore spanStore;
    
    @Mock
    private Aggregates aggregates;
    
    private QueryMetrics metrics;
    private List<String> adjustmentLog;
    private TraceQueryService service;
    
    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        adjustmentLog = new ArrayList<>();
        
        Map<Adjust, Adjuster> adjusters = new EnumMap<>(Adjust.class);
        adjusters.put(Adjust.TIME_SKEW, trace -> {
            adjustmentLog.add("TIME_SKEW:" + trace.getId());
            return trace;
        });
        
        service = new TraceQueryService(
            spanStore,
            aggregates,
            new AdjusterRegistry(adjusters),
            new TraceIdQueryEngine(spanStore, Duration.ofMinutes(1)),
            new QueryHandler(metrics),
            500);
    }
    
    // ========== Search ==========
    
    @Test
    void testGetTraceIds_WithServiceOnly_ShouldReturnDirectLookup() {
        when(spanStore.getTraceIdsByName("web", null, 1000L, 10))
            .thenReturn(Mono.just(List.of(new IndexedTraceId(1L, 900L), new IndexedTraceId(2L, 800L))));
        
        StepVerifier.create(service.getTraceIds(new QueryRequest("web", 1000L, 10)))
            .assertNext(response -> {
                assertThat(response.getTraceIds()).containsExactly(1L, 2L);
                assertThat(response.getStartTs()).isEqualTo(800L);
                assertThat(response.getEndTs()).isEqualTo(900L);
            })
            .verifyComplete();
        
        assertThat(metrics.getCallCount("getTraceIds")).isEqualTo(1L);
    }
    
    @Test
    void testGetTraceIds_WithEmptyServiceName_ShouldFailWithoutTouchingStore() {
        QueryRequest request = new QueryRequest("", 1000L, 10).spanName("GET");
        
        StepVerifier.create(service.getTraceIds(request))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(InvalidQueryException.class);
                assertThat(error.getMessage()).isEqualTo("No service name provided");
            })
            .verify();
        
        verifyNoInteractions(spanStore);
        assertThat(metrics.getCallCount("getTraceIds")).isZero();
    }
    
    @Test
    void testGetTraceIds_WhenStoreFails_ShouldSurfaceQueryException() {
        when(spanStore.getTraceIdsByName("web", "GET", 1000L, 10))
            .thenReturn(Mono.error(new IllegalStateException("index offline")));
        
        StepVerifier.create(service.getTraceIds(new QueryRequest("web", 1000L, 10).spanName("GET")))
            .expectErrorSatisfies(error -> {
                assertThat(error).isExactlyInstanceOf(QueryException.class);
                assertThat(error.getMessage()).isEqualTo("java.lang.IllegalStateException: index offline");
            })
            .verify();
        
        assertThat(metrics.getErrorCount("getTraceIds", IllegalStateException.class)).isEqualTo(1.0);
    }
    
    @Test
    void testGetTraceIdsByAnnotation_WithoutValue_ShouldUsePlainAnnotationLookup() {
        when(spanStore.getTraceIdsByAnnotation(eq("web"), eq("error"), isNull(), eq(1000L), eq(3)))
            .thenReturn(Mono.just(List.of(new IndexedTraceId(4L, 400L))));
        
        StepVerifier.create(service.getTraceIdsByAnnotation("web", "error", null, 1000L, 3))
            .expectNext(List.of(4L))
            .verifyComplete();
    }
    
    @Test
    void testGetTraceIdsByServiceName_ShouldLookUpWithoutSpanName() {
        when(spanStore.getTraceIdsByName("web", null, 1000L, 2))
            .thenReturn(Mono.just(List.of(new IndexedTraceId(7L, 700L), new IndexedTraceId(8L, 600L),
                new IndexedTraceId(9L, 500L))));

        StepVerifier.create(service.getTraceIdsByServiceName("web", 1000L, 2))
            .expectNext(List.of(7L, 8L))
            .verifyComplete();

        assertThat(metrics.getCallCount("getTraceIdsByServiceName")).isEqualTo(1L);
    }

    @Test
    void testGetTraceIdsBySpanName_WithBlankService_ShouldFailValidation() {
        StepVerifier.create(service.getTraceIdsBySpanName(null, "GET", 1000L, 3))
            .expectError(InvalidQueryException.class)
            .verify();
        
        verifyNoInteractions(spanStore);
    }
    
    // ========== Fetch by id ==========
    
    @Test
    void testGetTracesByIds_ShouldApplyOnlyRegisteredAdjustersInOrder() {
        when(spanStore.getSpansByTraceIds(List.of(1L))).thenReturn(Mono.just(List.of(spans(1L, 100L))));
        
        StepVerifier.create(service.getTracesByIds(List.of(1L), List.of(Adjust.NOTHING, Adjust.TIME_SKEW, Adjust.TIME_SKEW)))
            .assertNext(traces -> assertThat(traces).extracting(Trace::getId).containsExactly(1L))
            .verifyComplete();
        
        assertThat(adjustmentLog).containsExactly("TIME_SKEW:1", "TIME_SKEW:1");
    }
    
    @Test
    void testGetTraceSummariesByIds_ShouldDropTracesThatCannotBeSummarized() {
        // Given: trace 2 has a span without any annotations, so it has no timestamps
        Span unannotated = new Span(2L, "orphan", 20L, null, List.of(), List.of());
        when(spanStore.getSpansByTraceIds(List.of(1L, 2L, 3L)))
            .thenReturn(Mono.just(List.of(spans(1L, 100L), List.of(unannotated), spans(3L, 300L))));
        
        // Then
        StepVerifier.create(service.getTraceSummariesByIds(List.of(1L, 2L, 3L), List.of()))
            .assertNext(summaries -> assertThat(summaries)
                .extracting(TraceSummary::getTraceId)
                .containsExactly(1L, 3L))
            .verifyComplete();
        
        assertThat(metrics.getErrorCount("getTraceSummariesByIds")).isZero();
    }
    
    @Test
    void testGetTraceCombosByIds_ShouldKeepUnsummarizableTraces() {
        Span unannotated = new Span(2L, "orphan", 20L, null, List.of(), List.of());
        when(spanStore.getSpansByTraceIds(List.of(1L, 2L)))
            .thenReturn(Mono.just(List.of(spans(1L, 100L), List.of(unannotated))));
        
        StepVerifier.create(service.getTraceCombosByIds(List.of(1L, 2L), null))
            .assertNext(combos -> {
                assertThat(combos).hasSize(2);
                assertThat(combos.get(0).getSummary()).isNotNull();
                assertThat(combos.get(1).getSummary()).isNull();
                assertThat(combos.get(0).getSpanDepths()).containsEntry(10L, 1).containsEntry(11L, 2);
            })
            .verifyComplete();
    }
    
    @Test
    void testGetTracesByIds_WhenAdjusterThrows_ShouldSurfaceQueryException() {
        Adjuster failingAdjuster = trace -> {
            throw new IllegalStateException("skew");
        };
        TraceQueryService failing = new TraceQueryService(
            spanStore,
            aggregates,
            new AdjusterRegistry(Map.of(Adjust.TIME_SKEW, failingAdjuster)),
            new TraceIdQueryEngine(spanStore, Duration.ofMinutes(1)),
            new QueryHandler(metrics),
            500);
        when(spanStore.getSpansByTraceIds(List.of(1L))).thenReturn(Mono.just(List.of(spans(1L, 100L))));
        
        StepVerifier.create(failing.getTracesByIds(List.of(1L), List.of(Adjust.TIME_SKEW)))
            .expectError(QueryException.class)
            .verify();
        
        assertThat(metrics.getErrorCount("getTracesByIds", IllegalStateException.class)).isEqualTo(1.0);
    }
    
    @Test
    void testTracesExist_ShouldPassThrough() {
        when(spanStore.tracesExist(List.of(1L, 2L))).thenReturn(Mono.just(Set.of(2L)));
        
        StepVerifier.create(service.tracesExist(List.of(1L, 2L)))
            .expectNext(Set.of(2L))
            .verifyComplete();
    }
    
    // ========== Enumeration and dependencies ==========
    
    @Test
    void testGetServiceNames_ShouldPassThrough() {
        when(spanStore.getAllServiceNames()).thenReturn(Mono.just(Set.of("web", "db")));
        
        StepVerifier.create(service.getServiceNames())
            .expectNext(Set.of("web", "db"))
            .verifyComplete();
        
        assertThat(metrics.getCallCount("getServiceNames")).isEqualTo(1L);
    }
    
    @Test
    void testGetSpanNames_ShouldPassThrough() {
        when(spanStore.getSpanNames("web")).thenReturn(Mono.just(Set.of("get", "post")));
        
        StepVerifier.create(service.getSpanNames("web"))
            .expectNext(Set.of("get", "post"))
            .verifyComplete();
    }
    
    @Test
    void testGetDependencies_ShouldConvertMicrosToInstants() {
        Dependencies dependencies = new Dependencies(1_000_000L, 2_000_000L,
            List.of(new DependencyLink("web", "db", 12L)));
        when(aggregates.getDependencies(Instant.ofEpochSecond(1), Instant.ofEpochSecond(2, 500_000)))
            .thenReturn(Mono.just(dependencies));
        
        StepVerifier.create(service.getDependencies(1_000_000L, 2_000_500L))
            .expectNext(dependencies)
            .verifyComplete();
    }
    
    @Test
    void testGetDependencies_WithoutRange_ShouldPassNulls() {
        when(aggregates.getDependencies(null, null)).thenReturn(Mono.just(Dependencies.empty()));
        
        StepVerifier.create(service.getDependencies(null, null))
            .assertNext(result -> assertThat(result.getLinks()).isEmpty())
            .verifyComplete();
        
        verify(aggregates).getDependencies(null, null);
    }
    
    private static List<Span> spans(long traceId, long start) {
        Span root = new Span(traceId, "get", 10L, null, List.of(
            new Annotation(start, "sr", WEB),
            new Annotation(start + 50, "ss", WEB)), List.of());
        Span child = new Span(traceId, "query", 11L, 10L, List.of(
            new Annotation(start + 10, "cs", WEB),
            new Annotation(start + 40, "cr", WEB)), List.of());
        return List.of(root, child);
    }
}
