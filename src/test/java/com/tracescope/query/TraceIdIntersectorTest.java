package com.tracescope.query;

import com.tracescope.domain.IndexedTraceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TraceIdIntersector Tests")
class TraceIdIntersectorTest {
    
    @Test
    @DisplayName("Should keep only ids present in every list")
    void shouldKeepIdsPresentInEveryList() {
        List<IndexedTraceId> a = List.of(id(1, 100), id(2, 200), id(3, 300));
        List<IndexedTraceId> b = List.of(id(2, 250), id(3, 150), id(4, 400));
        
        List<IndexedTraceId> result = TraceIdIntersector.intersect(List.of(a, b));
        
        assertThat(result).containsExactly(id(2, 250), id(3, 300));
    }
    
    @Test
    @DisplayName("Should stamp each id with its latest timestamp across all lists")
    void shouldUseMaximumTimestampAcrossAllOccurrences() {
        List<IndexedTraceId> a = List.of(id(7, 100), id(7, 500), id(8, 10));
        List<IndexedTraceId> b = List.of(id(7, 300), id(8, 20));
        List<IndexedTraceId> c = List.of(id(8, 5), id(7, 50));
        
        List<IndexedTraceId> result = TraceIdIntersector.intersect(List.of(a, b, c));
        
        assertThat(result).containsExactlyInAnyOrder(id(7, 500), id(8, 20));
    }
    
    @Test
    @DisplayName("Should give the same ids and timestamps regardless of list order")
    void shouldBeOrderIndependent() {
        List<IndexedTraceId> a = List.of(id(1, 10), id(2, 20), id(3, 30), id(3, 35));
        List<IndexedTraceId> b = List.of(id(3, 31), id(1, 11), id(5, 50));
        List<IndexedTraceId> c = List.of(id(1, 9), id(3, 40), id(2, 22));
        
        List<IndexedTraceId> abc = TraceIdIntersector.intersect(List.of(a, b, c));
        List<IndexedTraceId> cab = TraceIdIntersector.intersect(List.of(c, a, b));
        List<IndexedTraceId> bca = TraceIdIntersector.intersect(List.of(b, c, a));
        
        assertThat(abc).containsExactlyInAnyOrder(id(1, 11), id(3, 40));
        assertThat(cab).containsExactlyInAnyOrderElementsOf(abc);
        assertThat(bca).containsExactlyInAnyOrderElementsOf(abc);
    }
    
    @Test
    @DisplayName("Should return nothing when any list is empty")
    void shouldReturnEmptyWhenAnyListIsEmpty() {
        List<IndexedTraceId> a = List.of(id(1, 10), id(2, 20));
        
        assertThat(TraceIdIntersector.intersect(List.of(a, List.of()))).isEmpty();
        assertThat(TraceIdIntersector.intersect(List.of(List.of(), a))).isEmpty();
    }
    
    @Test
    @DisplayName("Should return one entry per trace id")
    void shouldDeduplicateTraceIds() {
        List<IndexedTraceId> a = List.of(id(1, 10), id(1, 20), id(1, 30));
        List<IndexedTraceId> b = List.of(id(1, 15), id(1, 25));
        
        List<Long> traceIds = TraceIdIntersector.intersect(List.of(a, b)).stream()
            .map(IndexedTraceId::getTraceId)
            .collect(Collectors.toList());
        
        assertThat(traceIds).containsExactly(1L);
    }
    
    @Test
    @DisplayName("Should follow first-appearance order of the first list")
    void shouldPreserveFirstListOrder() {
        List<IndexedTraceId> a = List.of(id(3, 30), id(1, 10), id(2, 20));
        List<IndexedTraceId> b = List.of(id(1, 10), id(2, 20), id(3, 30));
        
        assertThat(TraceIdIntersector.intersect(List.of(a, b)))
            .extracting(IndexedTraceId::getTraceId)
            .containsExactly(3L, 1L, 2L);
    }
    
    @Test
    void testIntersect_WithNoLists_ShouldReturnEmpty() {
        assertThat(TraceIdIntersector.intersect(List.of())).isEmpty();
    }
    
    private static IndexedTraceId id(long traceId, long timestamp) {
        return new IndexedTraceId(traceId, timestamp);
    }
}
