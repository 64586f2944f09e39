package com.tracescope.query;

import com.tracescope.domain.BinaryAnnotation;
import com.tracescope.domain.QueryRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * One secondary search filter, answerable by a single index lookup.
 * 
 * The variants are {@link SpanSliceQuery} and {@link AnnotationSliceQuery}.
 */
public abstract class SliceQuery {
    
    SliceQuery() {
    }
    
    /**
     * Extract the secondary filters of a request: the span name first, then
     * each annotation key, then each binary annotation.
     * 
     * @param request The search request
     * @return One slice per secondary filter, possibly none
     */
    public static List<SliceQuery> fromRequest(QueryRequest request) {
        List<SliceQuery> slices = new ArrayList<>();
        if (request.getSpanName() != null) {
            slices.add(new SpanSliceQuery(request.getSpanName()));
        }
        if (request.getAnnotations() != null) {
            for (String key : request.getAnnotations()) {
                slices.add(new AnnotationSliceQuery(key, null));
            }
        }
        if (request.getBinaryAnnotations() != null) {
            for (BinaryAnnotation binaryAnnotation : request.getBinaryAnnotations()) {
                slices.add(new AnnotationSliceQuery(binaryAnnotation.getKey(), binaryAnnotation.getValue()));
            }
        }
        return slices;
    }
}
