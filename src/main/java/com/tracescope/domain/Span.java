package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single timed unit of work within a trace.
 */
public class Span {
    
    @JsonProperty("trace_id")
    private final long traceId;
    
    @JsonProperty("name")
    private final String name;
    
    @JsonProperty("id")
    private final long id;
    
    @JsonProperty("parent_id")
    private final Long parentId;
    
    @JsonProperty("annotations")
    private final List<Annotation> annotations;
    
    @JsonProperty("binary_annotations")
    private final List<BinaryAnnotation> binaryAnnotations;
    
    @JsonProperty("debug")
    private final boolean debug;
    
    public Span(long traceId, String name, long id, Long parentId,
                List<Annotation> annotations, List<BinaryAnnotation> binaryAnnotations) {
        this(traceId, name, id, parentId, annotations, binaryAnnotations, false);
    }
    
    public Span(long traceId, String name, long id, Long parentId,
                List<Annotation> annotations, List<BinaryAnnotation> binaryAnnotations,
                boolean debug) {
        this.traceId = traceId;
        this.name = name;
        this.id = id;
        this.parentId = parentId;
        List<Annotation> sorted = new ArrayList<>(annotations != null ? annotations : List.of());
        sorted.sort(Comparator.comparingLong(Annotation::getTimestamp));
        this.annotations = Collections.unmodifiableList(sorted);
        this.binaryAnnotations = binaryAnnotations != null
            ? Collections.unmodifiableList(new ArrayList<>(binaryAnnotations))
            : List.of();
        this.debug = debug;
    }
    
    public long getTraceId() {
        return traceId;
    }
    
    public String getName() {
        return name;
    }
    
    public long getId() {
        return id;
    }
    
    public Long getParentId() {
        return parentId;
    }
    
    /**
     * @return annotations ordered by timestamp
     */
    public List<Annotation> getAnnotations() {
        return annotations;
    }
    
    public List<BinaryAnnotation> getBinaryAnnotations() {
        return binaryAnnotations;
    }
    
    public boolean isDebug() {
        return debug;
    }
    
    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }
    
    /**
     * @return earliest annotation timestamp, or null if the span has no annotations
     */
    @JsonIgnore
    public Long getFirstTimestamp() {
        return annotations.isEmpty() ? null : annotations.get(0).getTimestamp();
    }
    
    /**
     * @return latest annotation timestamp, or null if the span has no annotations
     */
    @JsonIgnore
    public Long getLastTimestamp() {
        return annotations.isEmpty() ? null : annotations.get(annotations.size() - 1).getTimestamp();
    }
    
    @JsonIgnore
    public long getDuration() {
        if (annotations.isEmpty()) {
            return 0L;
        }
        return getLastTimestamp() - getFirstTimestamp();
    }
    
    /**
     * Service names of every endpoint that recorded an annotation on this span.
     */
    @JsonIgnore
    public Set<String> getServiceNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Annotation annotation : annotations) {
            if (annotation.getServiceName() != null) {
                names.add(annotation.getServiceName());
            }
        }
        for (BinaryAnnotation binaryAnnotation : binaryAnnotations) {
            if (binaryAnnotation.getHost() != null) {
                names.add(binaryAnnotation.getHost().getServiceName());
            }
        }
        return names;
    }
    
    @JsonIgnore
    public Set<Endpoint> getEndpoints() {
        Set<Endpoint> endpoints = new LinkedHashSet<>();
        for (Annotation annotation : annotations) {
            if (annotation.getHost() != null) {
                endpoints.add(annotation.getHost());
            }
        }
        return endpoints;
    }
    
    /**
     * Copy of this span with its annotations replaced.
     */
    public Span withAnnotations(List<Annotation> newAnnotations) {
        return new Span(traceId, name, id, parentId, newAnnotations, binaryAnnotations, debug);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return traceId == span.traceId
            && id == span.id
            && debug == span.debug
            && Objects.equals(name, span.name)
            && Objects.equals(parentId, span.parentId)
            && annotations.equals(span.annotations)
            && binaryAnnotations.equals(span.binaryAnnotations);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(traceId, name, id, parentId, annotations, binaryAnnotations, debug);
    }
    
    @Override
    public String toString() {
        return "Span{traceId=" + traceId + ", name='" + name + "', id=" + id + ", parentId=" + parentId + '}';
    }
}
