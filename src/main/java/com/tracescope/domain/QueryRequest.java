package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Trace search request. The service name is always a filter; the span name,
 * annotation keys and binary annotations are optional secondary filters that
 * must all match.
 */
public class QueryRequest {
    
    @JsonProperty("service_name")
    private String serviceName;
    
    @JsonProperty("span_name")
    private String spanName;
    
    @JsonProperty("annotations")
    private List<String> annotations;
    
    @JsonProperty("binary_annotations")
    private List<BinaryAnnotation> binaryAnnotations;
    
    @JsonProperty("end_ts")
    private long endTs; // exclusive upper bound, epoch microseconds
    
    @JsonProperty("limit")
    private int limit;
    
    /**
     * Default constructor
     */
    public QueryRequest() {
        this.annotations = new ArrayList<>();
        this.binaryAnnotations = new ArrayList<>();
    }
    
    public QueryRequest(String serviceName, long endTs, int limit) {
        this();
        this.serviceName = serviceName;
        this.endTs = endTs;
        this.limit = limit;
    }
    
    // Getters and Setters
    
    public String getServiceName() {
        return serviceName;
    }
    
    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }
    
    public String getSpanName() {
        return spanName;
    }
    
    public void setSpanName(String spanName) {
        this.spanName = spanName;
    }
    
    public List<String> getAnnotations() {
        return annotations;
    }
    
    public void setAnnotations(List<String> annotations) {
        this.annotations = annotations != null ? annotations : new ArrayList<>();
    }
    
    public List<BinaryAnnotation> getBinaryAnnotations() {
        return binaryAnnotations;
    }
    
    public void setBinaryAnnotations(List<BinaryAnnotation> binaryAnnotations) {
        this.binaryAnnotations = binaryAnnotations != null ? binaryAnnotations : new ArrayList<>();
    }
    
    public long getEndTs() {
        return endTs;
    }
    
    public void setEndTs(long endTs) {
        this.endTs = endTs;
    }
    
    public int getLimit() {
        return limit;
    }
    
    public void setLimit(int limit) {
        this.limit = limit;
    }
    
    /**
     * Fluent variant of {@link #setSpanName(String)}
     */
    public QueryRequest spanName(String spanName) {
        setSpanName(spanName);
        return this;
    }
    
    /**
     * Add an annotation key filter
     */
    public QueryRequest annotation(String key) {
        this.annotations.add(key);
        return this;
    }
    
    /**
     * Add a binary annotation key/value filter
     */
    public QueryRequest binaryAnnotation(BinaryAnnotation binaryAnnotation) {
        this.binaryAnnotations.add(binaryAnnotation);
        return this;
    }
    
    @Override
    public String toString() {
        return "QueryRequest{" +
            "serviceName='" + serviceName + '\'' +
            ", spanName='" + spanName + '\'' +
            ", annotations=" + annotations +
            ", binaryAnnotations=" + binaryAnnotations +
            ", endTs=" + endTs +
            ", limit=" + limit +
            '}';
    }
}
