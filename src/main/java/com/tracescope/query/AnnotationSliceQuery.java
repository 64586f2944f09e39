package com.tracescope.query;

import java.util.Arrays;
import java.util.Objects;

/**
 * Filter on an annotation. Without a value it matches a plain annotation
 * named {@code key}; with a value it matches a binary annotation with that
 * key and exactly that value.
 */
public final class AnnotationSliceQuery extends SliceQuery {
    
    private final String key;
    private final byte[] value;
    
    public AnnotationSliceQuery(String key, byte[] value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value != null ? value.clone() : null;
    }
    
    public String getKey() {
        return key;
    }
    
    /**
     * @return the binary annotation value, or null for a plain annotation filter
     */
    public byte[] getValue() {
        return value != null ? value.clone() : null;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotationSliceQuery)) return false;
        AnnotationSliceQuery that = (AnnotationSliceQuery) o;
        return key.equals(that.key) && Arrays.equals(value, that.value);
    }
    
    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(value);
    }
    
    @Override
    public String toString() {
        return "AnnotationSliceQuery{key='" + key + "', value=" + (value != null ? value.length + " bytes" : "none") + '}';
    }
}
