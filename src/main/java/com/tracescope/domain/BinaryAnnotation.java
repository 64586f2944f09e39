package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Key/value tag recorded on a span. The value is opaque bytes; lookups
 * compare it byte for byte.
 */
public class BinaryAnnotation {
    
    @JsonProperty("key")
    private final String key;
    
    @JsonProperty("value")
    private final byte[] value;
    
    @JsonProperty("host")
    private final Endpoint host;
    
    public BinaryAnnotation(String key, byte[] value) {
        this(key, value, null);
    }
    
    public BinaryAnnotation(String key, byte[] value, Endpoint host) {
        this.key = key;
        this.value = value != null ? value.clone() : new byte[0];
        this.host = host;
    }
    
    /**
     * Convenience constructor for UTF-8 string values
     */
    public static BinaryAnnotation of(String key, String value, Endpoint host) {
        return new BinaryAnnotation(key, value.getBytes(StandardCharsets.UTF_8), host);
    }
    
    public String getKey() {
        return key;
    }
    
    public byte[] getValue() {
        return value.clone();
    }
    
    public Endpoint getHost() {
        return host;
    }
    
    /**
     * @return true if this annotation has the given key and exactly the given value bytes
     */
    public boolean matches(String otherKey, byte[] otherValue) {
        return key.equals(otherKey) && Arrays.equals(value, otherValue);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryAnnotation)) return false;
        BinaryAnnotation that = (BinaryAnnotation) o;
        return key.equals(that.key)
            && Arrays.equals(value, that.value)
            && Objects.equals(host, that.host);
    }
    
    @Override
    public int hashCode() {
        int result = Objects.hash(key, host);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }
    
    @Override
    public String toString() {
        return "BinaryAnnotation{key='" + key + "', value=" + value.length + " bytes}";
    }
}
