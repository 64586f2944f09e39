package com.tracescope.query;

import java.util.Objects;

/**
 * Filter on span name.
 */
public final class SpanSliceQuery extends SliceQuery {
    
    private final String name;
    
    public SpanSliceQuery(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }
    
    public String getName() {
        return name;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpanSliceQuery)) return false;
        return name.equals(((SpanSliceQuery) o).name);
    }
    
    @Override
    public int hashCode() {
        return name.hashCode();
    }
    
    @Override
    public String toString() {
        return "SpanSliceQuery{name='" + name + "'}";
    }
}
