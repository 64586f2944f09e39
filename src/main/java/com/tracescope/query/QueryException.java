package com.tracescope.query;

/**
 * The single failure kind callers of the query service see.
 * 
 * Whatever went wrong underneath (store unavailable, adjuster failure, bad
 * input) is reduced to its textual description; the original exception is
 * only visible in logs and in the per-type error counters.
 */
public class QueryException extends RuntimeException {
    
    public QueryException(String message) {
        super(message);
    }
}
