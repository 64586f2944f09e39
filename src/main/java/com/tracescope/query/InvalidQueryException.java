package com.tracescope.query;

/**
 * Thrown when a request is missing a required field. Raised before the
 * operation is timed or counted.
 */
public class InvalidQueryException extends QueryException {
    
    public InvalidQueryException(String message) {
        super(message);
    }
}
