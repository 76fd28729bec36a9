package com.sharpskill.search.exception;

/**
 * The query was blank. Callers are expected to ask the user for more input
 * rather than treat this as a fault.
 */
public class EmptyQueryException extends InvalidQueryException {

    public EmptyQueryException() {
        super("Query cannot be blank");
    }
}
