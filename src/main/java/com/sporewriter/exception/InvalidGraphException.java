package com.sporewriter.exception;

/**
 * Exception thrown when a node-link document cannot be turned into a graph.
 */
public class InvalidGraphException extends RuntimeException {

    public InvalidGraphException(String message) {
        super(message);
    }

    public InvalidGraphException(String graph, String problem) {
        super(String.format("Graph '%s' is invalid: %s", graph, problem));
    }
}
