package com.sporewriter.exception;

import lombok.Getter;

/**
 * Exception thrown when an LHS to input map is not a valid match.
 */
@Getter
public class MatchException extends RuntimeException {

    private final MatchError error;

    public MatchException(MatchError error, String message) {
        super(message);
        this.error = error;
    }
}
