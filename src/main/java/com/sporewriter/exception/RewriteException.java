package com.sporewriter.exception;

import lombok.Getter;

/**
 * Exception thrown when the gluing map does not allow a rewrite to run.
 */
@Getter
public class RewriteException extends RuntimeException {

    private final RewriteError error;

    public RewriteException(RewriteError error, String message) {
        super(message);
        this.error = error;
    }
}
