package com.sporewriter.exception;

import lombok.Getter;

/**
 * Exception thrown when a correspondence assignment is rejected.
 * The builder state is left unchanged, so the caller may retry with another target.
 */
@Getter
public class BuilderException extends RuntimeException {

    private final BuilderError error;

    public BuilderException(BuilderError error, String message) {
        super(message);
        this.error = error;
    }
}
