package com.sporewriter.exception;

/**
 * Reasons a single correspondence assignment is rejected.
 */
public enum BuilderError {
    DOMAIN_EXHAUSTED,
    DUPLICATE_TARGET
}
