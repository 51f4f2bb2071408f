package com.sporewriter.exception;

/**
 * Failures that stop a rewrite before it starts.
 */
public enum RewriteError {
    AMBIGUOUS_GLUING,
    INVALID_GLUING_REFERENCE,
    /** The new nodes would need ids above {@link Integer#MAX_VALUE}. */
    NODE_IDS_EXHAUSTED
}
