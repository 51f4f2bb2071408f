package com.sporewriter.exception;

/**
 * Match validation failures, in the order the checks run.
 */
public enum MatchError {
    INCOMPLETE_MATCH,
    NON_INJECTIVE_MATCH,
    DANGLING_MATCH_TARGET,
    STRUCTURE_NOT_PRESERVED,
    /** Only reported when induced matching is enabled. */
    EXTRA_INPUT_EDGE
}
