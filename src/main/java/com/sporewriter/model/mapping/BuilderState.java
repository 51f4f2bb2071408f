package com.sporewriter.model.mapping;

/**
 * Lifecycle of a {@link CorrespondenceBuilder} session.
 */
public enum BuilderState {
    IDLE,
    BUILDING,
    COMPLETE,
    CANCELLED
}
