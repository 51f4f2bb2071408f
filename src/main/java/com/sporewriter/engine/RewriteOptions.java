package com.sporewriter.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for {@link RewriteEngine}.
 */
@Value
@Builder
public class RewriteOptions {

    /**
     * Remove input edges matched by an LHS edge whose endpoints are both kept
     * but are not adjacent in the RHS.
     */
    @Builder.Default
    boolean deleteUnmatchedPatternEdges = false;

    public static RewriteOptions defaults() {
        return RewriteOptions.builder().build();
    }
}
