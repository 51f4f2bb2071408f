package com.sporewriter.engine;

import com.sporewriter.model.mapping.Correspondence;

/**
 * An LHS to input map that passed {@link MatchValidator}. Only the validator
 * creates these, so holding one means the map was checked at least once.
 */
public final class ValidatedMatch {

    private final Correspondence correspondence;

    ValidatedMatch(Correspondence correspondence) {
        this.correspondence = correspondence;
    }

    public Correspondence correspondence() {
        return correspondence;
    }

    /**
     * Input node matched by {@code lhsId}.
     */
    public int imageOf(int lhsId) {
        return correspondence.get(lhsId)
                .orElseThrow(() -> new IllegalArgumentException("LHS node " + lhsId + " is not matched"));
    }

    @Override
    public String toString() {
        return "ValidatedMatch" + correspondence.assignments();
    }
}
