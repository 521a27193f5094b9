package org.calista.metatot.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named, handled outcomes of a run. Not exceptions.
 */
public enum PlanError {
    /** Every expansion of the root failed; the caller falls back to single-shot reasoning. */
    NO_VIABLE_BRANCHES("NoViableBranches");

    private final String wire;

    PlanError(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
