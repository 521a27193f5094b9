package org.calista.metatot.plan.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StopReason {
    /** maxIterations reached. */
    ITERATIONS,
    DEADLINE,
    CANCELLED,
    /** No expandable node left in the tree. */
    EXHAUSTED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
