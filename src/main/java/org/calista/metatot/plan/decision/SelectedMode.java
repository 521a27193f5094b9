package org.calista.metatot.plan.decision;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SelectedMode {
    DIRECT("direct"),
    DEEP_SEARCH("deep_search");

    private final String wire;

    SelectedMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
