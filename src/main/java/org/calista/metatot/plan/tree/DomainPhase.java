package org.calista.metatot.plan.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role of an expansion step. LEAF marks nodes created at the depth limit.
 */
public enum DomainPhase {
    EXPLORE,
    CHALLENGE,
    EVOLVE,
    INTEGRATE,
    LEAF;

    private static final DomainPhase[] CYCLE = {EXPLORE, CHALLENGE, EVOLVE, INTEGRATE};

    /**
     * Phase used to expand a node at {@code depth}.
     * The expansion that produces {@code maxDepth} always integrates.
     */
    public static DomainPhase forExpansion(int depth, int maxDepth, boolean cycle) {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        if (depth + 1 >= maxDepth) return INTEGRATE;
        if (cycle) return CYCLE[depth % CYCLE.length];
        return CYCLE[Math.min(depth, CYCLE.length - 1)];
    }

    /** Lower bound of proposals an expansion in this phase asks for. */
    public int minProposals() {
        return this == EXPLORE ? 2 : 1;
    }

    /**
     * Upper bound for an expansion in this phase, capped by the branching factor:
     * explore 2..4, challenge up to the cap, evolve and integrate exactly one.
     */
    public int maxProposals(int branchingFactor) {
        int cap = Math.max(1, branchingFactor);
        switch (this) {
            case EXPLORE:
                return Math.max(minProposals(), Math.min(4, cap));
            case CHALLENGE:
                return cap;
            case EVOLVE:
            case INTEGRATE:
                return 1;
            default:
                throw new IllegalStateException("phase cannot be expanded: " + this);
        }
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DomainPhase fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("phase is null");
        return DomainPhase.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
