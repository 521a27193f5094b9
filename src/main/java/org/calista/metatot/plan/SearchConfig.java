package org.calista.metatot.plan;

/**
 * Per-request overrides. Null fields fall back to the orchestrator defaults.
 */
public final class SearchConfig {

    public final Integer maxIterations;
    public final Integer maxDepth;
    public final Long deadlineMs;
    public final Double complexityThreshold;
    public final Double uncertaintyThreshold;

    private SearchConfig(Builder b) {
        this.maxIterations = b.maxIterations;
        this.maxDepth = b.maxDepth;
        this.deadlineMs = b.deadlineMs;
        this.complexityThreshold = b.complexityThreshold;
        this.uncertaintyThreshold = b.uncertaintyThreshold;
    }

    public static SearchConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer maxIterations;
        private Integer maxDepth;
        private Long deadlineMs;
        private Double complexityThreshold;
        private Double uncertaintyThreshold;

        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder maxDepth(int v) { this.maxDepth = v; return this; }
        public Builder deadlineMs(long v) { this.deadlineMs = v; return this; }
        /** T_c. */
        public Builder complexityThreshold(double v) { this.complexityThreshold = v; return this; }
        /** T_u. */
        public Builder uncertaintyThreshold(double v) { this.uncertaintyThreshold = v; return this; }

        public SearchConfig build() {
            return new SearchConfig(this);
        }
    }

    void validate() {
        if (maxIterations != null && maxIterations < 1) throw new IllegalArgumentException("max_iterations must be >= 1");
        if (maxDepth != null && maxDepth < 1) throw new IllegalArgumentException("max_depth must be >= 1");
        if (deadlineMs != null && deadlineMs < 1) throw new IllegalArgumentException("deadline_ms must be >= 1");
        checkThreshold("T_c", complexityThreshold);
        checkThreshold("T_u", uncertaintyThreshold);
    }

    private static void checkThreshold(String name, Double v) {
        if (v != null && (!Double.isFinite(v) || v < 0.0 || v > 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0,1] (got " + v + ")");
        }
    }
}
