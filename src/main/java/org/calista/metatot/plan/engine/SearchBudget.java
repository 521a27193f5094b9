package org.calista.metatot.plan.engine;

/**
 * SearchBudget — иммутабельные ручки одного прогона поиска.
 * Builder + validate(), как ExplorationConfig в ретривере.
 */
public final class SearchBudget {

    public final int maxIterations;
    public final int maxDepth;
    public final long deadlineMs;
    public final double explorationConstant;
    public final int branchingFactor;
    public final double unexploredMalus;
    public final int parallelExpansions;
    public final boolean cyclePhases;
    public final long callTimeoutMs;

    private SearchBudget(Builder b) {
        this.maxIterations = b.maxIterations;
        this.maxDepth = b.maxDepth;
        this.deadlineMs = b.deadlineMs;
        this.explorationConstant = b.explorationConstant;
        this.branchingFactor = b.branchingFactor;
        this.unexploredMalus = b.unexploredMalus;
        this.parallelExpansions = b.parallelExpansions;
        this.cyclePhases = b.cyclePhases;
        this.callTimeoutMs = b.callTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxIterations(maxIterations)
                .maxDepth(maxDepth)
                .deadlineMs(deadlineMs)
                .explorationConstant(explorationConstant)
                .branchingFactor(branchingFactor)
                .unexploredMalus(unexploredMalus)
                .parallelExpansions(parallelExpansions)
                .cyclePhases(cyclePhases)
                .callTimeoutMs(callTimeoutMs);
    }

    public static final class Builder {
        private int maxIterations = 32;
        private int maxDepth = 4;
        private long deadlineMs = 5000;
        private double explorationConstant = 1.41;
        private int branchingFactor = 3;
        private double unexploredMalus = 0.5;
        private int parallelExpansions = 3;
        private boolean cyclePhases = true;
        private long callTimeoutMs = 4000;

        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder maxDepth(int v) { this.maxDepth = v; return this; }
        public Builder deadlineMs(long v) { this.deadlineMs = v; return this; }
        public Builder explorationConstant(double v) { this.explorationConstant = v; return this; }
        public Builder branchingFactor(int v) { this.branchingFactor = v; return this; }
        public Builder unexploredMalus(double v) { this.unexploredMalus = v; return this; }
        public Builder parallelExpansions(int v) { this.parallelExpansions = v; return this; }
        public Builder cyclePhases(boolean v) { this.cyclePhases = v; return this; }
        public Builder callTimeoutMs(long v) { this.callTimeoutMs = v; return this; }

        public SearchBudget build() {
            if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
            if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
            if (deadlineMs < 1) throw new IllegalArgumentException("deadlineMs must be >= 1");
            if (!Double.isFinite(explorationConstant) || explorationConstant < 0.0)
                throw new IllegalArgumentException("explorationConstant must be finite and >= 0");
            if (branchingFactor < 1) throw new IllegalArgumentException("branchingFactor must be >= 1");
            if (!Double.isFinite(unexploredMalus) || unexploredMalus < 0.0)
                throw new IllegalArgumentException("unexploredMalus must be finite and >= 0");
            if (parallelExpansions < 1) throw new IllegalArgumentException("parallelExpansions must be >= 1");
            if (callTimeoutMs < 1) throw new IllegalArgumentException("callTimeoutMs must be >= 1");
            return new SearchBudget(this);
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{iter=" + maxIterations + ", depth=" + maxDepth + ", deadlineMs=" + deadlineMs
                + ", c=" + explorationConstant + ", branching=" + branchingFactor + ", malus=" + unexploredMalus
                + ", parallel=" + parallelExpansions + ", cycle=" + cyclePhases + ", callTimeoutMs=" + callTimeoutMs + '}';
    }
}
