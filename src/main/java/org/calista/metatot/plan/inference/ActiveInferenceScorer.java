package org.calista.metatot.plan.inference;

import java.util.Map;
import java.util.Objects;

/**
 * Pure scoring: EFE = uncertainty + goal divergence, score = -EFE.
 * Stateless and safe to share across sessions.
 * Absolute EFE values depend on the {@link DivergenceMetric}; see its docs for a worked example.
 */
public final class ActiveInferenceScorer {

    private final DivergenceMetric metric;

    public ActiveInferenceScorer() {
        this(DivergenceMetric.COSINE);
    }

    public ActiveInferenceScorer(DivergenceMetric metric) {
        this.metric = Objects.requireNonNull(metric, "metric");
    }

    public DivergenceMetric metric() {
        return metric;
    }

    public ActiveInferenceState score(BeliefDistribution beliefs, Map<String, Double> goal, int reasoningLevel) {
        Objects.requireNonNull(beliefs, "beliefs");
        Objects.requireNonNull(goal, "goal");
        if (goal.isEmpty()) throw new IllegalArgumentException("goal vector must not be empty");

        double uncertainty = beliefs.normalizedEntropy();
        double divergence = metric.divergence(beliefs, goal);
        double efe = uncertainty + divergence;
        double precision = 1.0 / (uncertainty + ActiveInferenceState.PRECISION_EPS);

        return new ActiveInferenceState(divergence, efe, uncertainty, precision, beliefs, reasoningLevel);
    }

    /**
     * Raw-map entry point. An empty map is a precondition violation.
     */
    public ActiveInferenceState score(Map<String, Double> beliefs, Map<String, Double> goal, int reasoningLevel) {
        return score(BeliefDistribution.of(beliefs), goal, reasoningLevel);
    }

    public double efe(BeliefDistribution beliefs, Map<String, Double> goal) {
        return score(beliefs, goal, 0).efe();
    }
}
