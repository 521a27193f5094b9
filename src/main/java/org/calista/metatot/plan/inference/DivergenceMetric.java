package org.calista.metatot.plan.inference;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Distance between a belief vector and the caller's goal vector, normalized to [0,1].
 * Keys missing on either side count as zero.
 *
 * <p>The two metrics disagree noticeably on the same input, so EFE values are only
 * comparable under one metric. For beliefs {@code {a:0.5, b:0.5}} against goal
 * {@code {a:1, b:0}} (normalized entropy 1.0):</p>
 * <ul>
 *   <li>{@link #COSINE} (the default): divergence ≈ 0.146, EFE ≈ 1.146</li>
 *   <li>{@link #TOTAL_VARIATION}: divergence 0.5, EFE 1.5</li>
 * </ul>
 * <p>Select the metric with {@code scoring.divergence} in the config or
 * {@link ActiveInferenceScorer#ActiveInferenceScorer(DivergenceMetric)}.</p>
 */
public enum DivergenceMetric {

    /** (1 - cos_sim) clamped to [0,2], then halved. */
    COSINE {
        @Override
        public double divergence(BeliefDistribution beliefs, Map<String, Double> goal) {
            Set<String> keys = union(beliefs, goal);
            double dot = 0.0, nb = 0.0, ng = 0.0;
            for (String k : keys) {
                double b = beliefs.probability(k);
                double g = weight(goal, k);
                dot += b * g;
                nb += b * b;
                ng += g * g;
            }
            if (nb <= 0.0 || ng <= 0.0) {
                throw new IllegalArgumentException("divergence undefined for zero-norm vectors");
            }
            double cos = dot / (Math.sqrt(nb) * Math.sqrt(ng));
            double d = 1.0 - cos;
            if (d < 0.0) d = 0.0;
            if (d > 2.0) d = 2.0;
            return d / 2.0;
        }
    },

    /** Half L1 distance to the goal rescaled as a distribution (absolute weights). */
    TOTAL_VARIATION {
        @Override
        public double divergence(BeliefDistribution beliefs, Map<String, Double> goal) {
            double total = 0.0;
            for (Double v : goal.values()) total += Math.abs(v == null ? 0.0 : v);
            if (total <= 0.0) throw new IllegalArgumentException("divergence undefined for zero-norm goal");

            double l1 = 0.0;
            for (String k : union(beliefs, goal)) {
                l1 += Math.abs(beliefs.probability(k) - Math.abs(weight(goal, k)) / total);
            }
            double d = l1 / 2.0;
            return Math.max(0.0, Math.min(1.0, d));
        }
    };

    public abstract double divergence(BeliefDistribution beliefs, Map<String, Double> goal);

    private static Set<String> union(BeliefDistribution beliefs, Map<String, Double> goal) {
        Set<String> keys = new LinkedHashSet<>(beliefs.asMap().keySet());
        keys.addAll(goal.keySet());
        return keys;
    }

    private static double weight(Map<String, Double> goal, String k) {
        Double v = goal.get(k);
        return v == null ? 0.0 : v;
    }
}
