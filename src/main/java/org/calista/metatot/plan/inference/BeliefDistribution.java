package org.calista.metatot.plan.inference;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * BeliefDistribution — фиксированная форма распределения убеждений:
 * имя гипотезы -> вероятность.
 *
 * <p>Проверяется при создании: непустое, значения конечные и неотрицательные,
 * сумма равна 1 с точностью {@link #TOLERANCE}.</p>
 */
public final class BeliefDistribution {

    public static final double TOLERANCE = 1e-6;

    private final Map<String, Double> probabilities;

    private BeliefDistribution(Map<String, Double> probabilities) {
        this.probabilities = Collections.unmodifiableMap(probabilities);
    }

    /**
     * Strict factory: values must already sum to one.
     */
    @JsonCreator
    public static BeliefDistribution of(Map<String, Double> probabilities) {
        LinkedHashMap<String, Double> copy = checkedCopy(probabilities);
        double sum = 0.0;
        for (double v : copy.values()) sum += v;
        if (Math.abs(sum - 1.0) >= TOLERANCE) {
            throw new IllegalArgumentException("beliefs must sum to 1.0 (got " + sum + ")");
        }
        return new BeliefDistribution(copy);
    }

    /**
     * Normalizing factory: raw non-negative weights are scaled to sum to one.
     * Weights are divided by their maximum first, so totals beyond
     * {@link Double#MAX_VALUE} still normalize; the result is re-checked like {@link #of(Map)}.
     */
    public static BeliefDistribution normalized(Map<String, Double> weights) {
        LinkedHashMap<String, Double> copy = checkedCopy(weights);
        double max = 0.0;
        for (double v : copy.values()) max = Math.max(max, v);
        if (!(max > 0.0)) throw new IllegalArgumentException("beliefs have zero total weight");

        double sum = 0.0;
        for (double v : copy.values()) sum += v / max;

        LinkedHashMap<String, Double> out = new LinkedHashMap<>(copy.size() * 2);
        double check = 0.0;
        for (Map.Entry<String, Double> e : copy.entrySet()) {
            double p = (e.getValue() / max) / sum;
            out.put(e.getKey(), p);
            check += p;
        }
        if (!Double.isFinite(check) || Math.abs(check - 1.0) >= TOLERANCE) {
            throw new IllegalArgumentException("beliefs could not be normalized (sum " + check + ")");
        }
        return new BeliefDistribution(out);
    }

    public static BeliefDistribution single(String hypothesis) {
        LinkedHashMap<String, Double> m = new LinkedHashMap<>(2);
        m.put(requireName(hypothesis), 1.0);
        return new BeliefDistribution(m);
    }

    /**
     * Two-hypothesis belief used when a proposal carries only a confidence value.
     */
    public static BeliefDistribution binary(String yes, String no, double pYes) {
        double p = Double.isFinite(pYes) ? Math.max(0.0, Math.min(1.0, pYes)) : 0.5;
        LinkedHashMap<String, Double> m = new LinkedHashMap<>(4);
        m.put(requireName(yes), p);
        m.put(requireName(no), 1.0 - p);
        return new BeliefDistribution(m);
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return probabilities;
    }

    public int size() {
        return probabilities.size();
    }

    public double probability(String hypothesis) {
        Double v = probabilities.get(hypothesis);
        return v == null ? 0.0 : v;
    }

    public double sum() {
        double s = 0.0;
        for (double v : probabilities.values()) s += v;
        return s;
    }

    /** Shannon entropy (nats). */
    public double entropy() {
        double h = 0.0;
        for (double p : probabilities.values()) {
            if (p > 0.0) h -= p * Math.log(p);
        }
        return h;
    }

    /** Entropy divided by log(|beliefs|); 0 for a single hypothesis. */
    public double normalizedEntropy() {
        int n = probabilities.size();
        if (n <= 1) return 0.0;
        double u = entropy() / Math.log(n);
        if (u < 0.0) return 0.0;
        return Math.min(1.0, u);
    }

    private static LinkedHashMap<String, Double> checkedCopy(Map<String, Double> raw) {
        Objects.requireNonNull(raw, "beliefs");
        if (raw.isEmpty()) throw new IllegalArgumentException("beliefs must name at least one hypothesis");

        LinkedHashMap<String, Double> copy = new LinkedHashMap<>(raw.size() * 2);
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            String k = requireName(e.getKey());
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v) || v < 0.0) {
                throw new IllegalArgumentException("belief '" + k + "' must be a finite non-negative number (got " + v + ")");
            }
            copy.put(k, v);
        }
        return copy;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("hypothesis name must not be blank");
        return name.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BeliefDistribution)) return false;
        return probabilities.equals(((BeliefDistribution) o).probabilities);
    }

    @Override
    public int hashCode() {
        return probabilities.hashCode();
    }

    @Override
    public String toString() {
        return probabilities.toString();
    }
}
