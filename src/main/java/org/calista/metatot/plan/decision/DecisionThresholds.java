package org.calista.metatot.plan.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * T_c / T_u pair, both in [0,1].
 */
public final class DecisionThresholds {

    private final double complexity;
    private final double uncertainty;

    @JsonCreator
    public DecisionThresholds(@JsonProperty("complexity") double complexity,
                              @JsonProperty("uncertainty") double uncertainty) {
        this.complexity = check("complexity", complexity);
        this.uncertainty = check("uncertainty", uncertainty);
    }

    public static DecisionThresholds of(double complexity, double uncertainty) {
        return new DecisionThresholds(complexity, uncertainty);
    }

    @JsonProperty("complexity")
    public double complexity() { return complexity; }

    @JsonProperty("uncertainty")
    public double uncertainty() { return uncertainty; }

    private static double check(String name, double v) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " threshold must be in [0,1] (got " + v + ")");
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecisionThresholds)) return false;
        DecisionThresholds t = (DecisionThresholds) o;
        return Double.compare(t.complexity, complexity) == 0 && Double.compare(t.uncertainty, uncertainty) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(complexity) + Double.hashCode(uncertainty);
    }

    @Override
    public String toString() {
        return "T_c=" + complexity + ", T_u=" + uncertainty;
    }
}
