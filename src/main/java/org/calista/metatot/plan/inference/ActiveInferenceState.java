package org.calista.metatot.plan.inference;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * ActiveInferenceState — неизменяемый снимок убеждений узла.
 *
 * <ul>
 *   <li>surprise = нормированная энтропия beliefs (эпистемический член)</li>
 *   <li>prediction_error = расхождение с целью (прагматический член)</li>
 *   <li>free_energy = EFE = surprise + prediction_error</li>
 *   <li>precision = 1 / (surprise + 0.001)</li>
 * </ul>
 */
public final class ActiveInferenceState {

    static final double PRECISION_EPS = 0.001;

    private final double predictionError;
    private final double freeEnergy;
    private final double surprise;
    private final double precision;
    private final BeliefDistribution beliefs;
    private final int reasoningLevel;

    @JsonCreator
    public ActiveInferenceState(@JsonProperty("prediction_error") double predictionError,
                                @JsonProperty("free_energy") double freeEnergy,
                                @JsonProperty("surprise") double surprise,
                                @JsonProperty("precision") double precision,
                                @JsonProperty("beliefs") Map<String, Double> beliefs,
                                @JsonProperty("reasoning_level") int reasoningLevel) {
        this(predictionError, freeEnergy, surprise, precision, BeliefDistribution.of(beliefs), reasoningLevel);
    }

    ActiveInferenceState(double predictionError,
                         double freeEnergy,
                         double surprise,
                         double precision,
                         BeliefDistribution beliefs,
                         int reasoningLevel) {
        if (!(predictionError >= 0.0) || !(freeEnergy >= 0.0) || !(surprise >= 0.0)) {
            throw new IllegalArgumentException("prediction_error, free_energy and surprise must be >= 0");
        }
        if (!(precision > 0.0)) throw new IllegalArgumentException("precision must be > 0");
        if (reasoningLevel < 0) throw new IllegalArgumentException("reasoning_level must be >= 0");
        this.predictionError = predictionError;
        this.freeEnergy = freeEnergy;
        this.surprise = surprise;
        this.precision = precision;
        this.beliefs = Objects.requireNonNull(beliefs, "beliefs");
        this.reasoningLevel = reasoningLevel;
    }

    /**
     * Root state: a single certain hypothesis, EFE 0.
     */
    public static ActiveInferenceState neutral(String hypothesis) {
        return new ActiveInferenceState(0.0, 0.0, 0.0, 1.0 / PRECISION_EPS, BeliefDistribution.single(hypothesis), 0);
    }

    @JsonProperty("prediction_error")
    public double predictionError() { return predictionError; }

    @JsonProperty("free_energy")
    public double freeEnergy() { return freeEnergy; }

    @JsonProperty("surprise")
    public double surprise() { return surprise; }

    @JsonProperty("precision")
    public double precision() { return precision; }

    @JsonProperty("beliefs")
    public Map<String, Double> beliefMap() { return beliefs.asMap(); }

    @JsonIgnore
    public BeliefDistribution beliefs() { return beliefs; }

    @JsonProperty("reasoning_level")
    public int reasoningLevel() { return reasoningLevel; }

    @JsonIgnore
    public double uncertainty() { return surprise; }

    @JsonIgnore
    public double goalDivergence() { return predictionError; }

    @JsonIgnore
    public double efe() { return freeEnergy; }

    /** Search maximizes score; lower EFE is better. */
    @JsonIgnore
    public double score() { return -freeEnergy; }

    @Override
    public String toString() {
        return "ActiveInferenceState{efe=" + String.format(java.util.Locale.ROOT, "%.4f", freeEnergy)
                + ", u=" + String.format(java.util.Locale.ROOT, "%.4f", surprise)
                + ", div=" + String.format(java.util.Locale.ROOT, "%.4f", predictionError)
                + ", level=" + reasoningLevel
                + ", beliefs=" + beliefs + '}';
    }
}
