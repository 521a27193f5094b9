package org.calista.metatot.plan.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable output of the decision gate, created once per incoming task.
 */
public final class Decision {

    private final String task;
    private final double complexityScore;
    private final double uncertaintyScore;
    private final DecisionThresholds thresholds;
    private final SelectedMode selectedMode;
    private final String rationale;

    @JsonCreator
    public Decision(@JsonProperty("task") String task,
                    @JsonProperty("complexity_score") double complexityScore,
                    @JsonProperty("uncertainty_score") double uncertaintyScore,
                    @JsonProperty("thresholds") DecisionThresholds thresholds,
                    @JsonProperty("selected_mode") SelectedMode selectedMode,
                    @JsonProperty("rationale") String rationale) {
        this.task = Objects.requireNonNull(task, "task");
        this.complexityScore = complexityScore;
        this.uncertaintyScore = uncertaintyScore;
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.selectedMode = Objects.requireNonNull(selectedMode, "selectedMode");
        this.rationale = Objects.requireNonNull(rationale, "rationale");
    }

    /** Task reference: the task text, clipped. */
    @JsonProperty("task")
    public String task() { return task; }

    @JsonProperty("complexity_score")
    public double complexityScore() { return complexityScore; }

    @JsonProperty("uncertainty_score")
    public double uncertaintyScore() { return uncertaintyScore; }

    @JsonProperty("thresholds")
    public DecisionThresholds thresholds() { return thresholds; }

    @JsonProperty("selected_mode")
    public SelectedMode selectedMode() { return selectedMode; }

    @JsonProperty("rationale")
    public String rationale() { return rationale; }

    @JsonIgnore
    public boolean isDeepSearch() {
        return selectedMode == SelectedMode.DEEP_SEARCH;
    }

    @Override
    public String toString() {
        return "Decision{" + selectedMode.wire() + ", c=" + complexityScore + ", u=" + uncertaintyScore
                + ", " + thresholds + ", rationale='" + rationale + "'}";
    }
}
