package org.calista.metatot.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.engine.StopReason;
import org.calista.metatot.plan.tree.ThoughtNode;

/**
 * Aggregates of one session. Totals run over every scored node of the tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SessionMetrics {
    @JsonProperty("total_prediction_error")
    public double totalPredictionError;
    @JsonProperty("total_free_energy")
    public double totalFreeEnergy;
    @JsonProperty("duration_ms")
    public long durationMs;
    @JsonProperty("iterations")
    public int iterations;
    @JsonProperty("node_count")
    public int nodeCount;
    @JsonProperty("expansions")
    public int expansions;
    @JsonProperty("failed_expansions")
    public int failedExpansions;
    @JsonProperty("stop_reason")
    public StopReason stopReason;

    public static SessionMetrics of(SearchOutcome outcome) {
        SessionMetrics m = new SessionMetrics();
        for (ThoughtNode n : outcome.tree().nodes()) {
            m.totalPredictionError += n.state().predictionError();
            m.totalFreeEnergy += n.state().freeEnergy();
        }
        m.durationMs = outcome.durationMs();
        m.iterations = outcome.iterations();
        m.nodeCount = outcome.tree().size();
        m.expansions = outcome.expansions();
        m.failedExpansions = outcome.failedExpansions();
        m.stopReason = outcome.stopReason();
        return m;
    }
}
