package org.calista.metatot.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.metatot.plan.decision.Decision;

import java.util.Objects;

/**
 * Structured result of {@link MetaToT#run}. Callers always get one of these;
 * degraded outcomes are expressed through nulls and {@link #error()}.
 */
@JsonPropertyOrder({"decision", "session", "selected_action", "path_efe", "confidence", "trace_id", "error"})
public final class PlanResult {

    private final Decision decision;
    private final Session session;
    private final String selectedAction;
    private final Double pathEfe;
    private final Double confidence;
    private final String traceId;
    private final PlanError error;

    private PlanResult(Decision decision, Session session, String selectedAction,
                       Double pathEfe, Double confidence, String traceId, PlanError error) {
        this.decision = Objects.requireNonNull(decision, "decision");
        this.session = session;
        this.selectedAction = selectedAction;
        this.pathEfe = pathEfe;
        this.confidence = confidence;
        this.traceId = traceId;
        this.error = error;
    }

    public static PlanResult direct(Decision decision) {
        return new PlanResult(decision, null, null, null, null, null, null);
    }

    public static PlanResult noViableBranches(Decision decision) {
        return new PlanResult(decision, null, null, null, null, null, PlanError.NO_VIABLE_BRANCHES);
    }

    public static PlanResult success(Decision decision, Session session, String traceId) {
        Objects.requireNonNull(session, "session");
        return new PlanResult(decision, session, session.selectedAction(),
                session.pathEfe(), session.confidence(), traceId, null);
    }

    @JsonProperty("decision")
    public Decision decision() { return decision; }

    /** Null for direct mode and for NoViableBranches. */
    @JsonProperty("session")
    public Session session() { return session; }

    @JsonProperty("selected_action")
    public String selectedAction() { return selectedAction; }

    @JsonProperty("path_efe")
    public Double pathEfe() { return pathEfe; }

    @JsonProperty("confidence")
    public Double confidence() { return confidence; }

    @JsonProperty("trace_id")
    public String traceId() { return traceId; }

    @JsonProperty("error")
    public PlanError error() { return error; }

    @JsonIgnore
    public boolean isDirect() {
        return !decision.isDeepSearch();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return session != null && error == null;
    }

    @Override
    public String toString() {
        return "PlanResult{mode=" + decision.selectedMode().wire()
                + ", pathEfe=" + pathEfe + ", confidence=" + confidence
                + ", trace=" + traceId + ", error=" + (error == null ? "none" : error.wire()) + '}';
    }
}
