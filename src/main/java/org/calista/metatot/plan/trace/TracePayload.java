package org.calista.metatot.plan.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.metatot.plan.Session;
import org.calista.metatot.plan.SessionMetrics;
import org.calista.metatot.plan.decision.Decision;
import org.calista.metatot.plan.tree.ThoughtNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable record of one completed session: session fields, every node, the decision.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TracePayload {
    @JsonProperty("trace_id")
    public String traceId;
    @JsonProperty("session_id")
    public String sessionId;
    @JsonProperty("created_at")
    public long createdAtEpochMs;

    @JsonProperty("task")
    public String task;
    @JsonProperty("context_summary")
    public String contextSummary;
    @JsonProperty("started_at")
    public long startedAtEpochMs;
    @JsonProperty("ended_at")
    public long endedAtEpochMs;

    @JsonProperty("selected_action")
    public String selectedAction;
    @JsonProperty("selected_path")
    public List<String> selectedPath = new ArrayList<>();
    @JsonProperty("path_efe")
    public double pathEfe;
    @JsonProperty("confidence")
    public double confidence;

    @JsonProperty("metrics")
    public SessionMetrics metrics;
    @JsonProperty("decision")
    public Decision decision;
    @JsonProperty("nodes")
    public List<NodeTrace> nodes = new ArrayList<>();

    public static TracePayload of(Session s, long createdAtEpochMs) {
        TracePayload p = new TracePayload();
        p.traceId = s.traceId();
        p.sessionId = s.sessionId();
        p.createdAtEpochMs = createdAtEpochMs;
        p.task = s.task();
        p.contextSummary = s.contextSummary();
        p.startedAtEpochMs = s.startedAtMs();
        p.endedAtEpochMs = s.endedAtMs();
        p.selectedAction = s.selectedAction();
        p.selectedPath = new ArrayList<>(s.selectedPath());
        p.pathEfe = s.pathEfe();
        p.confidence = s.confidence();
        p.metrics = s.metrics();
        p.decision = s.decision();
        List<NodeTrace> nodes = new ArrayList<>(s.nodes().size());
        for (ThoughtNode n : s.nodes()) nodes.add(NodeTrace.of(n));
        p.nodes = nodes;
        return p;
    }

    public NodeTrace node(String id) {
        if (nodes == null || id == null) return null;
        for (NodeTrace n : nodes) {
            if (id.equals(n.id)) return n;
        }
        return null;
    }
}
