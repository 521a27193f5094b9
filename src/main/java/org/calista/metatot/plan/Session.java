package org.calista.metatot.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.metatot.plan.decision.Decision;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.tree.ThoughtNode;
import org.calista.metatot.plan.tree.ThoughtTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Session — один завершённый прогон планирования.
 *
 * <p>Создаётся после извлечения лучшего пути и далее неизменяем.
 * Инвариант: selected_path это цепочка root→leaf, существующая в дереве сессии.</p>
 */
@JsonPropertyOrder({"session_id", "task", "context_summary", "started_at", "ended_at",
        "selected_action", "selected_path", "path_efe", "confidence", "metrics", "trace_id"})
public final class Session {

    private static final int SUMMARY_CHARS = 300;

    private final String sessionId;
    private final String task;
    private final String contextSummary;
    private final long startedAtMs;
    private final long endedAtMs;
    private final String selectedAction;
    private final List<String> selectedPath;
    private final double pathEfe;
    private final double confidence;
    private final SessionMetrics metrics;
    private final Decision decision;
    private final String traceId;
    private final ThoughtTree tree;

    /**
     * Builds the immutable session from a finalized search.
     *
     * @throws IllegalStateException if the outcome has no selected path or the path is not a root-to-leaf chain
     */
    public static Session of(String traceId, String task, Map<String, Object> context, Decision decision, SearchOutcome outcome) {
        return new Session(traceId, task, context, decision, outcome);
    }

    private Session(String traceId, String task, Map<String, Object> context, Decision decision, SearchOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome.noViableBranches()) throw new IllegalStateException("no selected path to build a session from");

        this.tree = outcome.tree();
        this.sessionId = tree.sessionId();
        this.task = Objects.requireNonNull(task, "task");
        this.contextSummary = summarize(context);
        this.startedAtMs = outcome.startedAtMs();
        this.endedAtMs = outcome.endedAtMs();
        this.selectedAction = outcome.selectedLeaf().content();

        List<String> ids = new ArrayList<>(outcome.selectedPath().size());
        for (ThoughtNode n : outcome.selectedPath()) ids.add(n.id());
        if (!tree.isRootToLeafChain(ids)) {
            throw new IllegalStateException("selected path is not a root-to-leaf chain of session " + sessionId + ": " + ids);
        }
        this.selectedPath = List.copyOf(ids);
        this.pathEfe = outcome.pathEfe();
        this.confidence = outcome.confidence();
        this.metrics = SessionMetrics.of(outcome);
        this.decision = Objects.requireNonNull(decision, "decision");
        this.traceId = Objects.requireNonNull(traceId, "traceId");
    }

    @JsonProperty("session_id")
    public String sessionId() { return sessionId; }

    @JsonProperty("task")
    public String task() { return task; }

    @JsonProperty("context_summary")
    public String contextSummary() { return contextSummary; }

    @JsonProperty("started_at")
    public long startedAtMs() { return startedAtMs; }

    @JsonProperty("ended_at")
    public long endedAtMs() { return endedAtMs; }

    @JsonProperty("selected_action")
    public String selectedAction() { return selectedAction; }

    @JsonProperty("selected_path")
    public List<String> selectedPath() { return selectedPath; }

    @JsonProperty("path_efe")
    public double pathEfe() { return pathEfe; }

    @JsonProperty("confidence")
    public double confidence() { return confidence; }

    @JsonProperty("metrics")
    public SessionMetrics metrics() { return metrics; }

    /** The gating decision; serialized at the result level, not twice. */
    @JsonIgnore
    public Decision decision() { return decision; }

    @JsonProperty("trace_id")
    public String traceId() { return traceId; }

    /** Node set of the session, in creation order. */
    @JsonIgnore
    public List<ThoughtNode> nodes() { return tree.nodes(); }

    @JsonIgnore
    public ThoughtTree tree() { return tree; }

    @JsonIgnore
    public List<ThoughtNode> selectedNodes() {
        List<ThoughtNode> out = new ArrayList<>(selectedPath.size());
        for (String id : selectedPath) out.add(tree.node(id));
        return out;
    }

    static String summarize(Map<String, Object> context) {
        if (context == null || context.isEmpty()) return "";
        StringJoiner j = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, Object> e : context.entrySet()) {
            String v = String.valueOf(e.getValue());
            if (v.length() > 60) v = v.substring(0, 60) + "…";
            j.add(e.getKey() + "=" + v);
        }
        String s = j.toString();
        return s.length() <= SUMMARY_CHARS ? s : s.substring(0, SUMMARY_CHARS) + "…";
    }

    @Override
    public String toString() {
        return "Session{" + sessionId + ", path=" + selectedPath.size() + ", pathEfe=" + pathEfe
                + ", confidence=" + confidence + ", trace=" + traceId + '}';
    }
}
