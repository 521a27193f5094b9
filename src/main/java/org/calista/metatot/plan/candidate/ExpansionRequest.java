package org.calista.metatot.plan.candidate;

import org.calista.metatot.plan.tree.DomainPhase;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a generator needs to expand one node. Immutable snapshot,
 * safe to hand to a worker thread.
 */
public final class ExpansionRequest {

    private final String sessionId;
    private final String task;
    private final Map<String, Object> context;
    private final Map<String, Double> goal;
    private final String nodeId;
    private final String nodeContent;
    private final int depth;
    private final DomainPhase phase;
    private final List<String> path;
    private final List<String> survivingBranches;
    private final int maxProposals;

    public ExpansionRequest(String sessionId,
                            String task,
                            Map<String, Object> context,
                            Map<String, Double> goal,
                            String nodeId,
                            String nodeContent,
                            int depth,
                            DomainPhase phase,
                            List<String> path,
                            int maxProposals) {
        this(sessionId, task, context, goal, nodeId, nodeContent, depth, phase, path, List.of(), maxProposals);
    }

    public ExpansionRequest(String sessionId,
                            String task,
                            Map<String, Object> context,
                            Map<String, Double> goal,
                            String nodeId,
                            String nodeContent,
                            int depth,
                            DomainPhase phase,
                            List<String> path,
                            List<String> survivingBranches,
                            int maxProposals) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.task = Objects.requireNonNull(task, "task");
        this.context = (context == null) ? Map.of() : context;
        this.goal = Objects.requireNonNull(goal, "goal");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.nodeContent = Objects.requireNonNull(nodeContent, "nodeContent");
        this.depth = depth;
        this.phase = Objects.requireNonNull(phase, "phase");
        this.path = (path == null) ? List.of() : List.copyOf(path);
        this.survivingBranches = (survivingBranches == null) ? List.of() : List.copyOf(survivingBranches);
        if (maxProposals < 1) throw new IllegalArgumentException("maxProposals must be >= 1");
        this.maxProposals = maxProposals;
    }

    public String sessionId() { return sessionId; }

    public String task() { return task; }

    public Map<String, Object> context() { return context; }

    public Map<String, Double> goal() { return goal; }

    public String nodeId() { return nodeId; }

    /** Thought of the node being expanded (the current best on its path). */
    public String nodeContent() { return nodeContent; }

    public int depth() { return depth; }

    public DomainPhase phase() { return phase; }

    /** Thoughts from root to the expanded node, inclusive. */
    public List<String> path() { return path; }

    /**
     * Best live alternatives branching off {@link #path()}, strongest first.
     * Filled for integrate expansions; empty otherwise.
     */
    public List<String> survivingBranches() { return survivingBranches; }

    public int maxProposals() { return maxProposals; }

    @Override
    public String toString() {
        return "ExpansionRequest{" + nodeId + ", depth=" + depth + ", phase=" + phase.wire() + ", max=" + maxProposals + '}';
    }
}
