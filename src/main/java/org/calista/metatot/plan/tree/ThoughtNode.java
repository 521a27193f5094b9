package org.calista.metatot.plan.tree;

import org.calista.metatot.plan.inference.ActiveInferenceState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ThoughtNode — одна ветка дерева.
 *
 * <p>Содержимое, фаза и состояние неизменяемы; статистика (visits, value)
 * меняется только потоком движка во время backup.</p>
 */
public final class ThoughtNode {

    private final String id;
    private final int ordinal;
    private final String sessionId;
    private final ThoughtNode parent;
    private final int depth;
    private final DomainPhase phase;
    private final String content;
    private final ActiveInferenceState state;
    private final boolean terminal;

    private final List<ThoughtNode> children = new ArrayList<>(4);

    private int visits;
    private double valueSum;
    private boolean expanded;
    private boolean failed;
    private boolean selected;

    ThoughtNode(String id,
                int ordinal,
                String sessionId,
                ThoughtNode parent,
                DomainPhase phase,
                String content,
                ActiveInferenceState state,
                boolean terminal) {
        this.id = Objects.requireNonNull(id, "id");
        this.ordinal = ordinal;
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.parent = parent;
        this.depth = (parent == null) ? 0 : parent.depth + 1;
        this.phase = Objects.requireNonNull(phase, "phase");
        this.content = Objects.requireNonNull(content, "content");
        this.state = Objects.requireNonNull(state, "state");
        this.terminal = terminal;
    }

    public String id() { return id; }

    /** Creation order within the session; used for deterministic tie-breaking. */
    public int ordinal() { return ordinal; }

    public String sessionId() { return sessionId; }

    public ThoughtNode parent() { return parent; }

    public String parentId() { return parent == null ? null : parent.id; }

    public int depth() { return depth; }

    public DomainPhase phase() { return phase; }

    public String content() { return content; }

    public ActiveInferenceState state() { return state; }

    public double score() { return state.score(); }

    public double efe() { return state.efe(); }

    public List<ThoughtNode> children() { return Collections.unmodifiableList(children); }

    public boolean isRoot() { return parent == null; }

    public int visits() { return visits; }

    /** Running mean of backed-up values; a never-visited node reports its own score. */
    public double valueEstimate() {
        return visits == 0 ? state.score() : valueSum / visits;
    }

    public boolean isExpanded() { return expanded; }

    /** Created terminal (integrate/leaf) or made terminal by a failed expansion. */
    public boolean isTerminal() { return terminal || failed; }

    public boolean isFailed() { return failed; }

    public boolean isSelected() { return selected; }

    /** Not yet expanded and allowed to be expanded. */
    public boolean isExpandable() { return !expanded && !isTerminal(); }

    // ---------------------------------------------------------------------
    // Mutations (engine thread only)
    // ---------------------------------------------------------------------

    void addChild(ThoughtNode child) {
        if (child.parent != this) throw new IllegalStateException("child " + child.id + " does not belong to " + id);
        if (child.depth != depth + 1) throw new IllegalStateException("depth mismatch for child " + child.id);
        children.add(child);
    }

    public void markExpanded() {
        if (expanded) throw new IllegalStateException("node already expanded: " + id);
        if (isTerminal()) throw new IllegalStateException("terminal node cannot be expanded: " + id);
        expanded = true;
    }

    public void markFailed() {
        failed = true;
    }

    public void recordVisit(double value) {
        if (!Double.isFinite(value)) throw new IllegalArgumentException("backup value must be finite: " + value);
        visits++;
        valueSum += value;
    }

    public void markSelected() {
        selected = true;
    }

    @Override
    public String toString() {
        return "ThoughtNode{" + id + ", d=" + depth + ", " + phase.wire()
                + ", visits=" + visits
                + ", value=" + String.format(java.util.Locale.ROOT, "%.4f", valueEstimate())
                + ", efe=" + String.format(java.util.Locale.ROOT, "%.4f", efe()) + '}';
    }
}
