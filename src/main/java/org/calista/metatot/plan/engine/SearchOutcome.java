package org.calista.metatot.plan.engine;

import org.calista.metatot.plan.tree.ThoughtNode;
import org.calista.metatot.plan.tree.ThoughtTree;

import java.util.List;
import java.util.Objects;

/**
 * Result of a finalized search. When {@link #noViableBranches()} is true the
 * selected path is empty and path EFE / confidence are NaN.
 */
public final class SearchOutcome {

    private final ThoughtTree tree;
    private final List<ThoughtNode> selectedPath;
    private final double pathEfe;
    private final double confidence;
    private final int iterations;
    private final int expansions;
    private final int failedExpansions;
    private final StopReason stopReason;
    private final long startedAtMs;
    private final long endedAtMs;

    public SearchOutcome(ThoughtTree tree,
                         List<ThoughtNode> selectedPath,
                         double pathEfe,
                         double confidence,
                         int iterations,
                         int expansions,
                         int failedExpansions,
                         StopReason stopReason,
                         long startedAtMs,
                         long endedAtMs) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.selectedPath = List.copyOf(Objects.requireNonNull(selectedPath, "selectedPath"));
        this.pathEfe = pathEfe;
        this.confidence = confidence;
        this.iterations = iterations;
        this.expansions = expansions;
        this.failedExpansions = failedExpansions;
        this.stopReason = Objects.requireNonNull(stopReason, "stopReason");
        this.startedAtMs = startedAtMs;
        this.endedAtMs = endedAtMs;
    }

    public ThoughtTree tree() { return tree; }

    public boolean noViableBranches() { return selectedPath.isEmpty(); }

    /** Root-to-leaf chain, root included. */
    public List<ThoughtNode> selectedPath() { return selectedPath; }

    public ThoughtNode selectedLeaf() {
        return selectedPath.isEmpty() ? null : selectedPath.get(selectedPath.size() - 1);
    }

    public double pathEfe() { return pathEfe; }

    public double confidence() { return confidence; }

    public int iterations() { return iterations; }

    public int expansions() { return expansions; }

    public int failedExpansions() { return failedExpansions; }

    public StopReason stopReason() { return stopReason; }

    public long startedAtMs() { return startedAtMs; }

    public long endedAtMs() { return endedAtMs; }

    public long durationMs() { return Math.max(0L, endedAtMs - startedAtMs); }

    @Override
    public String toString() {
        return "SearchOutcome{nodes=" + tree.size() + ", path=" + selectedPath.size()
                + ", pathEfe=" + pathEfe + ", confidence=" + confidence
                + ", iterations=" + iterations + ", failed=" + failedExpansions
                + ", stop=" + stopReason.wire() + '}';
    }
}
