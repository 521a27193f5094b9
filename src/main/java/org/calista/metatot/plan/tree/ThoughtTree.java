package org.calista.metatot.plan.tree;

import org.calista.metatot.plan.inference.ActiveInferenceState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ThoughtTree — in-memory tree store of one session.
 *
 * <p>Owned by exactly one search run, never shared across sessions.
 * Nodes are never removed.</p>
 */
public final class ThoughtTree {

    private final String sessionId;
    private final List<ThoughtNode> nodes = new ArrayList<>(64);
    private final Map<String, ThoughtNode> byId = new HashMap<>(128);

    public ThoughtTree(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) throw new IllegalArgumentException("sessionId must not be blank");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    public ThoughtNode createRoot(String content, ActiveInferenceState state) {
        if (!nodes.isEmpty()) throw new IllegalStateException("root already exists");
        ThoughtNode root = new ThoughtNode(nextId(), 0, sessionId, null, DomainPhase.EXPLORE, content, state, false);
        register(root);
        return root;
    }

    public ThoughtNode addChild(ThoughtNode parent,
                                DomainPhase phase,
                                String content,
                                ActiveInferenceState state,
                                boolean terminal) {
        Objects.requireNonNull(parent, "parent");
        if (byId.get(parent.id()) != parent) throw new IllegalStateException("parent not in tree: " + parent.id());
        if (!parent.isExpanded()) throw new IllegalStateException("children only exist for expanded nodes: " + parent.id());

        ThoughtNode child = new ThoughtNode(nextId(), nodes.size(), sessionId, parent, phase, content, state, terminal);
        parent.addChild(child);
        register(child);
        return child;
    }

    public ThoughtNode root() {
        if (nodes.isEmpty()) throw new IllegalStateException("tree has no root");
        return nodes.get(0);
    }

    public ThoughtNode node(String id) {
        return byId.get(id);
    }

    /** Nodes in creation order. */
    public List<ThoughtNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Root-to-node chain.
     */
    public List<ThoughtNode> pathTo(ThoughtNode node) {
        Objects.requireNonNull(node, "node");
        if (byId.get(node.id()) != node) throw new IllegalStateException("node not in tree: " + node.id());
        ArrayList<ThoughtNode> path = new ArrayList<>(node.depth() + 1);
        for (ThoughtNode n = node; n != null; n = n.parent()) path.add(n);
        Collections.reverse(path);
        return path;
    }

    /**
     * Checks that the ids form a root-to-leaf chain of this tree.
     */
    public boolean isRootToLeafChain(List<String> ids) {
        if (ids == null || ids.isEmpty() || nodes.isEmpty()) return false;
        ThoughtNode prev = null;
        for (String id : ids) {
            ThoughtNode n = byId.get(id);
            if (n == null) return false;
            if (prev == null) {
                if (!n.isRoot()) return false;
            } else if (n.parent() != prev) {
                return false;
            }
            prev = n;
        }
        return prev.children().isEmpty();
    }

    /**
     * Structural invariants; throws on the first violation.
     */
    public void validate() {
        for (ThoughtNode n : nodes) {
            if (n.isRoot()) {
                if (n.depth() != 0) throw new IllegalStateException("root depth must be 0");
            } else if (n.depth() != n.parent().depth() + 1) {
                throw new IllegalStateException("depth invariant broken at " + n.id());
            }
            if (!n.children().isEmpty() && n.visits() < 1) {
                throw new IllegalStateException("node with children has no visits: " + n.id());
            }
            if (!n.children().isEmpty() && !n.isExpanded()) {
                throw new IllegalStateException("children on unexpanded node: " + n.id());
            }
        }
    }

    private String nextId() {
        return sessionId + "/n" + nodes.size();
    }

    private void register(ThoughtNode n) {
        nodes.add(n);
        byId.put(n.id(), n);
    }
}
