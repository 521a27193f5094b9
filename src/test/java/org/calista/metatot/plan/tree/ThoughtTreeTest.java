package org.calista.metatot.plan.tree;

import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.inference.ActiveInferenceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThoughtTreeTest {

    private static final Map<String, Double> GOAL = Map.of("a", 1.0, "b", 0.0);

    private ThoughtTree tree;
    private ActiveInferenceState childState;

    @BeforeEach
    void setUp() {
        tree = new ThoughtTree("s1");
        childState = new ActiveInferenceScorer().score(Map.of("a", 0.8, "b", 0.2), GOAL, 1);
    }

    @Test
    void testAddChild_AssignsDepthAndSequentialIds() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));
        root.markExpanded();
        ThoughtNode c1 = tree.addChild(root, DomainPhase.EXPLORE, "first", childState, false);
        ThoughtNode c2 = tree.addChild(root, DomainPhase.EXPLORE, "second", childState, false);

        assertEquals("s1/n0", root.id());
        assertEquals("s1/n1", c1.id());
        assertEquals(2, c2.ordinal());
        assertEquals(1, c1.depth());
        assertEquals(root.id(), c2.parentId());
        assertEquals(List.of(c1, c2), root.children());
        assertSame(c2, tree.node("s1/n2"));
    }

    @Test
    void testAddChild_RequiresExpandedParent() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));

        assertThrows(IllegalStateException.class,
                () -> tree.addChild(root, DomainPhase.EXPLORE, "x", childState, false));
        assertThrows(IllegalStateException.class,
                () -> tree.createRoot("again", ActiveInferenceState.neutral("task")));
    }

    @Test
    void testMarkExpanded_TerminalOrTwiceIsRejected() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));
        root.markExpanded();
        ThoughtNode leaf = tree.addChild(root, DomainPhase.LEAF, "leaf", childState, true);

        assertThrows(IllegalStateException.class, root::markExpanded);
        assertThrows(IllegalStateException.class, leaf::markExpanded);
        assertFalse(leaf.isExpandable());
    }

    @Test
    void testValueEstimate_RunningMeanAfterVisits() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));
        root.markExpanded();
        ThoughtNode c = tree.addChild(root, DomainPhase.EXPLORE, "c", childState, false);

        assertEquals(c.score(), c.valueEstimate());
        c.recordVisit(-1.0);
        c.recordVisit(-0.5);
        assertEquals(2, c.visits());
        assertEquals(-0.75, c.valueEstimate(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> c.recordVisit(Double.NaN));
    }

    @Test
    void testIsRootToLeafChain() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));
        root.markExpanded();
        ThoughtNode a = tree.addChild(root, DomainPhase.EXPLORE, "a", childState, false);
        ThoughtNode b = tree.addChild(root, DomainPhase.EXPLORE, "b", childState, false);
        a.markExpanded();
        ThoughtNode a1 = tree.addChild(a, DomainPhase.CHALLENGE, "a1", childState, false);

        assertTrue(tree.isRootToLeafChain(List.of(root.id(), a.id(), a1.id())));
        assertTrue(tree.isRootToLeafChain(List.of(root.id(), b.id())));
        assertFalse(tree.isRootToLeafChain(List.of(root.id(), a.id())));
        assertFalse(tree.isRootToLeafChain(List.of(a.id(), a1.id())));
        assertFalse(tree.isRootToLeafChain(List.of(root.id(), b.id(), a1.id())));
        assertFalse(tree.isRootToLeafChain(List.of()));
        assertEquals(List.of(root, a, a1), tree.pathTo(a1));
    }

    @Test
    void testValidate_NodeWithChildrenNeedsVisits() {
        ThoughtNode root = tree.createRoot("task", ActiveInferenceState.neutral("task"));
        root.markExpanded();
        tree.addChild(root, DomainPhase.EXPLORE, "a", childState, false);

        assertThrows(IllegalStateException.class, tree::validate);
        root.recordVisit(-0.2);
        assertDoesNotThrow(tree::validate);
    }
}
