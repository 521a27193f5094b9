package org.calista.metatot.plan.engine.impl;

import org.calista.metatot.plan.candidate.CandidateGenerator;
import org.calista.metatot.plan.candidate.ExpansionRequest;
import org.calista.metatot.plan.candidate.Proposal;
import org.calista.metatot.plan.engine.CancellationToken;
import org.calista.metatot.plan.engine.EngineState;
import org.calista.metatot.plan.engine.SearchBudget;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.engine.SearchTask;
import org.calista.metatot.plan.engine.StopReason;
import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.inference.BeliefDistribution;
import org.calista.metatot.plan.inference.DivergenceMetric;
import org.calista.metatot.plan.tree.DomainPhase;
import org.calista.metatot.plan.tree.ThoughtNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MctsSearchEngineTest {

    private static final Map<String, Double> GOAL = Map.of("a", 1.0, "b", 0.0);

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(2, TimeUnit.SECONDS);
    }

    private static SearchTask task(SearchBudget budget) {
        return task(budget, CancellationToken.none());
    }

    private static SearchTask task(SearchBudget budget, CancellationToken token) {
        return new SearchTask("s-test", "Plan the launch", Map.of(), GOAL, budget, token);
    }

    private static Proposal proposal(String content, double a) {
        return new Proposal(content, BeliefDistribution.of(Map.of("a", a, "b", 1.0 - a)));
    }

    /** Fills every expansion to its cap; beliefs vary by position so branches differ. */
    private static CandidateGenerator varied() {
        return req -> {
            List<Proposal> out = new ArrayList<>();
            for (int i = 0; i < req.maxProposals(); i++) {
                double a = 0.3 + 0.6 * (i + 1) / (req.maxProposals() + 1.0) * ((req.depth() % 2 == 0) ? 1.0 : 0.9);
                out.add(proposal(req.nodeId() + "#" + i, a));
            }
            return out;
        };
    }

    @Test
    void testSearch_AllExpansionsEmptyIsNoViableBranches() {
        MctsSearchEngine engine = new MctsSearchEngine(req -> List.of(), new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().build()));

        assertTrue(out.noViableBranches());
        assertEquals(StopReason.EXHAUSTED, out.stopReason());
        assertEquals(1, out.iterations());
        assertEquals(1, out.failedExpansions());
        assertTrue(Double.isNaN(out.pathEfe()));
        assertEquals(1, out.tree().size());
        assertTrue(out.tree().root().isFailed());
    }

    @Test
    void testSearch_SingleChildPathEfeCosine() {
        CandidateGenerator gen = req -> List.of(proposal("only", 0.5));
        MctsSearchEngine engine = new MctsSearchEngine(gen, new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().maxDepth(1).build()));

        double divergence = (1.0 - 1.0 / Math.sqrt(2.0)) / 2.0;
        assertEquals(2, out.selectedPath().size());
        assertEquals(1.0 + divergence, out.pathEfe(), 1e-9);
        assertEquals(1.0 - (1.0 + divergence) / 2.0, out.confidence(), 1e-9);
        assertEquals(StopReason.EXHAUSTED, out.stopReason());
        assertEquals(DomainPhase.LEAF, out.selectedLeaf().phase());
        assertEquals("only", out.selectedLeaf().content());
    }

    @Test
    void testSearch_SingleChildPathEfeTotalVariation() {
        CandidateGenerator gen = req -> List.of(proposal("only", 0.5));
        MctsSearchEngine engine = new MctsSearchEngine(gen, new ActiveInferenceScorer(DivergenceMetric.TOTAL_VARIATION), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().maxDepth(1).build()));

        assertEquals(1.5, out.pathEfe(), 1e-9);
        assertEquals(0.25, out.confidence(), 1e-9);
    }

    @Test
    void testSearch_TreeInvariantsAndPathAdditivity() {
        MctsSearchEngine engine = new MctsSearchEngine(varied(), new ActiveInferenceScorer(), pool);

        SearchOutcome out = engine.search(task(SearchBudget.builder()
                .maxIterations(25).maxDepth(4).deadlineMs(10_000).build()));

        assertFalse(out.noViableBranches());
        for (ThoughtNode n : out.tree().nodes()) {
            if (n.isRoot()) {
                assertEquals(0, n.depth());
            } else {
                assertEquals(n.parent().depth() + 1, n.depth());
                assertTrue(n.depth() <= 4);
            }
            if (!n.children().isEmpty()) assertTrue(n.visits() >= 1, "visits on " + n.id());
            assertTrue(Math.abs(n.state().beliefs().sum() - 1.0) < 1e-6);
            assertTrue(n.state().freeEnergy() >= 0.0);
        }

        double sum = 0.0;
        List<String> ids = new ArrayList<>();
        for (ThoughtNode n : out.selectedPath()) {
            sum += n.efe();
            ids.add(n.id());
            assertTrue(n.isSelected());
        }
        assertEquals(sum, out.pathEfe(), 1e-12);
        assertTrue(out.tree().isRootToLeafChain(ids));
        assertTrue(out.confidence() >= 0.0 && out.confidence() <= 1.0);
    }

    @Test
    void testSearch_ChildrenRespectPhaseCaps() {
        MctsSearchEngine engine = new MctsSearchEngine(varied(), new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder()
                .maxIterations(40).maxDepth(4).branchingFactor(3).build()));

        ThoughtNode root = out.tree().root();
        assertEquals(3, root.children().size());
        for (ThoughtNode n : out.tree().nodes()) {
            if (n.depth() == 2 || n.depth() == 3) {
                assertTrue(n.children().size() <= 1, "evolve/integrate produce one child: " + n.id());
            }
            if (n.depth() == 4) {
                assertEquals(DomainPhase.LEAF, n.phase());
                assertTrue(n.isTerminal());
            }
        }
    }

    @Test
    void testSearch_IntegrateRequestListsSiblingBranchesOffThePath() {
        // Given
        List<ExpansionRequest> seen = new CopyOnWriteArrayList<>();
        CandidateGenerator base = varied();
        CandidateGenerator recording = req -> {
            seen.add(req);
            return base.expand(req);
        };
        MctsSearchEngine engine = new MctsSearchEngine(recording, new ActiveInferenceScorer(), null);

        // When
        engine.search(task(SearchBudget.builder().maxIterations(10).maxDepth(2).branchingFactor(3).build()));

        // Then
        List<ExpansionRequest> integrate = new ArrayList<>();
        for (ExpansionRequest r : seen) {
            if (r.phase() == DomainPhase.INTEGRATE) integrate.add(r);
            else assertTrue(r.survivingBranches().isEmpty(), "only integrate gets alternatives: " + r);
        }
        assertFalse(integrate.isEmpty());
        for (ExpansionRequest r : integrate) {
            assertEquals(2, r.survivingBranches().size(), "the other two explore children survive: " + r);
            for (String b : r.survivingBranches()) {
                assertFalse(r.path().contains(b));
                assertTrue(b.contains("#"));
            }
        }
    }

    @Test
    void testSearch_DeadlineFinishesInFlightExpansionOnly() {
        CandidateGenerator slow = req -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(proposal(req.nodeId() + "-child", 0.7));
        };
        MctsSearchEngine engine = new MctsSearchEngine(slow, new ActiveInferenceScorer(), pool);

        long t0 = System.nanoTime();
        SearchOutcome out = engine.search(task(SearchBudget.builder().deadlineMs(50).maxIterations(100).build()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertEquals(StopReason.DEADLINE, out.stopReason());
        assertEquals(1, out.iterations());
        assertEquals(1, out.expansions());
        assertTrue(elapsedMs < 50 + 200 + 1000, "overran deadline: " + elapsedMs + "ms");
        assertFalse(out.noViableBranches());
    }

    @Test
    void testSearch_PerCallTimeoutTreatsExpansionAsFailed() {
        CandidateGenerator hanging = req -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(proposal("late", 0.9));
        };
        MctsSearchEngine engine = new MctsSearchEngine(hanging, new ActiveInferenceScorer(), pool);

        SearchOutcome out = engine.search(task(SearchBudget.builder().callTimeoutMs(50).build()));

        assertTrue(out.noViableBranches());
        assertEquals(1, out.failedExpansions());
        assertEquals(1, out.tree().size());
    }

    @Test
    void testSearch_CancelledBeforeStart() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        MctsSearchEngine engine = new MctsSearchEngine(varied(), new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().build(), token));

        assertEquals(StopReason.CANCELLED, out.stopReason());
        assertEquals(0, out.iterations());
        assertTrue(out.noViableBranches());
    }

    @Test
    void testSearch_CancelledMidRunKeepsExistingTree() {
        CancellationToken token = new CancellationToken();
        CandidateGenerator cancelling = req -> {
            token.cancel();
            return List.of(proposal("a", 0.6), proposal("b", 0.8));
        };
        MctsSearchEngine engine = new MctsSearchEngine(cancelling, new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().build(), token));

        assertEquals(StopReason.CANCELLED, out.stopReason());
        assertEquals(1, out.iterations());
        assertEquals(3, out.tree().size());
        assertEquals("b", out.selectedLeaf().content());
    }

    @Test
    void testSearch_TiesBrokenByLowestOrdinal() {
        CandidateGenerator same = req -> {
            List<Proposal> out = new ArrayList<>();
            for (int i = 0; i < req.maxProposals(); i++) out.add(proposal(req.nodeId() + "#" + i, 0.6));
            return out;
        };
        MctsSearchEngine engine = new MctsSearchEngine(same, new ActiveInferenceScorer(), null);

        SearchOutcome out = engine.search(task(SearchBudget.builder().maxDepth(2).build()));

        assertEquals(StopReason.EXHAUSTED, out.stopReason());
        assertEquals(1, out.selectedPath().get(1).ordinal());
    }

    @Test
    void testSearch_SiblingsExpandConcurrently() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CandidateGenerator tracking = req -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            List<Proposal> out = new ArrayList<>();
            for (int i = 0; i < req.maxProposals(); i++) out.add(proposal(req.nodeId() + "#" + i, 0.55 + 0.1 * i));
            return out;
        };
        MctsSearchEngine engine = new MctsSearchEngine(tracking, new ActiveInferenceScorer(), pool);

        SearchOutcome out = engine.search(task(SearchBudget.builder()
                .maxIterations(2).maxDepth(3).parallelExpansions(3).deadlineMs(10_000).build()));

        assertEquals(2, out.iterations());
        assertEquals(4, out.expansions());
        assertTrue(peak.get() >= 2, "peak concurrency " + peak.get());
    }

    @Test
    void testSearch_ReportsStateTransitions() {
        List<EngineState> seen = Collections.synchronizedList(new ArrayList<>());
        MctsSearchEngine engine = new MctsSearchEngine(req -> List.of(proposal("x", 0.9)),
                new ActiveInferenceScorer(), null, seen::add);

        engine.search(task(SearchBudget.builder().maxDepth(1).build()));

        assertEquals(EngineState.IDLE, seen.get(0));
        assertTrue(seen.contains(EngineState.SELECTING));
        assertTrue(seen.contains(EngineState.EXPANDING));
        assertTrue(seen.contains(EngineState.BACKING_UP));
        assertEquals(EngineState.FINALIZING, seen.get(seen.size() - 2));
        assertEquals(EngineState.DONE, seen.get(seen.size() - 1));
    }

    @Test
    void testConfidence_NormalizedAndClamped() {
        assertEquals(0.5, MctsSearchEngine.confidence(1.0, 1), 1e-12);
        assertEquals(0.75, MctsSearchEngine.confidence(1.0, 2), 1e-12);
        assertEquals(0.0, MctsSearchEngine.confidence(5.0, 1));
        assertEquals(0.0, MctsSearchEngine.confidence(0.0, 0));
    }
}
