package org.calista.metatot.plan.engine.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.metatot.plan.candidate.CandidateGenerator;
import org.calista.metatot.plan.candidate.ExpansionRequest;
import org.calista.metatot.plan.candidate.Proposal;
import org.calista.metatot.plan.engine.EngineState;
import org.calista.metatot.plan.engine.SearchBudget;
import org.calista.metatot.plan.engine.SearchEngine;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.engine.SearchTask;
import org.calista.metatot.plan.engine.StopReason;
import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.inference.ActiveInferenceState;
import org.calista.metatot.plan.tree.DomainPhase;
import org.calista.metatot.plan.tree.ThoughtNode;
import org.calista.metatot.plan.tree.ThoughtTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * MctsSearchEngine — POMCP/MCTS-style planning loop:
 * select (UCB) -> expand (generator, siblings in parallel) -> evaluate (EFE) -> backup -> finalize.
 *
 * <p>Threading: only the calling thread touches the tree. Worker threads run
 * {@link CandidateGenerator#expand} and return proposals; completed expansions
 * are committed and backed up one by one in completion order.</p>
 *
 * <p>Deadline: checked before each iteration. An in-flight batch is always
 * finished (bounded by the per-call timeout), so no partial node is created.</p>
 */
public final class MctsSearchEngine implements SearchEngine {

    private static final Logger log = LogManager.getLogger(MctsSearchEngine.class);

    public static final String ROOT_HYPOTHESIS = "task";

    /** Alternatives listed to an integrate expansion. */
    static final int MAX_SURVIVING_BRANCHES = 6;

    private final CandidateGenerator generator;
    private final ActiveInferenceScorer scorer;
    private final ExecutorService pool; // nullable => inline expansion, no per-call timeout
    private final Consumer<EngineState> stateListener;

    public MctsSearchEngine(CandidateGenerator generator, ActiveInferenceScorer scorer, ExecutorService pool) {
        this(generator, scorer, pool, s -> { });
    }

    public MctsSearchEngine(CandidateGenerator generator,
                            ActiveInferenceScorer scorer,
                            ExecutorService pool,
                            Consumer<EngineState> stateListener) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.pool = pool;
        this.stateListener = Objects.requireNonNull(stateListener, "stateListener");
    }

    @Override
    public SearchOutcome search(SearchTask task) {
        Objects.requireNonNull(task, "task");
        return new Run(task).execute();
    }

    // ---------------------------------------------------------------------
    // One run (owns its tree)
    // ---------------------------------------------------------------------

    private final class Run {
        private final SearchTask task;
        private final SearchBudget budget;
        private final ThoughtTree tree;

        private EngineState state = EngineState.IDLE;
        private int iterations;
        private int expansions;
        private int failed;

        Run(SearchTask task) {
            this.task = task;
            this.budget = task.budget();
            this.tree = new ThoughtTree(task.sessionId());
            stateListener.accept(state);
        }

        SearchOutcome execute() {
            final long startedAtMs = System.currentTimeMillis();
            final long deadlineNs = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budget.deadlineMs);

            ThoughtNode root = tree.createRoot(task.task(), ActiveInferenceState.neutral(ROOT_HYPOTHESIS));
            log.info("search.start budget={}", budget);

            StopReason stop;
            while (true) {
                if (iterations >= budget.maxIterations) {
                    stop = StopReason.ITERATIONS;
                    break;
                }
                if (task.cancellation().isCancelled()) {
                    stop = StopReason.CANCELLED;
                    break;
                }
                if (System.nanoTime() >= deadlineNs) {
                    stop = StopReason.DEADLINE;
                    break;
                }

                transition(EngineState.SELECTING);
                ThoughtNode leaf = select(root);
                if (leaf == null) {
                    stop = StopReason.EXHAUSTED;
                    break;
                }

                List<ThoughtNode> batch = batchFor(leaf);
                iterations++;
                log.debug("iter={} select={} depth={} batch={}", iterations, leaf.id(), leaf.depth(), batch.size());

                if (!expandBatch(batch)) {
                    stop = StopReason.CANCELLED;
                    break;
                }
            }

            transition(EngineState.FINALIZING);
            tree.validate();

            List<ThoughtNode> path = extractBestPath(root);
            double pathEfe = Double.NaN;
            double confidence = Double.NaN;
            if (!path.isEmpty()) {
                pathEfe = 0.0;
                for (ThoughtNode n : path) {
                    n.markSelected();
                    pathEfe += n.efe();
                }
                confidence = confidence(pathEfe, path.size() - 1);
            }

            long endedAtMs = System.currentTimeMillis();
            transition(EngineState.DONE);

            SearchOutcome out = new SearchOutcome(tree, path, pathEfe, confidence,
                    iterations, expansions, failed, stop, startedAtMs, endedAtMs);
            log.info("search.done stop={} iterations={} nodes={} failed={} pathLen={} pathEfe={} confidence={} ms={}",
                    stop.wire(), iterations, tree.size(), failed, path.size(), pathEfe, confidence, out.durationMs());
            return out;
        }

        // ---------------- select ----------------

        private ThoughtNode select(ThoughtNode root) {
            if (!hasOpen(root)) return null;
            ThoughtNode n = root;
            while (!n.isExpandable()) {
                ThoughtNode next = null;
                double bestU = Double.NEGATIVE_INFINITY;
                double lnParent = Math.log(Math.max(1, n.visits()));
                for (ThoughtNode c : n.children()) {
                    if (!hasOpen(c)) continue;
                    double u = (c.visits() == 0)
                            ? Double.POSITIVE_INFINITY
                            : c.valueEstimate() + budget.explorationConstant * Math.sqrt(lnParent / c.visits());
                    // strict '>' keeps the lowest ordinal on ties
                    if (next == null || u > bestU) {
                        next = c;
                        bestU = u;
                    }
                }
                if (next == null) throw new IllegalStateException("open subtree without open child at " + n.id());
                n = next;
            }
            return n;
        }

        private boolean hasOpen(ThoughtNode n) {
            if (n.isExpandable()) return true;
            for (ThoughtNode c : n.children()) {
                if (hasOpen(c)) return true;
            }
            return false;
        }

        private List<ThoughtNode> batchFor(ThoughtNode leaf) {
            List<ThoughtNode> batch = new ArrayList<>(budget.parallelExpansions);
            batch.add(leaf);
            ThoughtNode parent = leaf.parent();
            if (parent == null) return batch;
            for (ThoughtNode s : parent.children()) {
                if (batch.size() >= budget.parallelExpansions) break;
                if (s != leaf && s.isExpandable()) batch.add(s);
            }
            return batch;
        }

        // ---------------- expand ----------------

        /**
         * @return false if the engine thread was interrupted
         */
        private boolean expandBatch(List<ThoughtNode> batch) {
            transition(EngineState.EXPANDING);

            Map<ThoughtNode, ExpansionRequest> requests = new LinkedHashMap<>();
            for (ThoughtNode n : batch) requests.put(n, request(n));

            if (pool == null) {
                for (Map.Entry<ThoughtNode, ExpansionRequest> e : requests.entrySet()) {
                    commit(e.getKey(), generator.expand(e.getValue()));
                }
                return true;
            }

            final Map<String, String> mdc = ThreadContext.getImmutableContext();
            CompletionService<List<Proposal>> ecs = new ExecutorCompletionService<>(pool);
            Map<Future<List<Proposal>>, ThoughtNode> pending = new LinkedHashMap<>();
            for (Map.Entry<ThoughtNode, ExpansionRequest> e : requests.entrySet()) {
                final ExpansionRequest req = e.getValue();
                pending.put(ecs.submit(() -> expandWithContext(req, mdc)), e.getKey());
            }

            final long waitUntil = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budget.callTimeoutMs);
            try {
                while (!pending.isEmpty()) {
                    long remaining = waitUntil - System.nanoTime();
                    Future<List<Proposal>> f = (remaining > 0) ? ecs.poll(remaining, TimeUnit.NANOSECONDS) : ecs.poll();
                    if (f == null) {
                        for (Map.Entry<Future<List<Proposal>>, ThoughtNode> e : pending.entrySet()) {
                            e.getKey().cancel(true);
                            log.warn("expand.timeout node={} timeoutMs={}", e.getValue().id(), budget.callTimeoutMs);
                            commit(e.getValue(), List.of());
                        }
                        pending.clear();
                        break;
                    }
                    ThoughtNode node = pending.remove(f);
                    commit(node, f.get());
                }
                return true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancelAll(pending);
                log.warn("search interrupted; finalizing with {} nodes", tree.size());
                return false;
            } catch (ExecutionException ee) {
                cancelAll(pending);
                Throwable cause = ee.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException("candidate generator failed", cause);
            }
        }

        private ExpansionRequest request(ThoughtNode n) {
            DomainPhase phase = DomainPhase.forExpansion(n.depth(), budget.maxDepth, budget.cyclePhases);
            List<ThoughtNode> nodes = tree.pathTo(n);
            List<String> path = new ArrayList<>(nodes.size());
            for (ThoughtNode p : nodes) path.add(p.content());
            List<String> surviving = (phase == DomainPhase.INTEGRATE) ? survivingBranches(nodes) : List.of();
            return new ExpansionRequest(task.sessionId(), task.task(), task.context(), task.goal(),
                    n.id(), n.content(), n.depth(), phase, path, surviving, phase.maxProposals(budget.branchingFactor));
        }

        /** Non-failed siblings hanging off the path, best value first (ordinal breaks ties). */
        private List<String> survivingBranches(List<ThoughtNode> path) {
            Set<ThoughtNode> onPath = new HashSet<>(path);
            List<ThoughtNode> alive = new ArrayList<>();
            for (int i = 0; i < path.size() - 1; i++) {
                for (ThoughtNode c : path.get(i).children()) {
                    if (!onPath.contains(c) && !c.isFailed()) alive.add(c);
                }
            }
            alive.sort(Comparator.comparingDouble(ThoughtNode::valueEstimate).reversed()
                    .thenComparingInt(ThoughtNode::ordinal));
            List<String> out = new ArrayList<>(Math.min(alive.size(), MAX_SURVIVING_BRANCHES));
            for (ThoughtNode c : alive) {
                if (out.size() >= MAX_SURVIVING_BRANCHES) break;
                out.add(c.content());
            }
            return out;
        }

        private List<Proposal> expandWithContext(ExpansionRequest req, Map<String, String> mdc) {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            ThreadContext.putAll(mdc);
            try {
                return generator.expand(req);
            } finally {
                // CallerRunsPolicy may run this on the engine thread: restore its context
                ThreadContext.clearMap();
                ThreadContext.putAll(previous);
            }
        }

        private void cancelAll(Map<Future<List<Proposal>>, ThoughtNode> pending) {
            for (Future<List<Proposal>> f : pending.keySet()) f.cancel(true);
            pending.clear();
        }

        // ---------------- evaluate + backup ----------------

        private void commit(ThoughtNode node, List<Proposal> proposals) {
            transition(EngineState.BACKING_UP);
            node.markExpanded();
            expansions++;

            double value;
            if (proposals == null || proposals.isEmpty()) {
                node.markFailed();
                failed++;
                value = node.score() - budget.unexploredMalus;
                log.debug("expand.empty node={} value={}", node.id(), value);
            } else {
                DomainPhase phase = DomainPhase.forExpansion(node.depth(), budget.maxDepth, budget.cyclePhases);
                int childDepth = node.depth() + 1;
                boolean atMax = childDepth >= budget.maxDepth;
                boolean terminal = atMax || (phase == DomainPhase.INTEGRATE && !budget.cyclePhases);
                DomainPhase childPhase = atMax ? DomainPhase.LEAF : phase;
                int cap = phase.maxProposals(budget.branchingFactor);

                value = Double.NEGATIVE_INFINITY;
                int added = 0;
                for (Proposal p : proposals) {
                    if (added >= cap) break;
                    ActiveInferenceState s = scorer.score(p.beliefs(), task.goal(), childDepth);
                    ThoughtNode child = tree.addChild(node, childPhase, p.content(), s, terminal);
                    value = Math.max(value, child.score());
                    added++;
                }
                log.debug("expand.commit node={} phase={} children={} best={}", node.id(), phase.wire(), added, value);
            }

            for (ThoughtNode n = node; n != null; n = n.parent()) n.recordVisit(value);
        }

        // ---------------- finalize ----------------

        private List<ThoughtNode> extractBestPath(ThoughtNode root) {
            if (root.children().isEmpty()) return List.of();
            List<ThoughtNode> path = new ArrayList<>();
            ThoughtNode n = root;
            path.add(n);
            while (!n.children().isEmpty()) {
                ThoughtNode best = null;
                for (ThoughtNode c : n.children()) {
                    if (best == null || c.valueEstimate() > best.valueEstimate()) best = c;
                }
                path.add(best);
                n = best;
            }
            return path;
        }

        private void transition(EngineState next) {
            if (state != next) {
                state = next;
                stateListener.accept(next);
            }
        }
    }

    /**
     * 1 - path_efe / (2 * scored nodes), clamped to [0,1]. Each scored node's EFE is at most 2.
     */
    static double confidence(double pathEfe, int scoredNodes) {
        if (scoredNodes <= 0) return 0.0;
        double c = 1.0 - pathEfe / (2.0 * scoredNodes);
        if (Double.isNaN(c)) return 0.0;
        return Math.max(0.0, Math.min(1.0, c));
    }
}
