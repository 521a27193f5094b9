package org.calista.metatot.plan;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.events.EngineEvent;
import org.calista.metatot.events.EventStore;
import org.calista.metatot.plan.candidate.CandidateGenerator;
import org.calista.metatot.plan.decision.Decision;
import org.calista.metatot.plan.decision.DecisionGate;
import org.calista.metatot.plan.decision.DecisionThresholds;
import org.calista.metatot.plan.decision.ThresholdTuner;
import org.calista.metatot.plan.engine.CancellationToken;
import org.calista.metatot.plan.engine.SearchBudget;
import org.calista.metatot.plan.engine.SearchEngine;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.engine.SearchTask;
import org.calista.metatot.plan.engine.impl.MctsSearchEngine;
import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.trace.TraceRecorder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MetaToT — оркестратор: decision gate → (опционально) поиск по дереву → сессия → трасса.
 *
 * <p>Владеет пулом генерации, если он не передан снаружи. Один экземпляр безопасно
 * обслуживает несколько запросов подряд; дерево каждой сессии принадлежит только ей.</p>
 */
public final class MetaToT implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(MetaToT.class);

    public static final String SESSION_PREFIX = "mtot-";

    private final CandidateGenerator generator;
    private final SearchBudget defaults;
    private final ActiveInferenceScorer scorer;
    private final DecisionGate gate;
    private final DecisionThresholds thresholds;
    private final TraceRecorder recorder;
    private final EventStore events;   // nullable
    private final ThresholdTuner tuner; // nullable

    private final ExecutorService pool;
    private final boolean ownsPool;
    private final long shutdownTimeoutMs;

    private final SearchEngine engine;

    private MetaToT(Builder b) {
        this.generator = Objects.requireNonNull(b.generator, "generator");
        this.defaults = Objects.requireNonNull(b.budget, "budget");
        this.scorer = (b.scorer != null) ? b.scorer : new ActiveInferenceScorer();
        this.gate = (b.gate != null) ? b.gate : new DecisionGate();
        this.thresholds = (b.thresholds != null) ? b.thresholds : DecisionThresholds.of(0.7, 0.6);
        this.recorder = (b.recorder != null) ? b.recorder : TraceRecorder.inMemory(256);
        this.events = b.events;
        this.tuner = b.tuner;
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;

        this.ownsPool = (b.pool == null);
        this.pool = ownsPool ? createPool(b.parallelism, b.queueCapacity, b.threadNamePrefix) : b.pool;

        this.engine = new MctsSearchEngine(generator, scorer, pool);

        logCreation(b);
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public PlanResult run(PlanRequest request) {
        return run(request, CancellationToken.none());
    }

    /**
     * Gates the request and, for deep_search, runs the tree search and records the trace.
     * Never throws for a degraded run; input errors were rejected when the request was built.
     */
    public PlanResult run(PlanRequest request, CancellationToken cancellation) {
        Objects.requireNonNull(request, "request");
        SearchConfig overrides = request.config();

        DecisionThresholds base = (tuner != null) ? tuner.current() : thresholds;
        DecisionThresholds t = DecisionThresholds.of(
                overrides.complexityThreshold != null ? overrides.complexityThreshold : base.complexity(),
                overrides.uncertaintyThreshold != null ? overrides.uncertaintyThreshold : base.uncertainty());

        Decision decision = gate.decide(request.task(), request.context(), t);
        log.info("decision mode={} c={} u={} rationale={}",
                decision.selectedMode().wire(), decision.complexityScore(), decision.uncertaintyScore(), decision.rationale());

        if (!decision.isDeepSearch()) {
            emit(EngineEvent.DECISION, null, decision.rationale());
            return PlanResult.direct(decision);
        }

        String sessionId = SESSION_PREFIX + UUID.randomUUID();
        emit(EngineEvent.DECISION, sessionId, decision.rationale());

        SearchBudget budget = budgetFor(overrides);
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("session", sessionId)) {
            SearchOutcome outcome = engine.search(new SearchTask(sessionId, request.task(),
                    request.context(), request.goal(), budget, cancellation));

            if (outcome.noViableBranches()) {
                log.warn("session {} ended without viable branches (expansions={}, failed={})",
                        sessionId, outcome.expansions(), outcome.failedExpansions());
                emit(EngineEvent.SESSION, sessionId, PlanError.NO_VIABLE_BRANCHES.wire());
                return PlanResult.noViableBranches(decision);
            }

            Session session = Session.of(TraceRecorder.newTraceId(), request.task(), request.context(), decision, outcome);
            String traceId = recorder.persist(session);

            emit(EngineEvent.SESSION, sessionId, "path_efe=" + session.pathEfe()
                    + " confidence=" + session.confidence() + " stop=" + outcome.stopReason().wire());
            emit(EngineEvent.TRACE, sessionId, traceId);

            if (tuner != null) {
                try {
                    DecisionThresholds next = tuner.observe(session.confidence(), outcome.durationMs(), budget.deadlineMs);
                    log.debug("thresholds now {}", next);
                } catch (IOException e) {
                    log.warn("threshold state not saved: {}", e.getMessage(), e);
                }
            }

            log.info("session {} done: action='{}' pathEfe={} confidence={} trace={}",
                    sessionId, abbreviate(session.selectedAction()), session.pathEfe(), session.confidence(), traceId);
            return PlanResult.success(decision, session, traceId);
        }
    }

    SearchBudget budgetFor(SearchConfig overrides) {
        if (overrides.maxIterations == null && overrides.maxDepth == null && overrides.deadlineMs == null) {
            return defaults;
        }
        SearchBudget.Builder b = defaults.toBuilder();
        if (overrides.maxIterations != null) b.maxIterations(overrides.maxIterations);
        if (overrides.maxDepth != null) b.maxDepth(overrides.maxDepth);
        if (overrides.deadlineMs != null) b.deadlineMs(overrides.deadlineMs);
        return b.build();
    }

    private void emit(String type, String sessionId, String text) {
        if (events == null) return;
        try {
            events.append(EngineEvent.of(type, sessionId, text, System.currentTimeMillis()));
        } catch (IOException | UncheckedIOException e) {
            log.warn("event {} not written to {}: {}", type, events.file(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------------

    public SearchBudget getDefaults() { return defaults; }

    public DecisionGate getGate() { return gate; }

    public DecisionThresholds getThresholds() { return (tuner != null) ? tuner.current() : thresholds; }

    public TraceRecorder getRecorder() { return recorder; }

    public ThresholdTuner getTuner() { return tuner; }

    public ExecutorService getPool() { return pool; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (ownsPool) {
            shutdownExecutor(pool, shutdownTimeoutMs);
        } else {
            log.debug("MetaToT.close(): pool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder(CandidateGenerator generator) {
        return new Builder(generator);
    }

    public static final class Builder {
        private final CandidateGenerator generator;

        private SearchBudget budget = SearchBudget.builder().build();
        private ActiveInferenceScorer scorer;
        private DecisionGate gate;
        private DecisionThresholds thresholds;
        private TraceRecorder recorder;
        private EventStore events;
        private ThresholdTuner tuner;

        private ExecutorService pool;
        private int parallelism = 4;
        private int queueCapacity = 256;
        private String threadNamePrefix = "meta-tot-gen-";
        private long shutdownTimeoutMs = 2500;

        private Builder(CandidateGenerator generator) {
            this.generator = Objects.requireNonNull(generator, "generator");
        }

        public Builder budget(SearchBudget v) { this.budget = Objects.requireNonNull(v, "budget"); return this; }
        public Builder scorer(ActiveInferenceScorer v) { this.scorer = v; return this; }
        public Builder gate(DecisionGate v) { this.gate = v; return this; }
        public Builder thresholds(DecisionThresholds v) { this.thresholds = v; return this; }
        public Builder recorder(TraceRecorder v) { this.recorder = v; return this; }
        public Builder events(EventStore v) { this.events = v; return this; }
        public Builder tuner(ThresholdTuner v) { this.tuner = v; return this; }

        /** External pool; not shut down by {@link MetaToT#close()}. */
        public Builder pool(ExecutorService v) { this.pool = v; return this; }

        public Builder parallelism(int v) { this.parallelism = Math.max(1, Math.min(16, v)); return this; }
        public Builder queueCapacity(int v) { this.queueCapacity = Math.max(1, v); return this; }
        public Builder threadNamePrefix(String v) { this.threadNamePrefix = (v == null || v.isBlank()) ? "meta-tot-gen-" : v; return this; }
        public Builder shutdownTimeoutMs(long v) { this.shutdownTimeoutMs = Math.max(0, v); return this; }

        public MetaToT build() {
            return new MetaToT(this);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static ExecutorService createPool(int parallelism, int queueCapacity, String prefix) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, prefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy => backpressure on the inference backend
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return (s.length() <= 80) ? s : s.substring(0, 77) + "...";
    }

    private void logCreation(Builder b) {
        if (!log.isInfoEnabled()) return;

        String msg = MetaToTLogFmt.box("MetaToT initialized", x -> {
            x.kv("generator", generator.getClass().getName());
            x.kv("scorer", scorer.metric());
            x.kv("engine", engine.getClass().getSimpleName());
            x.kv("recorder.primary", recorder.primary() == null ? "<none>" : recorder.primary().name());
            x.kv("recorder.fallbackCapacity", recorder.fallback().capacity());
            x.kv("events", events == null ? "<none>" : events.file());
            x.sep();
            x.kv("maxIterations", defaults.maxIterations);
            x.kv("maxDepth", defaults.maxDepth);
            x.kv("deadlineMs", defaults.deadlineMs);
            x.kv("explorationConstant", defaults.explorationConstant);
            x.kv("branchingFactor", defaults.branchingFactor);
            x.kv("parallelExpansions", defaults.parallelExpansions);
            x.kv("cyclePhases", defaults.cyclePhases);
            x.kv("callTimeoutMs", defaults.callTimeoutMs);
            x.sep();
            x.kv("T_c", getThresholds().complexity());
            x.kv("T_u", getThresholds().uncertainty());
            x.kv("alwaysOn", gate.alwaysOn());
            x.kv("adaptive", tuner != null);
            x.sep();
            x.kv("poolOwnership", ownsPool ? "owned" : "external");
            x.kv("poolParallelism", ownsPool ? b.parallelism : "<external>");
            x.kv("poolQueueCapacity", ownsPool ? b.queueCapacity : "<external>");
        });

        log.info("\n{}", msg);
    }
}
