package org.calista.metatot.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.metatot.plan.MetaToT;
import org.calista.metatot.plan.candidate.CandidateGenerator;
import org.calista.metatot.plan.candidate.Langchain4jInferenceClient;
import org.calista.metatot.plan.candidate.LlmCandidateGenerator;
import org.calista.metatot.plan.candidate.ProposalParser;
import org.calista.metatot.plan.decision.DecisionGate;
import org.calista.metatot.plan.decision.DecisionThresholds;
import org.calista.metatot.plan.engine.SearchBudget;
import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.inference.DivergenceMetric;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Composes a {@link MetaToT} from the kernel: JS plan (or the Java fallback) → budget,
 * scorer, gate, stores, inference client.
 */
public final class MetaToTComposer {

    private static final Logger log = LoggerFactory.getLogger(MetaToTComposer.class);

    public static final String PLAN_SCRIPT = "script/search_plan.js";

    private final MetaToTKernel kernel;
    private final Value buildPlan; // null when JS is disabled

    public MetaToTComposer(MetaToTKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        Context context = kernel.jsContext();
        if (context == null) {
            this.buildPlan = null;
            log.info("MetaToTComposer: JS disabled, plan is taken from config");
            return;
        }
        try {
            context.eval(Source.newBuilder("js", loadScript(), "search_plan.js").buildLiteral());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to load " + PLAN_SCRIPT, e);
        }
        Value fn = context.getBindings("js").getMember("buildPlan");
        if (fn == null || fn.isNull() || !fn.canExecute()) {
            throw new IllegalStateException("JS buildPlan not found in " + PLAN_SCRIPT);
        }
        this.buildPlan = fn;
    }

    // ---------------------------------------------------------------------
    // Plan
    // ---------------------------------------------------------------------

    /**
     * @return plan JSON produced by the script, or by {@link #javaPlan} when JS is disabled
     */
    public String buildPlan(String cfgJson) {
        Objects.requireNonNull(cfgJson, "cfgJson");
        if (buildPlan == null) return javaPlan(cfgJson);
        return buildPlan.execute(cfgJson).asString();
    }

    public Map<String, Object> plan() {
        ObjectMapper om = kernel.mapper();
        try {
            String planJson = buildPlan(om.writeValueAsString(kernel.config()));
            return om.readValue(planJson, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("search plan is not valid JSON", e);
        }
    }

    /**
     * Same derivation as the script: the per-call timeout never exceeds the session deadline,
     * sibling fan-out never exceeds the pool.
     */
    String javaPlan(String cfgJson) {
        ObjectMapper om = kernel.mapper();
        try {
            MetaToTConfig cfg = om.readValue(cfgJson, MetaToTConfig.class);
            cfg.validate();

            ObjectNode plan = om.createObjectNode();
            plan.put("maxIterations", cfg.search.maxIterations);
            plan.put("maxDepth", cfg.search.maxDepth);
            plan.put("deadlineMs", cfg.search.deadlineMs);
            plan.put("explorationConstant", cfg.search.explorationConstant);
            plan.put("branchingFactor", cfg.search.branchingFactor);
            plan.put("unexploredMalus", cfg.search.unexploredMalus);
            plan.put("parallelExpansions", Math.min(cfg.search.parallelExpansions, cfg.pool.parallelism));
            plan.put("cyclePhases", cfg.search.cyclePhases);
            plan.put("callTimeoutMs", Math.min(cfg.inference.callTimeoutMs, cfg.search.deadlineMs));
            plan.put("divergence", cfg.scoring.divergence);

            ObjectNode pool = plan.putObject("pool");
            pool.put("parallelism", cfg.pool.parallelism);
            pool.put("queueCapacity", cfg.pool.queueCapacity);
            pool.put("threadNamePrefix", cfg.pool.threadNamePrefix);
            pool.put("shutdownTimeoutMs", cfg.pool.shutdownTimeoutMs);
            return om.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("config JSON is not readable", e);
        }
    }

    // ---------------------------------------------------------------------
    // Orchestrator
    // ---------------------------------------------------------------------

    /** Orchestrator backed by the configured inference service. */
    public MetaToT buildMetaToT() {
        MetaToTConfig.Inference inf = kernel.config().inference;
        if (!"ollama".equalsIgnoreCase(inf.provider)) {
            throw new IllegalStateException("unsupported inference.provider: " + inf.provider);
        }
        Map<String, Object> plan = plan();
        Langchain4jInferenceClient client = Langchain4jInferenceClient.ollama(
                inf.baseUrl, inf.model, inf.temperature, l(plan, "callTimeoutMs"));
        CandidateGenerator generator = new LlmCandidateGenerator(client,
                new ProposalParser(kernel.mapper(), inf.maxProposalChars));
        return buildMetaToT(generator, plan);
    }

    public MetaToT buildMetaToT(CandidateGenerator generator) {
        return buildMetaToT(generator, plan());
    }

    private MetaToT buildMetaToT(CandidateGenerator generator, Map<String, Object> plan) {
        Objects.requireNonNull(generator, "generator");
        MetaToTConfig cfg = kernel.config();

        SearchBudget budget = SearchBudget.builder()
                .maxIterations(i(plan, "maxIterations"))
                .maxDepth(i(plan, "maxDepth"))
                .deadlineMs(l(plan, "deadlineMs"))
                .explorationConstant(d(plan, "explorationConstant"))
                .branchingFactor(i(plan, "branchingFactor"))
                .unexploredMalus(d(plan, "unexploredMalus"))
                .parallelExpansions(i(plan, "parallelExpansions"))
                .cyclePhases(b(plan, "cyclePhases"))
                .callTimeoutMs(l(plan, "callTimeoutMs"))
                .build();

        MetaToT.Builder mb = MetaToT.builder(generator)
                .budget(budget)
                .scorer(new ActiveInferenceScorer(DivergenceMetric.valueOf(s(plan, "divergence", "COSINE"))))
                .gate(new DecisionGate(cfg.decision.minTokenThreshold, cfg.decision.alwaysOn))
                .thresholds(DecisionThresholds.of(cfg.decision.complexityThreshold, cfg.decision.uncertaintyThreshold))
                .recorder(kernel.traceRecorder())
                .events(kernel.eventStore())
                .tuner(kernel.thresholdTuner());

        Object p = plan.get("pool");
        if (p instanceof Map<?, ?>) {
            @SuppressWarnings("unchecked")
            Map<String, Object> pool = (Map<String, Object>) p;
            if (pool.containsKey("parallelism")) mb.parallelism(i(pool, "parallelism"));
            if (pool.containsKey("queueCapacity")) mb.queueCapacity(i(pool, "queueCapacity"));
            if (pool.containsKey("threadNamePrefix")) mb.threadNamePrefix(s(pool, "threadNamePrefix", null));
            if (pool.containsKey("shutdownTimeoutMs")) mb.shutdownTimeoutMs(l(pool, "shutdownTimeoutMs"));
        }
        return mb.build();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static String loadScript() {
        try (InputStream in = MetaToTComposer.class.getClassLoader().getResourceAsStream(PLAN_SCRIPT)) {
            if (in == null) throw new IllegalStateException(PLAN_SCRIPT + " not found on classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PLAN_SCRIPT, e);
        }
    }

    private static Number num(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (!(v instanceof Number)) throw new IllegalStateException("plan." + k + " missing or not a number: " + v);
        return (Number) v;
    }

    private static int i(Map<String, Object> m, String k) { return num(m, k).intValue(); }

    private static long l(Map<String, Object> m, String k) { return num(m, k).longValue(); }

    private static double d(Map<String, Object> m, String k) { return num(m, k).doubleValue(); }

    private static boolean b(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (v instanceof Boolean) return (Boolean) v;
        throw new IllegalStateException("plan." + k + " missing or not a boolean: " + v);
    }

    private static String s(Map<String, Object> m, String k, String fallback) {
        Object v = m.get(k);
        return (v == null) ? fallback : String.valueOf(v);
    }
}
