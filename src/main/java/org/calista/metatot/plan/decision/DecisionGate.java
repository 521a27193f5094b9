package org.calista.metatot.plan.decision;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * DecisionGate — пороговая политика: запускать ли глубокий поиск.
 *
 * <p>Чистая функция: одинаковые (complexity, uncertainty, T_c, T_u) всегда дают
 * одинаковый режим. Адаптация порогов живёт снаружи ({@link ThresholdTuner}),
 * gate получает пороги аргументом.</p>
 *
 * <pre>
 * deep_search  iff  complexity >= T_c  OR  uncertainty >= T_u
 * </pre>
 *
 * Контекстные флаги:
 * <ul>
 *   <li>{@value #DISABLE_FLAG}: всегда direct, оценки 0</li>
 *   <li>{@value #FORCE_FLAG} (или alwaysOn в конфиге): всегда deep_search</li>
 * </ul>
 */
public final class DecisionGate {

    public static final String DISABLE_FLAG = "disable_meta_tot";
    public static final String FORCE_FLAG = "force_meta_tot";

    public static final String CTX_COMPLEXITY_LEVEL = "complexity_level";
    public static final String CTX_COMPLEXITY_SCORE = "complexity_score";
    public static final String CTX_UNCERTAINTY_LEVEL = "uncertainty_level";
    public static final String CTX_GOAL_ALIGNMENT = "goal_alignment";
    public static final String CTX_UNKNOWNS = "unknowns";
    public static final String CTX_REQUIRED_FACTS = "required_facts";
    public static final String CTX_KNOWN_FACTS = "known_facts";

    private static final List<String> CONSTRAINT_TERMS = List.of("must", "should", "constraint", "tradeoff", "risk");
    private static final List<String> DOMAIN_TERMS = List.of("strategy", "plan", "marketing", "evolution", "architecture");
    private static final int TASK_REF_CHARS = 200;

    private final int minTokenThreshold;
    private final boolean alwaysOn;

    public DecisionGate() {
        this(160, false);
    }

    public DecisionGate(int minTokenThreshold, boolean alwaysOn) {
        if (minTokenThreshold < 1) throw new IllegalArgumentException("minTokenThreshold must be >= 1");
        this.minTokenThreshold = minTokenThreshold;
        this.alwaysOn = alwaysOn;
    }

    public Decision decide(String task, Map<String, Object> context, DecisionThresholds thresholds) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(thresholds, "thresholds");
        Map<String, Object> ctx = (context == null) ? Map.of() : context;
        String ref = taskRef(task);

        if (truthy(ctx.get(DISABLE_FLAG))) {
            return new Decision(ref, 0.0, 0.0, thresholds, SelectedMode.DIRECT,
                    "direct: disabled by context flag " + DISABLE_FLAG);
        }

        double complexity = complexityScore(task, ctx);
        double uncertainty = uncertaintyScore(task, ctx);

        if (truthy(ctx.get(FORCE_FLAG))) {
            return new Decision(ref, complexity, uncertainty, thresholds, SelectedMode.DEEP_SEARCH,
                    "deep_search: forced by context flag " + FORCE_FLAG + "; " + scoresLine(complexity, uncertainty, thresholds));
        }
        if (alwaysOn) {
            return new Decision(ref, complexity, uncertainty, thresholds, SelectedMode.DEEP_SEARCH,
                    "deep_search: forced by alwaysOn configuration; " + scoresLine(complexity, uncertainty, thresholds));
        }
        return decide(ref, complexity, uncertainty, thresholds);
    }

    /**
     * The threshold rule on precomputed scores.
     */
    public static Decision decide(String taskRef, double complexity, double uncertainty, DecisionThresholds t) {
        Objects.requireNonNull(t, "thresholds");
        double c = clamp01(complexity);
        double u = clamp01(uncertainty);

        boolean byC = c >= t.complexity();
        boolean byU = u >= t.uncertainty();

        String rationale;
        if (byC && byU) {
            rationale = String.format(Locale.ROOT,
                    "deep_search: complexity %.2f >= T_c %.2f and uncertainty %.2f >= T_u %.2f",
                    c, t.complexity(), u, t.uncertainty());
        } else if (byC) {
            rationale = String.format(Locale.ROOT,
                    "deep_search: complexity %.2f >= T_c %.2f (uncertainty %.2f < T_u %.2f)",
                    c, t.complexity(), u, t.uncertainty());
        } else if (byU) {
            rationale = String.format(Locale.ROOT,
                    "deep_search: uncertainty %.2f >= T_u %.2f (complexity %.2f < T_c %.2f)",
                    u, t.uncertainty(), c, t.complexity());
        } else {
            rationale = String.format(Locale.ROOT,
                    "direct: complexity %.2f < T_c %.2f and uncertainty %.2f < T_u %.2f",
                    c, t.complexity(), u, t.uncertainty());
        }
        SelectedMode mode = (byC || byU) ? SelectedMode.DEEP_SEARCH : SelectedMode.DIRECT;
        return new Decision(taskRef == null ? "" : taskRef, c, u, t, mode, rationale);
    }

    // ---------------------------------------------------------------------
    // Heuristics
    // ---------------------------------------------------------------------

    /**
     * 0.5·length + 0.25·constraint terms + 0.15·domain terms + 0.10·context complexity_score;
     * context complexity_level overrides.
     */
    public double complexityScore(String task, Map<String, Object> ctx) {
        Double override = number(ctx.get(CTX_COMPLEXITY_LEVEL));
        if (override != null) return clamp01(override);

        String lower = task.toLowerCase(Locale.ROOT);
        String trimmed = lower.trim();
        int tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        double length = Math.min((double) tokens / minTokenThreshold, 1.0);
        double constraints = Math.min(hits(lower, CONSTRAINT_TERMS) / 5.0, 1.0);
        double domain = Math.min(hits(lower, DOMAIN_TERMS) / 5.0, 1.0);
        Double ctxScore = number(ctx.get(CTX_COMPLEXITY_SCORE));
        double contextComplexity = (ctxScore == null) ? 0.0 : clamp01(ctxScore);

        return clamp01(0.5 * length + 0.25 * constraints + 0.15 * domain + 0.10 * contextComplexity);
    }

    /**
     * uncertainty_level overrides; else 0.5·(1 − goal_alignment) + 0.25·unknowns + 0.25·questions.
     * With required_facts/known_facts the unknowns term is the fraction of required facts not known.
     */
    public double uncertaintyScore(String task, Map<String, Object> ctx) {
        Double override = number(ctx.get(CTX_UNCERTAINTY_LEVEL));
        if (override != null) return clamp01(override);

        Double alignment = number(ctx.get(CTX_GOAL_ALIGNMENT));
        double goalAlignment = (alignment == null) ? 0.5 : clamp01(alignment);

        double unknowns;
        Object required = ctx.get(CTX_REQUIRED_FACTS);
        if (required instanceof Collection<?> && !((Collection<?>) required).isEmpty()) {
            Collection<?> req = (Collection<?>) required;
            Object knownRaw = ctx.get(CTX_KNOWN_FACTS);
            Collection<?> known = (knownRaw instanceof Collection<?>) ? (Collection<?>) knownRaw : List.of();
            long missing = req.stream().filter(f -> !known.contains(f)).count();
            unknowns = (double) missing / req.size();
        } else {
            Object u = ctx.get(CTX_UNKNOWNS);
            unknowns = (u instanceof Collection<?>) ? Math.min(((Collection<?>) u).size() / 5.0, 1.0) : 0.0;
        }

        long questions = task.chars().filter(ch -> ch == '?').count();
        double questionScore = Math.min(questions / 3.0, 1.0);

        return clamp01(0.5 * (1.0 - goalAlignment) + 0.25 * unknowns + 0.25 * questionScore);
    }

    public int minTokenThreshold() {
        return minTokenThreshold;
    }

    public boolean alwaysOn() {
        return alwaysOn;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static int hits(String lower, List<String> terms) {
        int n = 0;
        for (String t : terms) if (lower.contains(t)) n++;
        return n;
    }

    private static String scoresLine(double c, double u, DecisionThresholds t) {
        return String.format(Locale.ROOT, "complexity %.2f (T_c %.2f), uncertainty %.2f (T_u %.2f)",
                c, t.complexity(), u, t.uncertainty());
    }

    private static String taskRef(String task) {
        String s = task.trim();
        return s.length() <= TASK_REF_CHARS ? s : s.substring(0, TASK_REF_CHARS);
    }

    static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Number) return ((Number) v).doubleValue() != 0.0;
        String s = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("1") || s.equals("yes") || s.equals("on");
    }

    private static Double number(Object v) {
        if (v == null) return null;
        if (v instanceof Number) {
            double d = ((Number) v).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        try {
            double d = Double.parseDouble(String.valueOf(v).trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("context value is not a number: " + v, e);
        }
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }
}
