package org.calista.metatot.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound call: task, context snapshot, goal vector, per-request overrides.
 * Validated before the decision gate runs.
 */
public final class PlanRequest {

    private final String task;
    private final Map<String, Object> context;
    private final Map<String, Double> goal;
    private final SearchConfig config;

    private PlanRequest(String task, Map<String, Object> context, Map<String, Double> goal, SearchConfig config) {
        this.task = task;
        this.context = context;
        this.goal = goal;
        this.config = config;
    }

    /**
     * @throws IllegalArgumentException blank task, missing/empty/zero-norm goal, non-finite weights, bad overrides
     */
    public static PlanRequest of(String task, Map<String, Object> context, Map<String, Double> goal, SearchConfig config) {
        if (task == null || task.isBlank()) throw new IllegalArgumentException("task must not be empty");
        if (goal == null || goal.isEmpty()) throw new IllegalArgumentException("goal vector must not be empty");

        LinkedHashMap<String, Double> g = new LinkedHashMap<>(goal.size() * 2);
        double norm = 0.0;
        for (Map.Entry<String, Double> e : goal.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) throw new IllegalArgumentException("goal key must not be blank");
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v)) {
                throw new IllegalArgumentException("goal weight for '" + e.getKey() + "' must be finite (got " + v + ")");
            }
            g.put(e.getKey().trim(), v);
            norm += v * v;
        }
        if (norm <= 0.0) throw new IllegalArgumentException("goal vector must have non-zero norm");

        SearchConfig cfg = (config == null) ? SearchConfig.defaults() : config;
        cfg.validate();

        Map<String, Object> ctx = (context == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        return new PlanRequest(task.trim(), ctx, Collections.unmodifiableMap(g), cfg);
    }

    public static PlanRequest of(String task, Map<String, Object> context, Map<String, Double> goal) {
        return of(task, context, goal, null);
    }

    public String task() { return task; }

    public Map<String, Object> context() { return context; }

    public Map<String, Double> goal() { return goal; }

    public SearchConfig config() { return config; }

    @Override
    public String toString() {
        return "PlanRequest{taskLen=" + task.length() + ", contextKeys=" + context.keySet() + ", goal=" + goal + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanRequest)) return false;
        PlanRequest r = (PlanRequest) o;
        return task.equals(r.task) && context.equals(r.context) && goal.equals(r.goal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, context, goal);
    }
}
