package org.calista.metatot.plan.engine;

import java.util.Map;
import java.util.Objects;

/**
 * Input of one search run. The goal vector has already been validated by the caller.
 */
public final class SearchTask {

    private final String sessionId;
    private final String task;
    private final Map<String, Object> context;
    private final Map<String, Double> goal;
    private final SearchBudget budget;
    private final CancellationToken cancellation;

    public SearchTask(String sessionId,
                      String task,
                      Map<String, Object> context,
                      Map<String, Double> goal,
                      SearchBudget budget,
                      CancellationToken cancellation) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.task = Objects.requireNonNull(task, "task");
        this.context = (context == null) ? Map.of() : context;
        this.goal = Objects.requireNonNull(goal, "goal");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.cancellation = (cancellation == null) ? CancellationToken.none() : cancellation;
    }

    public String sessionId() { return sessionId; }

    public String task() { return task; }

    public Map<String, Object> context() { return context; }

    public Map<String, Double> goal() { return goal; }

    public SearchBudget budget() { return budget; }

    public CancellationToken cancellation() { return cancellation; }
}
