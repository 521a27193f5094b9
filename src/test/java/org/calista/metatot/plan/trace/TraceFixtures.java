package org.calista.metatot.plan.trace;

import org.calista.metatot.plan.Session;
import org.calista.metatot.plan.decision.DecisionGate;
import org.calista.metatot.plan.decision.DecisionThresholds;
import org.calista.metatot.plan.engine.CancellationToken;
import org.calista.metatot.plan.engine.SearchBudget;
import org.calista.metatot.plan.engine.SearchOutcome;
import org.calista.metatot.plan.engine.SearchTask;
import org.calista.metatot.plan.engine.impl.MctsSearchEngine;
import org.calista.metatot.plan.candidate.Proposal;
import org.calista.metatot.plan.inference.ActiveInferenceScorer;
import org.calista.metatot.plan.inference.BeliefDistribution;

import java.util.List;
import java.util.Map;

final class TraceFixtures {

    private TraceFixtures() {
    }

    /** A finished two-level session built by the real engine with a fixed generator. */
    static Session session(String sessionId) {
        MctsSearchEngine engine = new MctsSearchEngine(req -> List.of(
                new Proposal(req.nodeId() + " step A", BeliefDistribution.of(Map.of("a", 0.6, "b", 0.4))),
                new Proposal(req.nodeId() + " step B", BeliefDistribution.of(Map.of("a", 0.9, "b", 0.1)))),
                new ActiveInferenceScorer(), null);
        SearchOutcome out = engine.search(new SearchTask(sessionId, "Plan the launch", Map.of("region", "eu"),
                Map.of("a", 1.0, "b", 0.0),
                SearchBudget.builder().maxDepth(2).maxIterations(10).build(), CancellationToken.none()));
        return Session.of(TraceRecorder.newTraceId(), "Plan the launch", Map.of("region", "eu"),
                DecisionGate.decide("Plan the launch", 0.2, 0.9, DecisionThresholds.of(0.5, 0.5)), out);
    }
}
