package org.calista.metatot.plan.candidate;

import org.calista.metatot.plan.tree.DomainPhase;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * PhasePrompts — шаблоны инструкций для каждой фазы расширения.
 * Границы числа предложений задаёт {@link DomainPhase#maxProposals(int)}.
 */
public final class PhasePrompts {

    public static final String SYSTEM =
            "You expand one node of a reasoning tree. Respond with JSON only: "
                    + "an object {\"proposals\": [{\"content\": \"...\", \"beliefs\": {\"<hypothesis>\": <probability>}}]}. "
                    + "Beliefs are your probabilities over named outcome hypotheses and must sum to 1.";

    private static final int CONTEXT_CHARS = 600;

    private PhasePrompts() {}

    public static String instruction(DomainPhase phase, int maxProposals) {
        switch (phase) {
            case EXPLORE:
                return "Generate " + phase.minProposals() + " to " + maxProposals
                        + " divergent next steps that approach the problem from different angles.";
            case CHALLENGE:
                return "Critique the current thought and give at least one counter-proposal (at most "
                        + maxProposals + "). Put the critique inside each proposal's content.";
            case EVOLVE:
                return "Refine the current thought into one more specific, concrete variant.";
            case INTEGRATE:
                return "Synthesize the reasoning path and the surviving branches into one terminal action that can be executed.";
            default:
                throw new IllegalArgumentException("phase cannot be expanded: " + phase);
        }
    }

    public static String userPrompt(ExpansionRequest req) {
        Objects.requireNonNull(req, "req");
        StringBuilder sb = new StringBuilder(512);
        sb.append("Phase: ").append(req.phase().wire()).append('\n');
        sb.append("Instruction: ").append(instruction(req.phase(), req.maxProposals())).append('\n');
        sb.append("Task: ").append(req.task()).append('\n');

        List<String> path = req.path();
        if (path.size() > 1) {
            sb.append("Reasoning path:\n");
            for (int i = 1; i < path.size(); i++) {
                sb.append("  ").append(i).append(". ").append(path.get(i)).append('\n');
            }
        }
        sb.append("Current thought: ").append(req.nodeContent()).append('\n');

        List<String> surviving = req.survivingBranches();
        if (!surviving.isEmpty()) {
            sb.append("Surviving branches:\n");
            for (String b : surviving) sb.append("  - ").append(b).append('\n');
        }

        if (!req.goal().isEmpty()) {
            sb.append("Goal hypotheses: ").append(goalLine(req.goal())).append('\n');
        }
        String ctx = contextLine(req.context());
        if (!ctx.isEmpty()) sb.append("Context: ").append(ctx).append('\n');
        return sb.toString();
    }

    private static String goalLine(Map<String, Double> goal) {
        StringJoiner j = new StringJoiner(", ");
        for (Map.Entry<String, Double> e : goal.entrySet()) {
            j.add(e.getKey() + "=" + String.format(Locale.ROOT, "%.2f", e.getValue() == null ? 0.0 : e.getValue()));
        }
        return j.toString();
    }

    private static String contextLine(Map<String, Object> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        StringJoiner j = new StringJoiner("; ");
        for (Map.Entry<String, Object> e : ctx.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            j.add(e.getKey() + "=" + e.getValue());
        }
        String s = j.toString();
        return s.length() > CONTEXT_CHARS ? s.substring(0, CONTEXT_CHARS) : s;
    }
}
