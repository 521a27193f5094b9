package org.calista.metatot.plan.candidate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * LlmCandidateGenerator — one inference call per expansion with a phase-specific
 * instruction; response shaped into proposals by {@link ProposalParser}.
 *
 * <p>{@link InferenceException} is recovered here: WARN + empty expansion.</p>
 */
public final class LlmCandidateGenerator implements CandidateGenerator {

    private static final Logger log = LogManager.getLogger(LlmCandidateGenerator.class);

    private final InferenceClient client;
    private final ProposalParser parser;

    public LlmCandidateGenerator(InferenceClient client, ProposalParser parser) {
        this.client = Objects.requireNonNull(client, "client");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public List<Proposal> expand(ExpansionRequest request) {
        Objects.requireNonNull(request, "request");

        final String raw;
        try {
            raw = client.generate(PhasePrompts.SYSTEM, PhasePrompts.userPrompt(request));
        } catch (InferenceException e) {
            log.warn("expand.fail node={} phase={} client={} err={}",
                    request.nodeId(), request.phase().wire(), client.describe(), e.getMessage());
            return List.of();
        }

        List<Proposal> proposals = parser.parse(raw, request.maxProposals());
        int min = request.phase().minProposals();
        if (proposals.size() < min) {
            log.debug("expand.short node={} phase={} got={} expectedMin={}",
                    request.nodeId(), request.phase().wire(), proposals.size(), min);
        }
        log.debug("expand.ok node={} phase={} proposals={}", request.nodeId(), request.phase().wire(), proposals.size());
        return proposals;
    }
}
