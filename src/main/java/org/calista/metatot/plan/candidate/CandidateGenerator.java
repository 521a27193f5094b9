package org.calista.metatot.plan.candidate;

import java.util.List;

/**
 * CandidateGenerator — capability for producing child proposals of a node.
 *
 * <p>Implementations must be safe for concurrent use: sibling nodes are expanded
 * in parallel. Upstream failures (timeouts, service errors) are reported as an
 * empty list, never as an exception. A runtime exception escaping {@link #expand}
 * is treated as a defect and aborts the run.</p>
 */
@FunctionalInterface
public interface CandidateGenerator {

    List<Proposal> expand(ExpansionRequest request);
}
