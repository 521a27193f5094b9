package org.calista.metatot.plan.candidate;

import org.calista.metatot.plan.inference.BeliefDistribution;

import java.util.Objects;

/**
 * One child proposal returned by a candidate generator.
 */
public final class Proposal {

    private final String content;
    private final BeliefDistribution beliefs;

    public Proposal(String content, BeliefDistribution beliefs) {
        if (content == null || content.isBlank()) throw new IllegalArgumentException("proposal content must not be blank");
        this.content = content.trim();
        this.beliefs = Objects.requireNonNull(beliefs, "beliefs");
    }

    public String content() {
        return content;
    }

    public BeliefDistribution beliefs() {
        return beliefs;
    }

    @Override
    public String toString() {
        return "Proposal{" + (content.length() > 60 ? content.substring(0, 60) + "…" : content) + ", beliefs=" + beliefs + '}';
    }
}
