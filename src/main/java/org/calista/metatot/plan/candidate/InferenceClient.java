package org.calista.metatot.plan.candidate;

/**
 * Outbound text-generation call. Shared, stateless, safe for concurrent use.
 */
public interface InferenceClient {

    /**
     * @return raw model text
     * @throws InferenceException on timeout or service error
     */
    String generate(String systemPrompt, String userPrompt) throws InferenceException;

    /** Short provider/model label for logs. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
