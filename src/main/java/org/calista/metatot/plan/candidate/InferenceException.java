package org.calista.metatot.plan.candidate;

/**
 * Transient failure of the inference service (timeout, transport, 5xx).
 */
public class InferenceException extends Exception {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
