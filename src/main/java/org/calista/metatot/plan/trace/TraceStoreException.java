package org.calista.metatot.plan.trace;

/**
 * Trace store unreachable or unreadable. Recovered by the recorder.
 */
public class TraceStoreException extends Exception {

    public TraceStoreException(String message) {
        super(message);
    }

    public TraceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
