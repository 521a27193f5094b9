package org.calista.metatot.plan.trace;

import java.util.Optional;

/**
 * Trace persistence seam: idempotent upsert keyed by a caller-generated id,
 * and a point lookup. Implementations are shared across sessions.
 */
public interface TraceStore {

    void upsert(String traceId, TracePayload payload) throws TraceStoreException;

    Optional<TracePayload> find(String traceId) throws TraceStoreException;

    /** Label for logs. */
    default String name() {
        return getClass().getSimpleName();
    }
}
