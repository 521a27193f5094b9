package org.calista.metatot.plan.trace;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.plan.Session;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * TraceRecorder — сохраняет завершённую сессию и достаёт её по id.
 *
 * <p>persist: основной store → при любой ошибке store (checked или unchecked) WARN и in-memory ring buffer.
 * Потеря трассы никогда не прерывает прогон планирования.</p>
 * <p>retrieve: основной store, затем буфер.</p>
 */
public final class TraceRecorder {

    private static final Logger log = LogManager.getLogger(TraceRecorder.class);

    private final TraceStore primary; // nullable => memory only
    private final InMemoryTraceStore fallback;

    public TraceRecorder(TraceStore primary, InMemoryTraceStore fallback) {
        this.primary = primary;
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public static TraceRecorder inMemory(int capacity) {
        return new TraceRecorder(null, new InMemoryTraceStore(capacity));
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * @return the session's trace id (also the key in the fallback buffer)
     */
    public String persist(Session session) {
        Objects.requireNonNull(session, "session");
        String traceId = session.traceId();
        TracePayload payload = TracePayload.of(session, System.currentTimeMillis());

        if (primary != null) {
            try {
                primary.upsert(traceId, payload);
                log.debug("trace.persist store={} trace={} nodes={}", primary.name(), traceId, payload.nodes.size());
                return traceId;
            } catch (TraceStoreException | RuntimeException e) {
                // unchecked store failures land in the buffer too
                log.warn("trace.persist failed on {}; keeping trace {} in memory: {}",
                        primary.name(), traceId, e.getMessage(), e);
            }
        }
        fallback.upsert(traceId, payload);
        log.debug("trace.persist store={} trace={} nodes={}", fallback.name(), traceId, payload.nodes.size());
        return traceId;
    }

    public Optional<TracePayload> retrieve(String traceId) {
        if (traceId == null || traceId.isBlank()) return Optional.empty();
        if (primary != null) {
            try {
                Optional<TracePayload> p = primary.find(traceId);
                if (p.isPresent()) return p;
            } catch (TraceStoreException | RuntimeException e) {
                log.warn("trace.retrieve failed on {} for {}; checking memory: {}", primary.name(), traceId, e.getMessage(), e);
            }
        }
        return fallback.find(traceId);
    }

    public TraceStore primary() {
        return primary;
    }

    public InMemoryTraceStore fallback() {
        return fallback;
    }
}
