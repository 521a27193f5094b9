package org.calista.metatot.plan.trace;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process ring buffer: the oldest trace is evicted once capacity is reached.
 * Never fails.
 */
public final class InMemoryTraceStore implements TraceStore {

    private final int capacity;
    private final LinkedHashMap<String, TracePayload> buffer;

    public InMemoryTraceStore(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.buffer = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TracePayload> eldest) {
                return size() > InMemoryTraceStore.this.capacity;
            }
        };
    }

    @Override
    public synchronized void upsert(String traceId, TracePayload payload) {
        if (traceId == null || traceId.isBlank()) throw new IllegalArgumentException("traceId must not be blank");
        if (payload == null) throw new IllegalArgumentException("payload must not be null");
        buffer.remove(traceId); // re-insert as newest
        buffer.put(traceId, payload);
    }

    @Override
    public synchronized Optional<TracePayload> find(String traceId) {
        return Optional.ofNullable(buffer.get(traceId));
    }

    public synchronized int size() {
        return buffer.size();
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String name() {
        return "memory";
    }
}
