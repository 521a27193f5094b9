package org.calista.metatot.plan.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * JsonlTraceStore — append-only JSONL файл трасс (одна трасса на строку).
 *
 * <p>Upsert = append; при чтении побеждает последняя запись с тем же trace_id,
 * поэтому повторный upsert идемпотентен.</p>
 */
public final class JsonlTraceStore implements TraceStore {

    private static final Logger log = LogManager.getLogger(JsonlTraceStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public JsonlTraceStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public void upsert(String traceId, TracePayload payload) throws TraceStoreException {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(payload, "payload");
        if (!traceId.equals(payload.traceId)) {
            throw new IllegalArgumentException("payload trace_id " + payload.traceId + " does not match key " + traceId);
        }
        try {
            io.appendJsonl(file, mapper.writeValueAsString(payload));
        } catch (IOException e) {
            throw new TraceStoreException("failed to append trace " + traceId + " to " + file, e);
        }
    }

    @Override
    public Optional<TracePayload> find(String traceId) throws TraceStoreException {
        Objects.requireNonNull(traceId, "traceId");
        TracePayload found = null;
        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (!line.contains(traceId)) continue;
                TracePayload p;
                try {
                    p = mapper.readValue(line, TracePayload.class);
                } catch (JsonProcessingException e) {
                    log.warn("trace.skip malformed line in {}: {}", file, e.getOriginalMessage());
                    continue;
                }
                if (traceId.equals(p.traceId)) found = p;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TraceStoreException("failed to read traces from " + file, e);
        }
        return Optional.ofNullable(found);
    }

    public Path file() {
        return file;
    }

    @Override
    public String name() {
        return "jsonl:" + file.getFileName();
    }
}
