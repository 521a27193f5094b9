package org.calista.metatot.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.metatot.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    @TempDir
    Path dir;

    @Test
    void testAppend_ReadAllKeepsOrder() throws Exception {
        // Given
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));

        // When
        store.append(EngineEvent.of(EngineEvent.DECISION, null, "direct: low scores", 1L));
        store.append(EngineEvent.of(EngineEvent.TRACE, "mtot-1", "trace-1", 2L));

        // Then
        List<EngineEvent> all = store.readAll();
        assertEquals(2, all.size());
        assertEquals(EngineEvent.DECISION, all.get(0).type);
        assertNull(all.get(0).sessionId);
        assertEquals("trace-1", all.get(1).text);
        assertEquals(2L, all.get(1).tsEpochMs);
    }
}
