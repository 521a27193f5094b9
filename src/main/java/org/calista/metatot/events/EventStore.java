package org.calista.metatot.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.metatot.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public void append(EngineEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<EngineEvent> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        List<EngineEvent> out = new ArrayList<>(lines.size());
        for (String l : lines) out.add(mapper.readValue(l, EngineEvent.class));
        return out;
    }

    public Path file() {
        return file;
    }
}
