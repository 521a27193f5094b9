package org.calista.metatot.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineEvent {
    public static final String DECISION = "DECISION";
    public static final String SESSION = "SESSION";
    public static final String TRACE = "TRACE";

    public String type;        // DECISION / SESSION / TRACE
    public long tsEpochMs;
    public String sessionId;   // null for direct decisions
    public String text;        // rationale / summary / trace id

    public static EngineEvent of(String type, String sessionId, String text, long tsEpochMs) {
        EngineEvent e = new EngineEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
