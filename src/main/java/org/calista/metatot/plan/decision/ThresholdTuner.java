package org.calista.metatot.plan.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * ThresholdTuner — адаптация T_c/T_u по полезности прошедших глубоких поисков.
 *
 * <pre>
 * utility = clamp01(confidence - min(duration / deadline, 1))
 * ema     = 0.1 * utility + 0.9 * ema          (start 0.5)
 * ema > 0.6  => оба порога -0.02
 * ema < 0.4  => оба порога +0.02
 * пороги в [0.3, 0.9]
 * </pre>
 *
 * Состояние хранится JSON-файлом (атомарная запись через FileIO).
 */
public final class ThresholdTuner {

    private static final Logger log = LogManager.getLogger(ThresholdTuner.class);

    public static final double THRESHOLD_MIN = 0.3;
    public static final double THRESHOLD_MAX = 0.9;
    public static final double ADJUST_STEP = 0.02;
    public static final double UTILITY_LOW = 0.4;
    public static final double UTILITY_HIGH = 0.6;
    public static final double EMA_ALPHA = 0.1;
    public static final double EMA_INITIAL = 0.5;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class State {
        public double complexityThreshold;
        public double uncertaintyThreshold;
        public double emaUtility = EMA_INITIAL;
        public long sampleCount;
        public long updatedAtEpochMs;
    }

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path stateFile;
    private final State state;

    /**
     * Loads persisted state, or seeds it from the configured thresholds.
     */
    public ThresholdTuner(FileIO io, ObjectMapper mapper, Path stateFile, DecisionThresholds seed) throws IOException {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile");
        Objects.requireNonNull(seed, "seed");

        Optional<String> json = io.readStringIfExists(stateFile);
        State s = null;
        if (json.isPresent() && !json.get().isBlank()) {
            s = mapper.readValue(json.get(), State.class);
        }
        if (s == null) {
            s = new State();
            s.complexityThreshold = seed.complexity();
            s.uncertaintyThreshold = seed.uncertainty();
            log.info("Threshold state not found. Seeded from config: {}", seed);
        }
        clamp(s);
        this.state = s;
    }

    public synchronized DecisionThresholds current() {
        return DecisionThresholds.of(state.complexityThreshold, state.uncertaintyThreshold);
    }

    public synchronized double emaUtility() {
        return state.emaUtility;
    }

    public synchronized long sampleCount() {
        return state.sampleCount;
    }

    /**
     * Feeds one deep-search result and persists the new state.
     *
     * @return thresholds after the update
     */
    public synchronized DecisionThresholds observe(double confidence, long durationMs, long deadlineMs) throws IOException {
        double budget = (deadlineMs <= 0) ? 5000.0 : deadlineMs;
        double c = Double.isFinite(confidence) ? confidence : 0.0;
        double utility = clamp01(c - Math.min(Math.max(0L, durationMs) / budget, 1.0));

        state.emaUtility = EMA_ALPHA * utility + (1.0 - EMA_ALPHA) * state.emaUtility;
        state.sampleCount++;
        state.updatedAtEpochMs = System.currentTimeMillis();

        if (state.emaUtility > UTILITY_HIGH) {
            state.complexityThreshold -= ADJUST_STEP;
            state.uncertaintyThreshold -= ADJUST_STEP;
        } else if (state.emaUtility < UTILITY_LOW) {
            state.complexityThreshold += ADJUST_STEP;
            state.uncertaintyThreshold += ADJUST_STEP;
        }
        clamp(state);

        io.writeString(stateFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state) + System.lineSeparator());
        log.debug("thresholds.update utility={} ema={} T_c={} T_u={}",
                utility, state.emaUtility, state.complexityThreshold, state.uncertaintyThreshold);
        return current();
    }

    private static void clamp(State s) {
        s.complexityThreshold = clampRange(s.complexityThreshold);
        s.uncertaintyThreshold = clampRange(s.uncertaintyThreshold);
        if (!Double.isFinite(s.emaUtility)) s.emaUtility = EMA_INITIAL;
    }

    private static double clampRange(double v) {
        if (!Double.isFinite(v)) return THRESHOLD_MAX;
        return Math.max(THRESHOLD_MIN, Math.min(THRESHOLD_MAX, v));
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
