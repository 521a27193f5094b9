package org.calista.metatot.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.metatot.events.EventStore;
import org.calista.metatot.io.FileIO;
import org.calista.metatot.plan.decision.DecisionThresholds;
import org.calista.metatot.plan.decision.ThresholdTuner;
import org.calista.metatot.plan.trace.InMemoryTraceStore;
import org.calista.metatot.plan.trace.JsonlTraceStore;
import org.calista.metatot.plan.trace.TraceRecorder;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * MetaToTKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config) -> loadOrCreate config + init stores / tuner / JS
 *   2) use           -> composer builds the orchestrator from it
 *   3) close()       -> close JS context
 *
 * No static singletons: lifecycle is explicit.
 */
public final class MetaToTKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetaToTKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final MetaToTConfig cfg;

    private final EventStore events;
    private final TraceRecorder traces;
    private final ThresholdTuner tuner; // nullable: decision.adaptive=false

    private final Context jsContext;

    private MetaToTKernel(FileIO io,
                          ObjectMapper mapper,
                          MetaToTConfig cfg,
                          EventStore events,
                          TraceRecorder traces,
                          ThresholdTuner tuner,
                          Context jsContext) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.events = Objects.requireNonNull(events, "events");
        this.traces = Objects.requireNonNull(traces, "traces");
        this.tuner = tuner;
        this.jsContext = jsContext; // nullable allowed
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        // GraalVM policy
        private boolean enableJs = true;
        private boolean allowHostAccess = false;
        private String warnInterpreterOnly = "false";

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder enableJs(boolean enableJs) {
            this.enableJs = enableJs;
            return this;
        }

        public Builder allowHostAccess(boolean allowHostAccess) {
            this.allowHostAccess = allowHostAccess;
            return this;
        }

        public Builder warnInterpreterOnly(String value) {
            this.warnInterpreterOnly = (value == null ? "false" : value);
            return this;
        }

        public MetaToTKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile);

            MetaToTConfig cfg = MetaToTConfig.loadOrCreate(external, cfgPath, om);

            // Runtime data dir; relative baseDir is taken against configRoot
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = external.baseDir().resolve(base);
            FileIO io = new FileIO(base, FileIO.Options.builder()
                    .charset(charset)
                    .atomicWrites(true)
                    .lockWrites(cfg.trace.lockWrites)
                    .lockTimeout(Duration.ofMillis(cfg.trace.lockTimeoutMs))
                    .build());

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));

            InMemoryTraceStore memory = new InMemoryTraceStore(cfg.trace.fallbackCapacity);
            TraceRecorder traces = cfg.trace.persist
                    ? new TraceRecorder(new JsonlTraceStore(io, om, io.resolve(cfg.trace.logFile)), memory)
                    : new TraceRecorder(null, memory);

            ThresholdTuner tuner = null;
            if (cfg.decision.adaptive) {
                tuner = new ThresholdTuner(io, om, io.resolve(cfg.decision.stateFile),
                        DecisionThresholds.of(cfg.decision.complexityThreshold, cfg.decision.uncertaintyThreshold));
            }

            Context js = enableJs ? buildJsContext(allowHostAccess, warnInterpreterOnly) : null;

            MetaToTKernel k = new MetaToTKernel(io, om, cfg, events, traces, tuner, js);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }

        private static Context buildJsContext(boolean allowHostAccess, String warnInterpreterOnly) {
            HostAccess ha = allowHostAccess ? HostAccess.ALL : HostAccess.NONE;
            return Context.newBuilder("js")
                    .allowHostAccess(ha)
                    .option("engine.WarnInterpreterOnly", warnInterpreterOnly == null ? "false" : warnInterpreterOnly)
                    .build();
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public MetaToTConfig config() { return cfg; }
    public EventStore eventStore() { return events; }
    public TraceRecorder traceRecorder() { return traces; }

    /** Null unless decision.adaptive is on. */
    public ThresholdTuner thresholdTuner() { return tuner; }

    /** JS context can be disabled. */
    public Context jsContext() { return jsContext; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (jsContext == null) return;
        try {
            jsContext.close(true);
        } catch (PolyglotException | IllegalStateException e) {
            log.warn("JS context did not close cleanly: {}", e.getMessage());
        }
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("MetaToTKernel created: config={}, baseDir={}, jsEnabled={}, tracePersist={}, adaptive={}",
                cfgPath, io.baseDir(), (jsContext != null), cfg.trace.persist, (tuner != null));
    }
}
