package org.calista.metatot.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.metatot.io.FileIO;
import org.calista.metatot.plan.inference.DivergenceMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * MetaToTConfig — простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetaToTConfig {

    private static final Logger log = LoggerFactory.getLogger(MetaToTConfig.class);

    public String baseDir = "data";
    public Search search = new Search();
    public Scoring scoring = new Scoring();
    public Inference inference = new Inference();
    public Pool pool = new Pool();
    public Decision decision = new Decision();
    public Trace trace = new Trace();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        public int maxIterations = 32;
        public int maxDepth = 4;
        public long deadlineMs = 5000;
        public double explorationConstant = 1.41;
        public int branchingFactor = 3;
        public double unexploredMalus = 0.5;
        public int parallelExpansions = 3;
        public boolean cyclePhases = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scoring {
        /** COSINE | TOTAL_VARIATION */
        public String divergence = "COSINE";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Inference {
        public String provider = "ollama";
        public String baseUrl = "http://localhost:11434";
        public String model = "llama3.1";
        public double temperature = 0.2;
        public long callTimeoutMs = 4000;
        public int maxProposalChars = 600;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Pool {
        public int parallelism = 4;
        public int queueCapacity = 256;
        public String threadNamePrefix = "meta-tot-gen-";
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Decision {
        public double complexityThreshold = 0.7;
        public double uncertaintyThreshold = 0.6;
        public int minTokenThreshold = 160;
        public boolean alwaysOn = false;
        public boolean adaptive = false;
        public String stateFile = "thresholds.json";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Trace {
        public boolean persist = true;
        public String logFile = "traces.jsonl";
        public int fallbackCapacity = 256;
        public boolean lockWrites = true;
        public long lockTimeoutMs = 3000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    // -------------------- Load / Save --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static MetaToTConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            MetaToTConfig created = new MetaToTConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            MetaToTConfig created = new MetaToTConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        MetaToTConfig cfg = mapper.readValue(json, MetaToTConfig.class);
        if (cfg == null) cfg = new MetaToTConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, MetaToTConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, MetaToTConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    /** Parsed {@link Scoring#divergence}; call after {@link #validate()}. */
    public DivergenceMetric divergenceMetric() {
        return DivergenceMetric.valueOf(scoring.divergence);
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (search == null) search = new Search();
        if (search.maxIterations < 1) search.maxIterations = 1;
        if (search.maxDepth < 1) search.maxDepth = 1;
        if (search.deadlineMs < 1) search.deadlineMs = 1;
        if (!Double.isFinite(search.explorationConstant) || search.explorationConstant < 0.0) search.explorationConstant = 1.41;
        if (search.branchingFactor < 1) search.branchingFactor = 1;
        if (!Double.isFinite(search.unexploredMalus) || search.unexploredMalus < 0.0) search.unexploredMalus = 0.5;
        if (search.parallelExpansions < 1) search.parallelExpansions = 1;

        if (scoring == null) scoring = new Scoring();
        String metric = (scoring.divergence == null) ? "" : scoring.divergence.trim().toUpperCase(Locale.ROOT);
        try {
            DivergenceMetric.valueOf(metric);
            scoring.divergence = metric;
        } catch (IllegalArgumentException e) {
            log.warn("Unknown scoring.divergence '{}'; using COSINE", scoring.divergence);
            scoring.divergence = DivergenceMetric.COSINE.name();
        }

        if (inference == null) inference = new Inference();
        if (inference.provider == null || inference.provider.isBlank()) inference.provider = "ollama";
        if (inference.baseUrl == null || inference.baseUrl.isBlank()) inference.baseUrl = "http://localhost:11434";
        if (inference.model == null || inference.model.isBlank()) inference.model = "llama3.1";
        if (!Double.isFinite(inference.temperature) || inference.temperature < 0.0) inference.temperature = 0.2;
        if (inference.callTimeoutMs < 100) inference.callTimeoutMs = 100;
        if (inference.maxProposalChars < 40) inference.maxProposalChars = 40;

        if (pool == null) pool = new Pool();
        if (pool.parallelism < 1) pool.parallelism = 1;
        if (pool.parallelism > 16) pool.parallelism = 16;
        if (pool.queueCapacity < 16) pool.queueCapacity = 16;
        if (pool.threadNamePrefix == null || pool.threadNamePrefix.isBlank()) pool.threadNamePrefix = "meta-tot-gen-";
        if (pool.shutdownTimeoutMs < 250) pool.shutdownTimeoutMs = 250;

        if (decision == null) decision = new Decision();
        decision.complexityThreshold = clamp01(decision.complexityThreshold, 0.7);
        decision.uncertaintyThreshold = clamp01(decision.uncertaintyThreshold, 0.6);
        if (decision.minTokenThreshold < 1) decision.minTokenThreshold = 160;
        if (decision.stateFile == null || decision.stateFile.isBlank()) decision.stateFile = "thresholds.json";

        if (trace == null) trace = new Trace();
        if (trace.logFile == null || trace.logFile.isBlank()) trace.logFile = "traces.jsonl";
        if (trace.fallbackCapacity < 1) trace.fallbackCapacity = 1;
        if (trace.lockTimeoutMs < 10) trace.lockTimeoutMs = 10;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
    }

    private static double clamp01(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
