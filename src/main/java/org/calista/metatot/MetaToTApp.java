package org.calista.metatot;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.core.MetaToTComposer;
import org.calista.metatot.core.MetaToTKernel;
import org.calista.metatot.plan.MetaToT;
import org.calista.metatot.plan.MetaToTLogFmt;
import org.calista.metatot.plan.PlanRequest;
import org.calista.metatot.plan.PlanResult;
import org.calista.metatot.plan.SearchConfig;
import org.calista.metatot.plan.Session;
import org.calista.metatot.plan.candidate.CandidateGenerator;
import org.calista.metatot.plan.tree.ThoughtNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * MetaToTApp — console runner: one task in, result JSON out.
 *
 * Lifecycle:
 *  1) build kernel (config, stores, JS)
 *  2) compose MetaToT
 *  3) run the request
 *  4) close MetaToT (owns generation pool) + kernel (owns JS context)
 */
public final class MetaToTApp {

    private static final Logger log = LogManager.getLogger(MetaToTApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_VIABLE = 2;
    public static final int EXIT_USAGE = 64;
    public static final int EXIT_IO = 74;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: meta-tot \"<task>\" [options]",
            "  --depth N          max tree depth",
            "  --branches N       max proposals per expansion",
            "  --iterations N     max search iterations",
            "  --deadline-ms N    session deadline in milliseconds",
            "  --goal k=v,...     goal vector (default succeeds=1.0,fails=0.0)",
            "  --context k=v,...  context entries (numbers and booleans are typed)",
            "  --config PATH      config file (default config/meta-tot.json)",
            "  --no-js            derive the engine plan without the JS script",
            "  --verbose          print the whole tree");

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, null);
    }

    /**
     * @param generator replaces the configured inference service when not null
     */
    public static int run(String[] args, PrintStream out, PrintStream err, CandidateGenerator generator) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        PlanRequest request;
        try {
            SearchConfig.Builder sc = SearchConfig.builder();
            if (opts.depth != null) sc.maxDepth(opts.depth);
            if (opts.iterations != null) sc.maxIterations(opts.iterations);
            if (opts.deadlineMs != null) sc.deadlineMs(opts.deadlineMs);
            request = PlanRequest.of(opts.task, opts.context, opts.goal, sc.build());
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        MetaToTKernel kernel = null;
        MetaToT metaToT = null;
        try {
            Path cfg = opts.config.toAbsolutePath().normalize();
            kernel = MetaToTKernel.builder()
                    .configRoot(cfg.getParent())
                    .enableJs(opts.js)
                    .allowHostAccess(false)
                    .build(cfg.getFileName());
            if (opts.branches != null) kernel.config().search.branchingFactor = opts.branches;

            MetaToTComposer composer = new MetaToTComposer(kernel);
            metaToT = (generator == null) ? composer.buildMetaToT() : composer.buildMetaToT(generator);

            PlanResult result = metaToT.run(request);
            out.println(kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));

            if (result.session() != null) {
                err.println(pathBox(result.session()));
                if (opts.verbose) err.println(treeDump(result.session()));
            }
            return (result.error() != null) ? EXIT_NO_VIABLE : EXIT_OK;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("result is not serializable", e);
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            err.println("error: " + e.getMessage());
            return EXIT_IO;
        } finally {
            if (metaToT != null) metaToT.close();
            if (kernel != null) kernel.close();
        }
    }

    static String pathBox(Session s) {
        return MetaToTLogFmt.box("Selected path " + s.sessionId(), b -> {
            b.kv("path_efe", String.format(Locale.ROOT, "%.4f", s.pathEfe()));
            b.kv("confidence", String.format(Locale.ROOT, "%.4f", s.confidence()));
            b.kv("stop", s.metrics().stopReason.wire());
            b.sep();
            for (ThoughtNode n : s.selectedNodes()) {
                b.line(String.format(Locale.ROOT, "%d %-9s efe=%.3f %s",
                        n.depth(), n.phase().wire(), n.efe(), clip(n.content(), 90)));
            }
        });
    }

    static String treeDump(Session s) {
        StringBuilder sb = new StringBuilder();
        for (ThoughtNode n : s.nodes()) {
            sb.append("  ".repeat(n.depth()))
                    .append(n.isSelected() ? "* " : "- ")
                    .append(n.id())
                    .append(String.format(Locale.ROOT, " [%s] efe=%.3f visits=%d value=%.3f%s ",
                            n.phase().wire(), n.efe(), n.visits(), n.valueEstimate(), n.isFailed() ? " failed" : ""))
                    .append(clip(n.content(), 120))
                    .append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static String clip(String s, int max) {
        String one = s.replace('\n', ' ');
        return (one.length() <= max) ? one : one.substring(0, max - 3) + "...";
    }

    // ---------------------------------------------------------------------
    // Args
    // ---------------------------------------------------------------------

    static final class Options {
        String task;
        Integer depth;
        Integer branches;
        Integer iterations;
        Long deadlineMs;
        Map<String, Double> goal = defaultGoal();
        Map<String, Object> context = new LinkedHashMap<>();
        Path config = Path.of("config", "meta-tot.json");
        boolean js = true;
        boolean verbose;

        static Options parse(String[] args) {
            if (args == null || args.length == 0) throw new IllegalArgumentException("task is required");
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--depth":
                        o.depth = intArg(a, value(args, ++i, a));
                        break;
                    case "--branches":
                        o.branches = intArg(a, value(args, ++i, a));
                        if (o.branches < 1) throw new IllegalArgumentException("--branches must be >= 1");
                        break;
                    case "--iterations":
                        o.iterations = intArg(a, value(args, ++i, a));
                        break;
                    case "--deadline-ms":
                        o.deadlineMs = longArg(a, value(args, ++i, a));
                        break;
                    case "--goal":
                        o.goal = parseGoal(value(args, ++i, a));
                        break;
                    case "--context":
                        o.context = parseContext(value(args, ++i, a));
                        break;
                    case "--config":
                        o.config = Path.of(value(args, ++i, a));
                        break;
                    case "--no-js":
                        o.js = false;
                        break;
                    case "--verbose":
                        o.verbose = true;
                        break;
                    default:
                        if (a.startsWith("--")) throw new IllegalArgumentException("unknown option " + a);
                        if (o.task != null) throw new IllegalArgumentException("only one task is accepted");
                        o.task = a;
                }
            }
            if (o.task == null) throw new IllegalArgumentException("task is required");
            return o;
        }

        static Map<String, Double> defaultGoal() {
            Map<String, Double> g = new LinkedHashMap<>();
            g.put("succeeds", 1.0);
            g.put("fails", 0.0);
            return g;
        }

        static Map<String, Double> parseGoal(String spec) {
            Map<String, Double> g = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : pairs("--goal", spec).entrySet()) {
                try {
                    g.put(e.getKey(), Double.parseDouble(e.getValue()));
                } catch (NumberFormatException nfe) {
                    throw new IllegalArgumentException("--goal weight for '" + e.getKey() + "' is not a number: " + e.getValue());
                }
            }
            return g;
        }

        static Map<String, Object> parseContext(String spec) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : pairs("--context", spec).entrySet()) {
                ctx.put(e.getKey(), typed(e.getValue()));
            }
            return ctx;
        }

        private static Object typed(String v) {
            if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) return Boolean.parseBoolean(v);
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException e) {
                return v;
            }
        }

        private static Map<String, String> pairs(String flag, String spec) {
            Map<String, String> out = new LinkedHashMap<>();
            for (String part : spec.split(",")) {
                if (part.isBlank()) continue;
                int eq = part.indexOf('=');
                if (eq <= 0) throw new IllegalArgumentException(flag + " expects k=v pairs, got '" + part + "'");
                out.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
            }
            return out;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new IllegalArgumentException(flag + " requires a value");
            return args[i];
        }

        private static int intArg(String flag, String v) {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects an integer, got '" + v + "'");
            }
        }

        private static long longArg(String flag, String v) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects an integer, got '" + v + "'");
            }
        }
    }
}
