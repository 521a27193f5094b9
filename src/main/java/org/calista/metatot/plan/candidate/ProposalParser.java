package org.calista.metatot.plan.candidate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.metatot.plan.inference.BeliefDistribution;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ProposalParser — терпимый разбор ответа модели.
 *
 * <p>Поддерживаемые формы (по убыванию приоритета):</p>
 * <ul>
 *   <li>объект {"proposals": [...]}</li>
 *   <li>JSON-массив объектов или строк</li>
 *   <li>ответ, обёрнутый в ```json ... ```</li>
 *   <li>построчный текст (последний вариант)</li>
 * </ul>
 *
 * <p>Строки без beliefs получают двухгипотезное распределение
 * {@value #YES} / {@value #NO} из опционального confidence.</p>
 */
public final class ProposalParser {

    private static final Logger log = LogManager.getLogger(ProposalParser.class);

    public static final String YES = "succeeds";
    public static final String NO = "fails";
    public static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]+|\\d+[.)])\\s*");
    private static final String[] CONTENT_KEYS = {"content", "thought", "text", "proposal", "step"};
    private static final String[] BELIEF_KEYS = {"beliefs", "belief_hypotheses", "hypotheses"};

    private final ObjectMapper mapper;
    private final int maxChars;

    public ProposalParser(ObjectMapper mapper, int maxChars) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.maxChars = Math.max(32, maxChars);
    }

    public List<Proposal> parse(String raw, int maxProposals) {
        if (raw == null || raw.isBlank() || maxProposals < 1) return List.of();

        String cleaned = stripFences(raw.trim());
        List<Proposal> out = new ArrayList<>(Math.min(maxProposals, 8));
        Set<String> seen = new LinkedHashSet<>();

        JsonNode root = tryReadTree(cleaned);
        if (root != null && (root.isArray() || root.isObject())) {
            JsonNode items = root;
            if (root.isObject()) {
                JsonNode p = root.get("proposals");
                items = (p != null && p.isArray()) ? p : mapper.createArrayNode().add(root);
            }
            for (JsonNode item : items) {
                if (out.size() >= maxProposals) break;
                Proposal pr = fromNode(item);
                if (pr != null && seen.add(key(pr.content()))) out.add(pr);
            }
            return out;
        }

        for (String line : cleaned.split("\\R")) {
            if (out.size() >= maxProposals) break;
            String s = LIST_MARKER.matcher(line).replaceFirst("").trim();
            if (s.isEmpty()) continue;
            Proposal pr = new Proposal(clip(s), defaultBeliefs(DEFAULT_CONFIDENCE));
            if (seen.add(key(pr.content()))) out.add(pr);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Proposal fromNode(JsonNode item) {
        if (item == null || item.isNull()) return null;

        if (item.isTextual()) {
            String s = item.asText().trim();
            return s.isEmpty() ? null : new Proposal(clip(s), defaultBeliefs(DEFAULT_CONFIDENCE));
        }
        if (!item.isObject()) return null;

        String content = null;
        for (String k : CONTENT_KEYS) {
            JsonNode c = item.get(k);
            if (c != null && c.isTextual() && !c.asText().isBlank()) {
                content = c.asText().trim();
                break;
            }
        }
        if (content == null) {
            log.warn("proposal.drop reason=no_content keys={}", fieldNames(item));
            return null;
        }

        JsonNode beliefsNode = null;
        for (String k : BELIEF_KEYS) {
            JsonNode b = item.get(k);
            if (b != null && b.isObject()) {
                beliefsNode = b;
                break;
            }
        }

        if (beliefsNode == null) {
            JsonNode conf = item.get("confidence");
            double c = (conf != null && conf.isNumber()) ? conf.asDouble() : DEFAULT_CONFIDENCE;
            return new Proposal(clip(content), defaultBeliefs(c));
        }

        LinkedHashMap<String, Double> weights = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = beliefsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey() == null || e.getKey().isBlank() || !e.getValue().isNumber()) continue;
            double v = e.getValue().asDouble();
            if (Double.isFinite(v) && v >= 0.0) weights.put(e.getKey().trim(), v);
        }
        boolean anyPositive = false;
        for (double v : weights.values()) anyPositive |= v > 0.0;
        if (!anyPositive) {
            log.warn("proposal.drop reason=no_usable_hypotheses content='{}'", abbreviate(content));
            return null;
        }
        try {
            return new Proposal(clip(content), BeliefDistribution.normalized(weights));
        } catch (IllegalArgumentException e) {
            log.warn("proposal.drop reason=bad_beliefs content='{}': {}", abbreviate(content), e.getMessage());
            return null;
        }
    }

    static BeliefDistribution defaultBeliefs(double confidence) {
        return BeliefDistribution.binary(YES, NO, confidence);
    }

    private JsonNode tryReadTree(String s) {
        if (s.isEmpty()) return null;
        char c = s.charAt(0);
        if (c != '[' && c != '{') return null;
        try {
            return mapper.readTree(s);
        } catch (JsonProcessingException e) {
            log.debug("proposal.parse not JSON, falling back to lines: {}", e.getOriginalMessage());
            return null;
        }
    }

    static String stripFences(String s) {
        if (!s.startsWith("```")) return s;
        int nl = s.indexOf('\n');
        String body = (nl < 0) ? s.substring(3) : s.substring(nl + 1);
        int end = body.lastIndexOf("```");
        if (end >= 0) body = body.substring(0, end);
        return body.trim();
    }

    private String clip(String s) {
        return s.length() <= maxChars ? s : s.substring(0, maxChars).trim();
    }

    private static String key(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static String abbreviate(String s) {
        return s.length() > 80 ? s.substring(0, 80) + "…" : s;
    }

    private static List<String> fieldNames(JsonNode n) {
        List<String> names = new ArrayList<>();
        n.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
