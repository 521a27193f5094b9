package org.calista.metatot.plan.candidate;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProposalParserTest {

    private ProposalParser parser;

    @BeforeEach
    void setUp() {
        parser = new ProposalParser(new ObjectMapper(), 200);
    }

    @Test
    void testParse_ProposalsObjectWithBeliefs() {
        String raw = "{\"proposals\": ["
                + "{\"content\": \"Ship a pilot\", \"beliefs\": {\"a\": 3, \"b\": 1}},"
                + "{\"content\": \"Run a survey\", \"belief_hypotheses\": {\"a\": 0.5, \"b\": 0.5}}"
                + "]}";

        List<Proposal> out = parser.parse(raw, 4);

        assertEquals(2, out.size());
        assertEquals("Ship a pilot", out.get(0).content());
        assertEquals(0.75, out.get(0).beliefs().probability("a"), 1e-12);
        assertEquals(0.5, out.get(1).beliefs().probability("b"), 1e-12);
    }

    @Test
    void testParse_FencedArrayOfStringsGetsDefaultBeliefs() {
        String raw = "```json\n[\"first idea\", \"second idea\"]\n```";

        List<Proposal> out = parser.parse(raw, 4);

        assertEquals(2, out.size());
        assertEquals("second idea", out.get(1).content());
        assertEquals(0.5, out.get(0).beliefs().probability(ProposalParser.YES), 1e-12);
        assertEquals(0.5, out.get(0).beliefs().probability(ProposalParser.NO), 1e-12);
    }

    @Test
    void testParse_ConfidenceBecomesBinaryBelief() {
        String raw = "[{\"thought\": \"Negotiate the contract\", \"confidence\": 0.8}]";

        List<Proposal> out = parser.parse(raw, 3);

        assertEquals(1, out.size());
        assertEquals(0.8, out.get(0).beliefs().probability(ProposalParser.YES), 1e-12);
        assertEquals(0.2, out.get(0).beliefs().probability(ProposalParser.NO), 1e-12);
    }

    @Test
    void testParse_DropsItemsWithoutContentOrUsableBeliefs() {
        String raw = "[{\"beliefs\": {\"a\": 1}},"
                + "{\"content\": \"zero weights\", \"beliefs\": {\"a\": 0, \"b\": 0}},"
                + "{\"content\": \"kept\"}]";

        List<Proposal> out = parser.parse(raw, 5);

        assertEquals(1, out.size());
        assertEquals("kept", out.get(0).content());
    }

    @Test
    void testParse_OverflowingWeightsNormalizeInsteadOfFailing() {
        String raw = "[{\"content\": \"huge weights\", \"beliefs\": {\"a\": 1e308, \"b\": 1e308}},"
                + "{\"content\": \"normal\", \"beliefs\": {\"a\": 1, \"b\": 3}}]";

        List<Proposal> out = parser.parse(raw, 5);

        assertEquals(2, out.size());
        assertEquals("huge weights", out.get(0).content());
        assertEquals(0.5, out.get(0).beliefs().probability("a"), 1e-12);
        assertEquals(1.0, out.get(0).beliefs().sum(), 1e-6);
        assertEquals(0.75, out.get(1).beliefs().probability("b"), 1e-12);
    }

    @Test
    void testParse_RespectsMaxAndRemovesDuplicates() {
        String raw = "[\"Same  idea\", \"same idea\", \"other\", \"third\"]";

        List<Proposal> out = parser.parse(raw, 2);

        assertEquals(2, out.size());
        assertEquals("Same  idea", out.get(0).content());
        assertEquals("other", out.get(1).content());
    }

    @Test
    void testParse_LineFallbackStripsListMarkers() {
        String raw = "1. Talk to customers\n- Build a prototype\n\n* Measure churn";

        List<Proposal> out = parser.parse(raw, 4);

        assertEquals(3, out.size());
        assertEquals("Talk to customers", out.get(0).content());
        assertEquals("Build a prototype", out.get(1).content());
        assertEquals("Measure churn", out.get(2).content());
    }

    @Test
    void testParse_BlankOrBrokenJsonInput() {
        assertTrue(parser.parse("   ", 3).isEmpty());
        assertTrue(parser.parse(null, 3).isEmpty());

        List<Proposal> out = parser.parse("{not json", 3);
        assertEquals(1, out.size());
        assertEquals("{not json", out.get(0).content());
    }

    @Test
    void testParse_ClipsLongContent() {
        ProposalParser small = new ProposalParser(new ObjectMapper(), 40);
        String longText = "x".repeat(100);

        List<Proposal> out = small.parse("[\"" + longText + "\"]", 1);

        assertEquals(40, out.get(0).content().length());
    }

    @Test
    void testStripFences() {
        assertEquals("[1]", ProposalParser.stripFences("```json\n[1]\n```"));
        assertEquals("plain", ProposalParser.stripFences("plain"));
    }
}
