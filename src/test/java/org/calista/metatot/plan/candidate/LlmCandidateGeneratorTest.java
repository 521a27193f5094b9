package org.calista.metatot.plan.candidate;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.metatot.plan.tree.DomainPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmCandidateGeneratorTest {

    @Mock
    private InferenceClient client;

    private LlmCandidateGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new LlmCandidateGenerator(client, new ProposalParser(new ObjectMapper(), 300));
    }

    private static ExpansionRequest request(DomainPhase phase, int max) {
        return new ExpansionRequest("s1", "Grow revenue", Map.of("market", "EU"), Map.of("a", 1.0, "b", 0.0),
                "s1/n1", "Enter a new market", 1, phase, List.of("Grow revenue", "Enter a new market"), max);
    }

    @Test
    void testExpand_ParsesProposalsFromClient() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenReturn(
                "{\"proposals\":[{\"content\":\"Partner locally\",\"beliefs\":{\"a\":0.9,\"b\":0.1}}]}");

        // When
        List<Proposal> out = generator.expand(request(DomainPhase.CHALLENGE, 3));

        // Then
        assertEquals(1, out.size());
        assertEquals("Partner locally", out.get(0).content());
        assertEquals(0.9, out.get(0).beliefs().probability("a"), 1e-12);
    }

    @Test
    void testExpand_PromptCarriesPhaseTaskPathAndGoal() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenReturn("[]");
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);

        // When
        generator.expand(request(DomainPhase.EXPLORE, 4));

        // Then
        verify(client).generate(eq(PhasePrompts.SYSTEM), user.capture());
        String prompt = user.getValue();
        assertTrue(prompt.contains("Phase: explore"));
        assertTrue(prompt.contains("Generate 2 to 4 divergent next steps"));
        assertTrue(prompt.contains("Task: Grow revenue"));
        assertTrue(prompt.contains("1. Enter a new market"));
        assertTrue(prompt.contains("a=1.00"));
        assertTrue(prompt.contains("b=0.00"));
        assertTrue(prompt.contains("market=EU"));
    }

    @Test
    void testExpand_IntegratePromptListsSurvivingBranches() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenReturn("[]");
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        ExpansionRequest req = new ExpansionRequest("s1", "Grow revenue", Map.of(), Map.of("a", 1.0, "b", 0.0),
                "s1/n4", "Open a Berlin office", 3, DomainPhase.INTEGRATE,
                List.of("Grow revenue", "Enter a new market", "Open a Berlin office"),
                List.of("Raise prices in the home market", "License the product"), 1);

        // When
        generator.expand(req);

        // Then
        verify(client).generate(eq(PhasePrompts.SYSTEM), user.capture());
        String prompt = user.getValue();
        assertTrue(prompt.contains("Phase: integrate"));
        assertTrue(prompt.contains("surviving branches into one terminal action"));
        assertTrue(prompt.contains("Surviving branches:\n  - Raise prices in the home market\n  - License the product\n"));
        assertTrue(prompt.indexOf("2. Open a Berlin office") < prompt.indexOf("Surviving branches:"));
    }

    @Test
    void testExpand_ExploreRequestHasNoSurvivingBranchesSection() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenReturn("[]");
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);

        // When
        generator.expand(request(DomainPhase.EXPLORE, 4));

        // Then
        verify(client).generate(eq(PhasePrompts.SYSTEM), user.capture());
        assertFalse(user.getValue().contains("Surviving branches:"));
    }

    @Test
    void testExpand_InferenceFailureYieldsEmptyExpansion() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenThrow(new InferenceException("timeout"));

        // When
        List<Proposal> out = generator.expand(request(DomainPhase.EVOLVE, 1));

        // Then
        assertTrue(out.isEmpty());
        verify(client, times(1)).generate(anyString(), anyString());
    }

    @Test
    void testExpand_CapsProposalsAtRequestMaximum() throws Exception {
        // Given
        when(client.generate(anyString(), anyString())).thenReturn("[\"one\", \"two\", \"three\"]");

        // When
        List<Proposal> out = generator.expand(request(DomainPhase.INTEGRATE, 1));

        // Then
        assertEquals(1, out.size());
        assertEquals("one", out.get(0).content());
    }
}
