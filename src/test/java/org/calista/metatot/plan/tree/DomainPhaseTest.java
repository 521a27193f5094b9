package org.calista.metatot.plan.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainPhaseTest {

    @Test
    void testForExpansion_CyclesThroughPhases() {
        assertEquals(DomainPhase.EXPLORE, DomainPhase.forExpansion(0, 10, true));
        assertEquals(DomainPhase.CHALLENGE, DomainPhase.forExpansion(1, 10, true));
        assertEquals(DomainPhase.EVOLVE, DomainPhase.forExpansion(2, 10, true));
        assertEquals(DomainPhase.INTEGRATE, DomainPhase.forExpansion(3, 10, true));
        assertEquals(DomainPhase.EXPLORE, DomainPhase.forExpansion(4, 10, true));
    }

    @Test
    void testForExpansion_HoldsLastPhaseWithoutCycle() {
        assertEquals(DomainPhase.INTEGRATE, DomainPhase.forExpansion(3, 10, false));
        assertEquals(DomainPhase.INTEGRATE, DomainPhase.forExpansion(6, 10, false));
    }

    @Test
    void testForExpansion_LastLevelAlwaysIntegrates() {
        assertEquals(DomainPhase.INTEGRATE, DomainPhase.forExpansion(0, 1, true));
        assertEquals(DomainPhase.INTEGRATE, DomainPhase.forExpansion(2, 3, true));
        assertThrows(IllegalArgumentException.class, () -> DomainPhase.forExpansion(-1, 3, true));
    }

    @Test
    void testMaxProposals_PhaseBounds() {
        assertEquals(2, DomainPhase.EXPLORE.maxProposals(1));
        assertEquals(3, DomainPhase.EXPLORE.maxProposals(3));
        assertEquals(4, DomainPhase.EXPLORE.maxProposals(9));
        assertEquals(5, DomainPhase.CHALLENGE.maxProposals(5));
        assertEquals(1, DomainPhase.EVOLVE.maxProposals(5));
        assertEquals(1, DomainPhase.INTEGRATE.maxProposals(5));
        assertThrows(IllegalStateException.class, () -> DomainPhase.LEAF.maxProposals(3));
    }

    @Test
    void testWire_LowercaseRoundTrip() {
        assertEquals("challenge", DomainPhase.CHALLENGE.wire());
        assertEquals(DomainPhase.LEAF, DomainPhase.fromWire(" leaf "));
    }
}
