package org.calista.metatot.core;

import com.fasterxml.jackson.core.type.TypeReference;
import org.calista.metatot.plan.MetaToT;
import org.calista.metatot.plan.candidate.Proposal;
import org.calista.metatot.plan.inference.BeliefDistribution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetaToTComposerTest {

    private static final String CONFIG = "{"
            + "\"search\":{\"maxDepth\":3,\"deadlineMs\":1500,\"parallelExpansions\":8,\"cyclePhases\":false},"
            + "\"inference\":{\"callTimeoutMs\":4000},"
            + "\"pool\":{\"parallelism\":2},"
            + "\"scoring\":{\"divergence\":\"TOTAL_VARIATION\"}"
            + "}";

    @TempDir
    Path dir;

    private MetaToTKernel kernel(boolean js) throws Exception {
        Files.writeString(dir.resolve("meta-tot.json"), CONFIG);
        return MetaToTKernel.builder().configRoot(dir).enableJs(js).build(Path.of("meta-tot.json"));
    }

    @Test
    void testPlan_CapsTimeoutAndFanOut() throws Exception {
        // Given
        try (MetaToTKernel k = kernel(false)) {
            MetaToTComposer composer = new MetaToTComposer(k);

            // When
            Map<String, Object> plan = composer.plan();

            // Then
            assertEquals(3, ((Number) plan.get("maxDepth")).intValue());
            assertEquals(1500L, ((Number) plan.get("callTimeoutMs")).longValue());
            assertEquals(2, ((Number) plan.get("parallelExpansions")).intValue());
            assertEquals(Boolean.FALSE, plan.get("cyclePhases"));
            assertEquals("TOTAL_VARIATION", plan.get("divergence"));
            assertTrue(plan.get("pool") instanceof Map);
        }
    }

    @Test
    void testBuildMetaToT_AppliesPlanToBudget() throws Exception {
        try (MetaToTKernel k = kernel(false);
             MetaToT metaToT = new MetaToTComposer(k).buildMetaToT(req -> List.of(
                     new Proposal("x", BeliefDistribution.of(Map.of("succeeds", 1.0)))))) {

            assertEquals(3, metaToT.getDefaults().maxDepth);
            assertEquals(1500L, metaToT.getDefaults().callTimeoutMs);
            assertEquals(2, metaToT.getDefaults().parallelExpansions);
            assertFalse(metaToT.getDefaults().cyclePhases);
            assertSame(k.traceRecorder(), metaToT.getRecorder());
        }
    }

    @Test
    void testBuildMetaToT_UnknownProviderRejected() throws Exception {
        try (MetaToTKernel k = kernel(false)) {
            k.config().inference.provider = "mystery";

            assertThrows(IllegalStateException.class, () -> new MetaToTComposer(k).buildMetaToT());
        }
    }

    @Test
    void testBuildPlan_ScriptMatchesJavaDerivation() throws Exception {
        try (MetaToTKernel k = kernel(true)) {
            MetaToTComposer composer = new MetaToTComposer(k);
            String cfgJson = k.mapper().writeValueAsString(k.config());

            Map<String, Object> fromJs = k.mapper().readValue(composer.buildPlan(cfgJson),
                    new TypeReference<Map<String, Object>>() {});
            Map<String, Object> fromJava = k.mapper().readValue(composer.javaPlan(cfgJson),
                    new TypeReference<Map<String, Object>>() {});

            assertEquals(fromJava, fromJs);
        }
    }
}
