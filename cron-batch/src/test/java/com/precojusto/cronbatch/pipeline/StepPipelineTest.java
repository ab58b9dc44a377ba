package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.JobType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StepPipelineTest {

    private final StepPipeline pipeline = StepPipeline.builder(JobType.FLAG_REEVALUATION)
            .step("RESEARCH", String.class, Set.of(), context -> "r")
            .step("ANALYSIS", String.class, Set.of("RESEARCH"), context -> "a")
            .step("EVALUATION", String.class, Set.of("ANALYSIS"), context -> "e")
            .build();

    @Test
    void testNextStep_ReturnsFirstStepWithoutCheckpoint() {
        assertEquals("RESEARCH", pipeline.nextStep(Set.of()).orElseThrow().getName());
        assertEquals("ANALYSIS", pipeline.nextStep(Set.of("RESEARCH")).orElseThrow().getName());
        assertEquals("EVALUATION", pipeline.nextStep(Set.of("RESEARCH", "ANALYSIS")).orElseThrow().getName());
        assertTrue(pipeline.nextStep(Set.of("RESEARCH", "ANALYSIS", "EVALUATION")).isEmpty());
    }

    @Test
    void testNextStep_UnknownCheckpointNamesAreIgnored() {
        assertEquals("RESEARCH", pipeline.nextStep(Set.of("LEGACY_STEP")).orElseThrow().getName());
    }

    @Test
    void testStep_WithoutExplicitDependencies_DependsOnAllPriorSteps() {
        // Act
        StepPipeline chained = StepPipeline.builder(JobType.AI_REPORT)
                .step("RESEARCH", String.class, context -> "r")
                .step("ANALYSIS", String.class, context -> "a")
                .step("COMPILATION", String.class, context -> "c")
                .build();

        // Assert
        assertEquals(Set.of(), chained.step("RESEARCH").orElseThrow().getDependsOn());
        assertEquals(Set.of("RESEARCH", "ANALYSIS"), chained.step("COMPILATION").orElseThrow().getDependsOn());
        assertEquals(2, chained.step("COMPILATION").orElseThrow().getOrdinal());
    }

    @Test
    void testBuilder_DependencyOnLaterStep_Rejected() {
        StepPipeline.Builder builder = StepPipeline.builder(JobType.AI_REPORT);

        assertThrows(IllegalArgumentException.class,
                () -> builder.step("ANALYSIS", String.class, Set.of("RESEARCH"), context -> "a"));
    }

    @Test
    void testBuilder_DuplicateOrEmpty_Rejected() {
        StepPipeline.Builder builder = StepPipeline.builder(JobType.AI_REPORT)
                .step("RESEARCH", String.class, context -> "r");

        assertThrows(IllegalArgumentException.class, () -> builder.step("RESEARCH", String.class, context -> "r"));
        assertThrows(IllegalStateException.class, () -> StepPipeline.builder(JobType.AI_REPORT).build());
    }
}
