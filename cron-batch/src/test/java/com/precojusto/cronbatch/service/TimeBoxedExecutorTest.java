package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.NonRetryableStepException;
import com.precojusto.cronbatch.exception.UnknownJobException;
import com.precojusto.cronbatch.support.EngineHarness;
import com.precojusto.cronbatch.support.ScriptedJobHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Executor runs over in-memory stores: resumption from checkpoints, the time
 * budget, failure isolation and daily progress.
 */
class TimeBoxedExecutorTest {

    private static final String RESEARCH = "RESEARCH";
    private static final String ANALYSIS = "ANALYSIS";
    private static final String EVALUATION = "EVALUATION";

    private EngineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.stop();
        }
    }

    @Test
    void testRun_ResumesEachItemFromItsFirstMissingStep() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.FLAG_REEVALUATION, RESEARCH, ANALYSIS, EVALUATION);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.FLAG_REEVALUATION, "A");
        WorkItem b = harness.enqueue(JobType.FLAG_REEVALUATION, "B");
        WorkItem c = harness.enqueue(JobType.FLAG_REEVALUATION, "C");
        harness.checkpoint(b, RESEARCH);
        harness.checkpoint(c, RESEARCH);
        harness.checkpoint(c, ANALYSIS);

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.FLAG_REEVALUATION);

        // Assert
        assertEquals(List.of(
                "A:RESEARCH", "A:ANALYSIS", "A:EVALUATION", "A:FINALIZE",
                "B:ANALYSIS", "B:EVALUATION", "B:FINALIZE",
                "C:EVALUATION", "C:FINALIZE"), handler.getCalls());

        for (WorkItem item : List.of(a, b, c)) {
            assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(item.getId()));
        }
        assertEquals("result-A", harness.getWorkItemSource().get(a.getId()).getResultId());
        assertEquals(0, harness.getCheckpointStore().stepCount());

        assertEquals(3, result.getProcessed());
        assertEquals(3, result.getCounted());
        assertFalse(result.isHasMore());
        assertFalse(result.isTimedOut());
        assertTrue(result.getErrors().isEmpty());

        BatchProgress progress = globalProgress(JobType.FLAG_REEVALUATION);
        assertEquals(3, progress.getProcessedCount());
        assertEquals(3, progress.getTotalCount());
        assertNotNull(progress.getCompletedAt());
        assertEquals(String.valueOf(c.getId()), progress.getLastProcessedScopeId());
    }

    @Test
    void testRun_BudgetExhaustedAfterFirstStep_LeavesOtherItemsUntouched() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.FLAG_REEVALUATION, RESEARCH, ANALYSIS, EVALUATION);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.FLAG_REEVALUATION, "A");
        WorkItem b = harness.enqueue(JobType.FLAG_REEVALUATION, "B");
        WorkItem c = harness.enqueue(JobType.FLAG_REEVALUATION, "C");
        harness.checkpoint(b, RESEARCH);
        harness.checkpoint(c, RESEARCH);
        harness.checkpoint(c, ANALYSIS);
        handler.on("A", RESEARCH, () -> harness.getClock().advance(EngineHarness.BUDGET));

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.FLAG_REEVALUATION);

        // Assert
        assertEquals(List.of("A:RESEARCH"), handler.getCalls());
        assertEquals(ItemStatus.PROCESSING, harness.getWorkItemSource().statusOf(a.getId()));
        assertTrue(harness.getCheckpointStore().load(JobType.FLAG_REEVALUATION, a.scopeId(), RESEARCH).isPresent());

        assertEquals(ItemStatus.PENDING, harness.getWorkItemSource().statusOf(b.getId()));
        assertNull(harness.getWorkItemSource().get(b.getId()).getLastProcessedAt());
        assertEquals(ItemStatus.PENDING, harness.getWorkItemSource().statusOf(c.getId()));
        assertEquals(4, harness.getCheckpointStore().stepCount());

        assertEquals(0, result.getProcessed());
        assertTrue(result.isHasMore());
        assertTrue(result.isTimedOut());
        assertTrue(result.getMessage().startsWith("Time budget exhausted"));
        assertEquals(0, globalProgress(JobType.FLAG_REEVALUATION).getProcessedCount());
    }

    @Test
    void testRun_NextInvocationResumesInterruptedItemWithoutRepeatingSteps() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.FLAG_REEVALUATION, RESEARCH, ANALYSIS, EVALUATION);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.FLAG_REEVALUATION, "A");
        harness.enqueue(JobType.FLAG_REEVALUATION, "B");
        handler.on("A", RESEARCH, () -> harness.getClock().advance(EngineHarness.BUDGET));
        harness.getExecutor().run(JobType.FLAG_REEVALUATION);
        handler.on("A", RESEARCH, () -> { });
        harness.getClock().advance(Duration.ofMinutes(1));

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.FLAG_REEVALUATION);

        // Assert
        assertEquals(List.of("A:RESEARCH",
                "B:RESEARCH", "B:ANALYSIS", "B:EVALUATION", "B:FINALIZE",
                "A:ANALYSIS", "A:EVALUATION", "A:FINALIZE"), handler.getCalls());
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(a.getId()));
        assertEquals(2, result.getProcessed());
        assertFalse(result.isHasMore());
        assertEquals(2, globalProgress(JobType.FLAG_REEVALUATION).getProcessedCount());
    }

    @Test
    void testRun_BudgetExhaustedBetweenItems_ProgressCountsFinishedItemsOnly() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.FLAG_REEVALUATION, RESEARCH, ANALYSIS);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.FLAG_REEVALUATION, "A");
        WorkItem b = harness.enqueue(JobType.FLAG_REEVALUATION, "B");
        handler.on("A", "FINALIZE", () -> harness.getClock().advance(EngineHarness.BUDGET));

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.FLAG_REEVALUATION);

        // Assert
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(a.getId()));
        assertEquals(ItemStatus.PENDING, harness.getWorkItemSource().statusOf(b.getId()));
        assertEquals(0, handler.callsFor("B"));
        assertEquals(1, result.getProcessed());
        assertTrue(result.isHasMore());

        BatchProgress progress = globalProgress(JobType.FLAG_REEVALUATION);
        assertEquals(1, progress.getProcessedCount());
        assertEquals(2, progress.getTotalCount());
        assertNull(progress.getCompletedAt());
    }

    @Test
    void testRun_FanOut_FailingItemDoesNotStopSiblings() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.AI_REPORT, RESEARCH, ANALYSIS);
        harness = new EngineHarness()
                .withProperty("batch.jobs.ai-report.parallelism", "3")
                .start(handler);
        WorkItem a = harness.enqueue(JobType.AI_REPORT, "A");
        WorkItem b = harness.enqueue(JobType.AI_REPORT, "B");
        WorkItem c = harness.enqueue(JobType.AI_REPORT, "C");
        handler.on("B", ANALYSIS, () -> {
            throw new IllegalStateException("provider overloaded");
        });

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.AI_REPORT);

        // Assert
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(a.getId()));
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(c.getId()));

        WorkItem failed = harness.getWorkItemSource().get(b.getId());
        assertEquals(ItemStatus.PROCESSING, failed.getStatus());
        assertEquals(1, failed.getRetryCount());
        assertEquals("provider overloaded", failed.getLastError());
        assertTrue(harness.getCheckpointStore().load(JobType.AI_REPORT, b.scopeId(), RESEARCH).isPresent());

        assertEquals(2, result.getCounted());
        assertEquals(List.of(b.getId() + ": provider overloaded"), result.getErrors());
        assertTrue(result.isHasMore());
    }

    @Test
    void testRun_NonRetryableFailure_MarksItemFailedAndContinues() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.FLAG_REEVALUATION, RESEARCH, ANALYSIS);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.FLAG_REEVALUATION, "A");
        WorkItem b = harness.enqueue(JobType.FLAG_REEVALUATION, "B");
        handler.on("A", RESEARCH, () -> {
            throw new NonRetryableStepException("Flag not found: A");
        });

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.FLAG_REEVALUATION);

        // Assert
        WorkItem failed = harness.getWorkItemSource().get(a.getId());
        assertEquals(ItemStatus.FAILED, failed.getStatus());
        assertEquals("Flag not found: A", failed.getLastError());
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(b.getId()));
        assertEquals(2, result.getProcessed());
        assertEquals(1, result.getCounted());
        assertFalse(result.isHasMore());
    }

    @Test
    void testRun_RetryableFailureEveryTime_FailsAfterMaxAttempts() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.AI_REPORT, RESEARCH);
        harness = new EngineHarness().start(handler);
        WorkItem a = harness.enqueue(JobType.AI_REPORT, "A");
        handler.on("A", RESEARCH, () -> {
            throw new IllegalStateException("rate limited");
        });

        // Act
        harness.getExecutor().run(JobType.AI_REPORT);
        harness.getExecutor().run(JobType.AI_REPORT);
        assertEquals(ItemStatus.PROCESSING, harness.getWorkItemSource().statusOf(a.getId()));
        BatchRunResult last = harness.getExecutor().run(JobType.AI_REPORT);

        // Assert
        WorkItem failed = harness.getWorkItemSource().get(a.getId());
        assertEquals(ItemStatus.FAILED, failed.getStatus());
        assertEquals(3, failed.getRetryCount());
        assertEquals(3, handler.callsFor("A"));
        assertFalse(last.isHasMore());
    }

    @Test
    void testRun_ProgressCompletedYesterday_IsResetNotTreatedAsDone() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.AI_REPORT, RESEARCH);
        harness = new EngineHarness().start(handler);
        Instant yesterday = EngineHarness.TUESDAY_MORNING.minus(Duration.ofDays(1));
        harness.getCheckpointStore().putProgress(BatchProgress.builder()
                .jobType(JobType.AI_REPORT)
                .scopeId(ProgressCheckpoint.GLOBAL_SCOPE)
                .processedCount(5)
                .totalCount(5)
                .lastProcessedScopeId("99")
                .createdAt(yesterday)
                .updatedAt(yesterday)
                .completedAt(yesterday)
                .build());
        WorkItem a = harness.enqueue(JobType.AI_REPORT, "A");

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.AI_REPORT);

        // Assert
        assertEquals(ItemStatus.COMPLETED, harness.getWorkItemSource().statusOf(a.getId()));
        assertEquals(1, result.getProcessed());

        BatchProgress progress = globalProgress(JobType.AI_REPORT);
        assertEquals(1, progress.getProcessedCount());
        assertEquals(1, progress.getTotalCount());
        assertEquals(EngineHarness.TUESDAY_MORNING.plusSeconds(1), progress.getCreatedAt());
    }

    @Test
    void testRun_NoOutstandingItems_ReturnsEmptyResult() {
        // Arrange
        ScriptedJobHandler handler = new ScriptedJobHandler(JobType.AI_REPORT, RESEARCH);
        harness = new EngineHarness().start(handler);

        // Act
        BatchRunResult result = harness.getExecutor().run(JobType.AI_REPORT);

        // Assert
        assertEquals(0, result.getProcessed());
        assertEquals("generated", result.getCounterName());
        assertFalse(result.isHasMore());
        assertTrue(handler.getCalls().isEmpty());
    }

    @Test
    void testRun_UnregisteredJob_ThrowsUnknownJob() {
        // Arrange
        harness = new EngineHarness().start(new ScriptedJobHandler(JobType.AI_REPORT, RESEARCH));

        // Act & Assert
        assertThrows(UnknownJobException.class, () -> harness.getExecutor().run(JobType.FLAG_REEVALUATION));
    }

    private BatchProgress globalProgress(JobType jobType) {
        return harness.getCheckpointStore().loadProgress(jobType, ProgressCheckpoint.GLOBAL_SCOPE).orElseThrow();
    }
}
