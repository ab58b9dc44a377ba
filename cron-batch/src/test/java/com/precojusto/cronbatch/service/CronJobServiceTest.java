package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import com.precojusto.cronbatch.exception.UnknownJobException;
import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.support.EngineHarness;
import com.precojusto.cronbatch.support.ScriptedSweepHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CronJobServiceTest {

    @Mock
    private TimeBoxedExecutor executor;

    @Mock
    private CheckpointStore checkpointStore;

    private CronJobService cronJobService;

    @BeforeEach
    void setUp() {
        cronJobService = new CronJobService(executor, checkpointStore);
    }

    @Test
    void testResolve_KnownEndpoints() {
        assertEquals(List.of(JobType.AI_REPORT), cronJobService.resolve("generate-ai-reports", null));
        assertEquals(List.of(JobType.FLAG_REEVALUATION), cronJobService.resolve("process-flag-reevaluations", ""));
        assertEquals(List.of(JobType.INDEX_MARK_TO_MARKET), cronJobService.resolve("update-indices", null));
        assertEquals(List.of(JobType.INDEX_SCREENING), cronJobService.resolve("update-indices", "Screening"));
        assertEquals(List.of(JobType.INDEX_MARK_TO_MARKET, JobType.INDEX_SCREENING),
                cronJobService.resolve("update-indices", "both"));
    }

    @Test
    void testResolve_UnknownEndpointOrVariant_Throws() {
        assertThrows(UnknownJobException.class, () -> cronJobService.resolve("send-newsletter", null));
        assertThrows(UnknownJobException.class, () -> cronJobService.resolve("update-indices", "weekly"));
        assertThrows(UnknownJobException.class, () -> cronJobService.resolve("generate-ai-reports", "both"));
    }

    @Test
    void testTrigger_Both_RunsInOrderAndMergesResults() {
        // Arrange
        when(executor.run(eq(JobType.INDEX_MARK_TO_MARKET), any())).thenReturn(BatchRunResult.builder()
                .jobType(JobType.INDEX_MARK_TO_MARKET)
                .counterName("updated")
                .processed(3)
                .counted(3)
                .errors(List.of("7: provider down"))
                .durationMs(1200)
                .hasMore(false)
                .build());
        when(executor.run(eq(JobType.INDEX_SCREENING), any())).thenReturn(BatchRunResult.builder()
                .jobType(JobType.INDEX_SCREENING)
                .counterName("rebalanced")
                .processed(2)
                .counted(1)
                .durationMs(800)
                .hasMore(true)
                .message("Time budget exhausted, 4 item(s) outstanding")
                .build());

        // Act
        CronRunSummary summary = cronJobService.trigger("update-indices", "both");

        // Assert
        InOrder inOrder = inOrder(executor);
        inOrder.verify(executor).run(eq(JobType.INDEX_MARK_TO_MARKET), any());
        inOrder.verify(executor).run(eq(JobType.INDEX_SCREENING), any());

        assertEquals("update-indices", summary.getJob());
        assertEquals(5, summary.getProcessed());
        assertEquals(Map.of("updated", 3, "rebalanced", 1), summary.getCounters());
        assertEquals(List.of("7: provider down"), summary.getErrors());
        assertEquals(2000, summary.getDurationMs());
        assertTrue(summary.isHasMore());
        assertEquals("screening: Time budget exhausted, 4 item(s) outstanding", summary.getMessage());
    }

    @Test
    void testTrigger_Both_SecondJobOnlyGetsWhatIsLeftOfTheBudget() {
        // Arrange
        ScriptedSweepHandler markToMarket = new ScriptedSweepHandler(JobType.INDEX_MARK_TO_MARKET,
                List.of("IBOV"), "MARK_TO_MARKET");
        ScriptedSweepHandler screening = new ScriptedSweepHandler(JobType.INDEX_SCREENING,
                List.of("IBOV"), "SCREENING");
        EngineHarness harness = new EngineHarness().start(markToMarket, screening);
        markToMarket.on("IBOV@2024-03-05", "MARK_TO_MARKET", () -> harness.getClock().advance(Duration.ofSeconds(45)));
        markToMarket.on("IBOV@2024-03-05", "FINALIZE", () -> harness.getClock().advance(Duration.ofSeconds(10)));
        CronJobService service = new CronJobService(harness.getExecutor(), harness.getCheckpointStore());

        try {
            // Act
            CronRunSummary summary = service.trigger("update-indices", "both");

            // Assert
            assertEquals(List.of("IBOV@2024-03-05:MARK_TO_MARKET", "IBOV@2024-03-05:FINALIZE"),
                    markToMarket.getCalls());
            assertTrue(screening.getCalls().isEmpty());
            assertTrue(screening.getEnrolledDates().isEmpty());

            List<WorkItem> items = harness.getWorkItemSource().all();
            assertEquals(1, items.size());
            assertEquals(ItemStatus.COMPLETED, items.get(0).getStatus());

            assertEquals(Map.of("generated", 1), summary.getCounters());
            assertEquals(55000, summary.getDurationMs());
            assertTrue(summary.isHasMore());
            assertEquals("screening: Time budget exhausted before start", summary.getMessage());
        } finally {
            harness.stop();
        }
    }

    @Test
    void testTrigger_SingleJob_KeepsMessageAsIs() {
        // Arrange
        when(executor.run(eq(JobType.AI_REPORT), any())).thenReturn(BatchRunResult.builder()
                .jobType(JobType.AI_REPORT)
                .counterName("reportsGenerated")
                .message("Another invocation of ai-report is running")
                .build());

        // Act
        CronRunSummary summary = cronJobService.trigger("generate-ai-reports", null);

        // Assert
        assertEquals(Map.of("reportsGenerated", 0), summary.getCounters());
        assertEquals("Another invocation of ai-report is running", summary.getMessage());
        assertFalse(summary.isHasMore());
    }

    @Test
    void testStatus_NoStoredProgress_ReturnsEmptyProgress() {
        // Arrange
        when(checkpointStore.loadProgress(JobType.FLAG_REEVALUATION, ProgressCheckpoint.GLOBAL_SCOPE))
                .thenReturn(Optional.empty());

        // Act
        List<BatchProgress> status = cronJobService.status("process-flag-reevaluations", null);

        // Assert
        assertEquals(1, status.size());
        assertEquals(JobType.FLAG_REEVALUATION, status.get(0).getJobType());
        assertEquals(0, status.get(0).getProcessedCount());
        verifyNoInteractions(executor);
    }
}
