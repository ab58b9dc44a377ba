package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.pipeline.CheckpointCodec;
import com.precojusto.cronbatch.pipeline.FinalizeContext;
import com.precojusto.cronbatch.pipeline.FinalizeResult;
import com.precojusto.cronbatch.pipeline.JobHandler;
import com.precojusto.cronbatch.pipeline.StepOutputs;
import com.precojusto.cronbatch.pipeline.StepRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Performs the terminal side effects of an item whose steps are all checkpointed,
 * then marks it COMPLETED and clears its checkpoints.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Finalizer {

    private final WorkItemService workItemService;
    private final StepRunner stepRunner;
    private final CheckpointCodec codec;

    /**
     * @return the finalize result, or empty if the item was already COMPLETED
     */
    public Optional<FinalizeResult> finalizeItem(JobHandler handler, WorkItem item) {
        WorkItem current = workItemService.get(item.getId());
        if (current.getStatus() == ItemStatus.COMPLETED) {
            log.warn("Item {} is already COMPLETED. Skipping finalization.", item.getId());
            return Optional.empty();
        }

        StepOutputs outputs = stepRunner.loadAll(handler.getPipeline(), current);
        FinalizeResult result = handler.finalizeItem(new FinalizeContext(current, outputs, codec));

        workItemService.complete(current.getId(), result.getResultId());
        log.info("Item {} finalized (result {})", current.getId(), result.getResultId());
        return Optional.of(result);
    }
}
