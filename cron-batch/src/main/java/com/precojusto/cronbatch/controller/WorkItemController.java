package com.precojusto.cronbatch.controller;

import com.precojusto.cronbatch.controller.dto.EnqueueRequest;
import com.precojusto.cronbatch.controller.dto.EnqueueResponse;
import com.precojusto.cronbatch.controller.dto.WorkItemResponse;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.UnknownJobException;
import com.precojusto.cronbatch.pipeline.CheckpointCodec;
import com.precojusto.cronbatch.service.EnqueueResult;
import com.precojusto.cronbatch.service.WorkItemService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for upstream enqueue and operator recovery of work items.
 */
@RestController
@RequestMapping("/api/work-items")
@RequiredArgsConstructor
@Slf4j
public class WorkItemController {

    private final WorkItemService workItemService;
    private final CheckpointCodec codec;

    /**
     * Enqueue work for a target. Returns the active item for the same target if one exists.
     *
     * @param request the enqueue request
     * @return the item id and status
     */
    @PostMapping
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody EnqueueRequest request) {

        log.info("POST /api/work-items - Job: {}, Target: {}", request.getJobType(), request.getTargetKey());

        JobType jobType = JobType.fromKey(request.getJobType())
                .orElseThrow(() -> new UnknownJobException("Unknown job type: " + request.getJobType()));

        EnqueueResult result = workItemService.enqueue(jobType, request.getTargetKey(), request.getPriority(),
                codec.encode(request.getPayload(), "payload"));
        WorkItem item = result.getItem();

        EnqueueResponse response = EnqueueResponse.builder()
                .itemId(item.getId())
                .status(item.getStatus())
                .isExisting(result.isExisting())
                .message(result.isExisting()
                        ? "Work already queued for " + item.getTargetKey()
                        : "Work item queued")
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<WorkItemResponse> get(@PathVariable Long itemId) {
        return ResponseEntity.ok(WorkItemResponse.from(workItemService.get(itemId)));
    }

    /**
     * Put a FAILED item back to PENDING with its checkpoints cleared.
     */
    @PostMapping("/{itemId}/reset")
    public ResponseEntity<WorkItemResponse> reset(@PathVariable Long itemId) {

        log.info("POST /api/work-items/{}/reset", itemId);

        return ResponseEntity.ok(WorkItemResponse.from(workItemService.reset(itemId)));
    }
}
