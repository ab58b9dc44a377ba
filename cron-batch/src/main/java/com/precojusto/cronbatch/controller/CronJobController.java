package com.precojusto.cronbatch.controller;

import com.precojusto.cronbatch.controller.dto.BatchRunResponse;
import com.precojusto.cronbatch.controller.dto.JobProgressResponse;
import com.precojusto.cronbatch.service.CronJobService;
import com.precojusto.cronbatch.service.CronRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Trigger endpoints called by the external scheduler.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
@Slf4j
public class CronJobController {

    static final String CRON_SECRET_HEADER = "X-Cron-Secret";

    private final CronJobService cronJobService;
    private final CronAuthVerifier authVerifier;
    private final Clock clock;

    /**
     * Run one time-boxed pass of the job behind an endpoint.
     *
     * @param job     endpoint name, e.g. {@code generate-ai-reports}
     * @param variant for {@code update-indices}: mark-to-market, screening or both
     * @return counters of the pass and whether work remains
     */
    @RequestMapping(value = "/{job}", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<BatchRunResponse> trigger(
            @PathVariable String job,
            @RequestParam(name = "job", required = false) String variant,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(name = CRON_SECRET_HEADER, required = false) String cronSecret) {

        authVerifier.verify(authorization, cronSecret);
        log.info("Cron /api/cron/{} triggered (variant {})", job, variant);

        CronRunSummary summary = cronJobService.trigger(job, variant);

        return ResponseEntity.ok(BatchRunResponse.from(summary, clock.instant()));
    }

    @GetMapping("/{job}/status")
    public ResponseEntity<List<JobProgressResponse>> status(
            @PathVariable String job,
            @RequestParam(name = "job", required = false) String variant,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(name = CRON_SECRET_HEADER, required = false) String cronSecret) {

        authVerifier.verify(authorization, cronSecret);

        List<JobProgressResponse> progress = cronJobService.status(job, variant).stream()
                .map(JobProgressResponse::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(progress);
    }
}
