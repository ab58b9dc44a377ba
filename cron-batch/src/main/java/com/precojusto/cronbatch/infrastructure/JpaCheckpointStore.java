package com.precojusto.cronbatch.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import com.precojusto.cronbatch.domain.StepCheckpoint;
import com.precojusto.cronbatch.repository.ProgressCheckpointRepository;
import com.precojusto.cronbatch.repository.StepCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JPA implementation of the CheckpointStore.
 * Step checkpoints and progress cursors live in separate tables, both upserted
 * through their unique keys.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCheckpointStore implements CheckpointStore {

    private static final TypeReference<List<String>> ERROR_LIST = new TypeReference<>() {
    };

    private final StepCheckpointRepository stepCheckpointRepository;
    private final ProgressCheckpointRepository progressCheckpointRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public void save(JobType jobType, String scopeId, String step, String dataJson) {
        StepCheckpoint checkpoint = stepCheckpointRepository
                .findByJobTypeAndScopeIdAndStep(jobType, scopeId, step)
                .orElseGet(() -> StepCheckpoint.builder()
                        .jobType(jobType)
                        .scopeId(scopeId)
                        .step(step)
                        .createdAt(clock.instant())
                        .build());

        checkpoint.setDataJson(dataJson);
        stepCheckpointRepository.save(checkpoint);

        log.debug("Saved checkpoint {}/{}/{}", jobType, scopeId, step);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StepCheckpoint> load(JobType jobType, String scopeId, String step) {
        return stepCheckpointRepository.findByJobTypeAndScopeIdAndStep(jobType, scopeId, step);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> completedSteps(JobType jobType, String scopeId) {
        return stepCheckpointRepository.findByJobTypeAndScopeId(jobType, scopeId).stream()
                .map(StepCheckpoint::getStep)
                .collect(Collectors.toSet());
    }

    @Override
    @Transactional
    public void clear(JobType jobType, String scopeId) {
        int steps = stepCheckpointRepository.deleteByScope(jobType, scopeId);
        int cursors = progressCheckpointRepository.deleteByScope(jobType, scopeId);
        log.debug("Cleared {} step checkpoint(s) and {} sub-task cursor(s) for {}/{}",
                steps, cursors, jobType, scopeId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BatchProgress> loadProgress(JobType jobType, String scopeId) {
        return progressCheckpointRepository.findByJobTypeAndScopeId(jobType, scopeId)
                .map(this::toProgress);
    }

    @Override
    @Transactional
    public BatchProgress saveProgress(BatchProgress progress) {
        Instant now = clock.instant();

        ProgressCheckpoint row = progressCheckpointRepository
                .findByJobTypeAndScopeId(progress.getJobType(), progress.getScopeId())
                .orElseGet(() -> ProgressCheckpoint.builder()
                        .jobType(progress.getJobType())
                        .scopeId(progress.getScopeId())
                        .createdAt(now)
                        .build());

        row.setLastProcessedScopeId(progress.getLastProcessedScopeId());
        row.setProcessedCount(progress.getProcessedCount());
        row.setTotalCount(progress.getTotalCount());
        row.setErrorsJson(writeErrors(progress.getErrors()));
        row.setUpdatedAt(now);
        row.setCompletedAt(row.isComplete() ? now : null);

        return toProgress(progressCheckpointRepository.save(row));
    }

    @Override
    @Transactional
    public void clearProgress(JobType jobType, String scopeId) {
        progressCheckpointRepository.deleteByScope(jobType, scopeId);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> scopesWithProgress(JobType jobType) {
        return progressCheckpointRepository
                .findByJobTypeAndScopeIdNot(jobType, ProgressCheckpoint.GLOBAL_SCOPE).stream()
                .map(ProgressCheckpoint::getScopeId)
                .collect(Collectors.toSet());
    }

    @Override
    @Transactional
    public int migrateLegacyGlobalScope(JobType jobType) {
        List<ProgressCheckpoint> legacy = progressCheckpointRepository
                .findByJobTypeAndScopeIdIsNullOrderByUpdatedAtDesc(jobType);

        if (legacy.isEmpty()) {
            return 0;
        }

        log.info("Found {} legacy progress row(s) with NULL scope for {}, compacting", legacy.size(), jobType);

        if (progressCheckpointRepository.findByJobTypeAndScopeId(jobType, ProgressCheckpoint.GLOBAL_SCOPE).isEmpty()) {
            ProgressCheckpoint mostRecent = legacy.get(0);
            ProgressCheckpoint migrated = ProgressCheckpoint.builder()
                    .jobType(jobType)
                    .scopeId(ProgressCheckpoint.GLOBAL_SCOPE)
                    .lastProcessedScopeId(mostRecent.getLastProcessedScopeId())
                    .processedCount(mostRecent.getProcessedCount())
                    .totalCount(mostRecent.getTotalCount())
                    .errorsJson(mostRecent.getErrorsJson())
                    .createdAt(mostRecent.getCreatedAt())
                    .updatedAt(mostRecent.getUpdatedAt())
                    .completedAt(mostRecent.getCompletedAt())
                    .build();
            progressCheckpointRepository.save(migrated);
            log.info("Migrated most recent legacy progress row to {} scope for {}",
                    ProgressCheckpoint.GLOBAL_SCOPE, jobType);
        }

        int removed = progressCheckpointRepository.deleteLegacyScope(jobType);
        log.info("Removed {} legacy progress row(s) for {}", removed, jobType);
        return removed;
    }

    private BatchProgress toProgress(ProgressCheckpoint row) {
        return BatchProgress.builder()
                .jobType(row.getJobType())
                .scopeId(row.getScopeId())
                .lastProcessedScopeId(row.getLastProcessedScopeId())
                .processedCount(row.getProcessedCount())
                .totalCount(row.getTotalCount())
                .errors(readErrors(row.getErrorsJson()))
                .createdAt(row.getCreatedAt())
                .updatedAt(row.getUpdatedAt())
                .completedAt(row.getCompletedAt())
                .build();
    }

    private String writeErrors(List<String> errors) {
        try {
            return objectMapper.writeValueAsString(errors != null ? errors : List.of());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize progress errors", e);
            throw new IllegalStateException("Failed to serialize progress errors", e);
        }
    }

    private List<String> readErrors(String errorsJson) {
        if (errorsJson == null || errorsJson.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(errorsJson, ERROR_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable progress errors, starting with an empty list: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
