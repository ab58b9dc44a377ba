package com.precojusto.cronbatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress cursor for a job type. With the {@link #GLOBAL_SCOPE} scope it is the
 * batch-wide progress of the job; with an item scope it is the sub-task cursor of
 * a step that decomposes into many sub-units.
 *
 * <p>Rows written before the sentinel scope existed have a NULL scope and are
 * compacted by the checkpoint store migration.
 */
@Entity
@Table(name = "progress_checkpoints", uniqueConstraints = {
        @UniqueConstraint(name = "uk_progress_checkpoint", columnNames = { "job_type", "scope_id" })
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ProgressCheckpoint {

    public static final String GLOBAL_SCOPE = "__GLOBAL__";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 40)
    private JobType jobType;

    @Column(name = "scope_id", length = 100)
    private String scopeId;

    @Column(name = "last_processed_scope_id", length = 255)
    private String lastProcessedScopeId;

    @Column(name = "processed_count", nullable = false)
    @Builder.Default
    private Integer processedCount = 0;

    @Column(name = "total_count", nullable = false)
    @Builder.Default
    private Integer totalCount = 0;

    @Column(name = "errors_json", columnDefinition = "TEXT")
    private String errorsJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isGlobal() {
        return GLOBAL_SCOPE.equals(scopeId);
    }

    public boolean isComplete() {
        return totalCount != null && totalCount > 0 && totalCount.equals(processedCount);
    }
}
