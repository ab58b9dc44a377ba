package com.precojusto.cronbatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Output of one completed pipeline step for one scope. Its presence is the only
 * signal that the step is done.
 */
@Entity
@Table(name = "step_checkpoints", uniqueConstraints = {
        @UniqueConstraint(name = "uk_step_checkpoint", columnNames = { "job_type", "scope_id", "step" })
}, indexes = {
        @Index(name = "idx_step_checkpoint_scope", columnList = "job_type, scope_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StepCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 40)
    private JobType jobType;

    @Column(name = "scope_id", nullable = false, length = 100)
    private String scopeId;

    @Column(name = "step", nullable = false, length = 60)
    private String step;

    @Column(name = "data_json", columnDefinition = "TEXT")
    private String dataJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
