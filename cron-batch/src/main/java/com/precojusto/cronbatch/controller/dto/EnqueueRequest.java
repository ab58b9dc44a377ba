package com.precojusto.cronbatch.controller.dto;

import com.precojusto.cronbatch.domain.PriorityClass;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for enqueuing work from an upstream trigger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnqueueRequest {

    @NotBlank(message = "Job type is required")
    private String jobType;

    @NotBlank(message = "Target key is required")
    @Size(max = 255, message = "Target key must be at most 255 characters")
    private String targetKey;

    private PriorityClass priority;

    @NotNull(message = "Payload is required")
    private Map<String, Object> payload;
}
