package com.precojusto.cronbatch.controller.dto;

import com.precojusto.cronbatch.domain.ItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an enqueue call. An existing active item for the same
 * target is returned with isExisting set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnqueueResponse {

    private Long itemId;
    private ItemStatus status;
    private Boolean isExisting;
    private String message;
}
