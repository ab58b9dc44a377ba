package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.WorkItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Item returned by an enqueue call, and whether it already existed.
 */
@Getter
@AllArgsConstructor
public class EnqueueResult {

    private final WorkItem item;
    private final boolean existing;
}
