package com.precojusto.cronbatch.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Payload of an item enrolled by a daily sweep: the swept target and the
 * business date it is processed for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SweepPayload {

    private String target;
    private LocalDate businessDate;

    /**
     * Work item target key: one item per target and business date.
     */
    public static String targetKey(String target, LocalDate businessDate) {
        return target + "@" + businessDate;
    }
}
