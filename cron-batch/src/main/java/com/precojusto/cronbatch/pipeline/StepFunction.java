package com.precojusto.cronbatch.pipeline;

/**
 * Work performed by one pipeline step. Implementations return data only and leave
 * side effects such as notifications to the finalize capability of the handler.
 *
 * @param <O> type of the step output stored as its checkpoint
 */
@FunctionalInterface
public interface StepFunction<O> {

    O execute(StepContext context);
}
