package com.precojusto.cronbatch.infrastructure;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Fixed number of concurrent slots pulling from a shared work list.
 * Each slot records its own success or failure; one item failing never
 * cancels its siblings.
 */
@Component
@Slf4j
public class BoundedWorkerPool {

    private final ExecutorService batchWorkerExecutorService;

    public BoundedWorkerPool(@Qualifier("batchWorkerExecutorService") ExecutorService batchWorkerExecutorService) {
        this.batchWorkerExecutorService = batchWorkerExecutorService;
    }

    /**
     * Process items with at most {@code slots} in flight at once.
     *
     * @param items     work list, consumed in order
     * @param slots     number of concurrent slots
     * @param keepGoing checked by a slot before it takes the next item
     * @param work      per-item work
     * @return one outcome per item that was taken, in work-list order
     */
    public <T, R> List<Outcome<T, R>> runAll(List<T> items, int slots, BooleanSupplier keepGoing,
            Function<T, R> work) {
        Queue<Indexed<T>> queue = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < items.size(); i++) {
            queue.add(new Indexed<>(i, items.get(i)));
        }

        List<Outcome<T, R>> outcomes = Collections.synchronizedList(new ArrayList<>());
        int slotCount = Math.max(1, Math.min(slots, items.size()));
        List<Future<?>> futures = new ArrayList<>(slotCount);

        for (int slot = 0; slot < slotCount; slot++) {
            String workerName = "slot-" + (slot + 1);
            futures.add(batchWorkerExecutorService.submit(() -> drain(workerName, queue, keepGoing, work, outcomes)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for worker slots");
                break;
            } catch (ExecutionException e) {
                log.error("Worker slot terminated unexpectedly: {}", e.getCause().getMessage(), e.getCause());
            }
        }

        List<Outcome<T, R>> ordered = new ArrayList<>(outcomes);
        ordered.sort(Comparator.comparingInt(Outcome::getPosition));
        return ordered;
    }

    private <T, R> void drain(String workerName, Queue<Indexed<T>> queue, BooleanSupplier keepGoing,
            Function<T, R> work, List<Outcome<T, R>> outcomes) {
        MDC.put("worker", workerName);
        try {
            while (keepGoing.getAsBoolean()) {
                Indexed<T> next = queue.poll();
                if (next == null) {
                    return;
                }
                try {
                    outcomes.add(Outcome.success(next.position, next.value, work.apply(next.value)));
                } catch (RuntimeException e) {
                    log.error("{} failed on item {}: {}", workerName, next.value, e.getMessage(), e);
                    outcomes.add(Outcome.failure(next.position, next.value, e));
                }
            }
            log.info("{} stopping: time budget exhausted", workerName);
        } finally {
            MDC.remove("worker");
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping batch worker pool...");
        batchWorkerExecutorService.shutdown();

        try {
            if (!batchWorkerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker slots did not terminate gracefully, forcing shutdown");
                batchWorkerExecutorService.shutdownNow();
            } else {
                log.info("Batch worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for worker slots to stop", e);
            batchWorkerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class Indexed<T> {
        private final int position;
        private final T value;

        private Indexed(int position, T value) {
            this.position = position;
            this.value = value;
        }
    }

    /**
     * Result of one item: either a value or the exception the work raised.
     */
    public static final class Outcome<T, R> {
        private final int position;
        private final T item;
        private final R result;
        private final RuntimeException error;

        private Outcome(int position, T item, R result, RuntimeException error) {
            this.position = position;
            this.item = item;
            this.result = result;
            this.error = error;
        }

        static <T, R> Outcome<T, R> success(int position, T item, R result) {
            return new Outcome<>(position, item, result, null);
        }

        static <T, R> Outcome<T, R> failure(int position, T item, RuntimeException error) {
            return new Outcome<>(position, item, null, error);
        }

        public int getPosition() {
            return position;
        }

        public T getItem() {
            return item;
        }

        public R getResult() {
            return result;
        }

        public RuntimeException getError() {
            return error;
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
