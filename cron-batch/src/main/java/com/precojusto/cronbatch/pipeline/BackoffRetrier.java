package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.exception.TransientStepException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries collaborator calls that fail with a {@link TransientStepException},
 * waiting 1s, 3s and 5s between attempts. Any other exception propagates at once.
 */
@Component
@Slf4j
public class BackoffRetrier {

    // Exponential backoff delays in milliseconds: 1s, 3s, 5s
    private static final long[] BACKOFF_DELAYS = { 1000, 3000, 5000 };

    /**
     * Pause between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Sleeper sleeper;

    public BackoffRetrier() {
        this(Thread::sleep);
    }

    public BackoffRetrier(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Call the supplier, retrying transient failures.
     *
     * @param operation name used in logs
     * @param call      the collaborator call
     * @return the call's result
     * @throws TransientStepException the last failure once every delay was used
     */
    public <T> T call(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (TransientStepException e) {
                if (attempt >= BACKOFF_DELAYS.length) {
                    log.error("{} failed after {} attempts: {}", operation, attempt + 1, e.getMessage());
                    throw e;
                }
                long delayMs = BACKOFF_DELAYS[attempt];
                attempt++;
                log.warn("{} failed ({}), applying exponential backoff: {}ms before retry {}",
                        operation, e.getMessage(), delayMs, attempt);
                pause(operation, delayMs, e);
            }
        }
    }

    /**
     * Variant for calls that return nothing.
     */
    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    private void pause(String operation, long delayMs, TransientStepException cause) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted during backoff", operation);
            throw new TransientStepException(operation + " interrupted during backoff", cause);
        }
    }
}
