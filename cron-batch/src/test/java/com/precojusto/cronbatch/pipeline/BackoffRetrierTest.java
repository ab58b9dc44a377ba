package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.exception.NonRetryableStepException;
import com.precojusto.cronbatch.exception.TransientStepException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackoffRetrierTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final BackoffRetrier retrier = new BackoffRetrier(sleeps::add);

    @Test
    void testCall_TransientThenSuccess_BacksOffOnce() {
        // Arrange
        AtomicInteger attempts = new AtomicInteger();

        // Act
        String result = retrier.call("research PETR4", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientStepException("429 Too Many Requests");
            }
            return "ok";
        });

        // Assert
        assertEquals("ok", result);
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void testCall_AlwaysTransient_GivesUpAfterThreeRetries() {
        // Arrange
        AtomicInteger attempts = new AtomicInteger();

        // Act & Assert
        TransientStepException error = assertThrows(TransientStepException.class,
                () -> retrier.call("research PETR4", () -> {
                    attempts.incrementAndGet();
                    throw new TransientStepException("503 overloaded");
                }));
        assertEquals("503 overloaded", error.getMessage());
        assertEquals(4, attempts.get());
        assertEquals(List.of(1000L, 3000L, 5000L), sleeps);
    }

    @Test
    void testCall_OtherException_PropagatesWithoutRetry() {
        // Arrange
        AtomicInteger attempts = new AtomicInteger();

        // Act & Assert
        assertThrows(NonRetryableStepException.class, () -> retrier.run("apply evaluation", () -> {
            attempts.incrementAndGet();
            throw new NonRetryableStepException("Flag deleted");
        }));
        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testCall_InterruptedDuringBackoff_SurfacesAsTransient() {
        // Arrange
        BackoffRetrier interrupting = new BackoffRetrier(millis -> {
            throw new InterruptedException();
        });

        // Act & Assert
        TransientStepException error = assertThrows(TransientStepException.class,
                () -> interrupting.call("compile report", () -> {
                    throw new TransientStepException("empty response");
                }));
        assertTrue(error.getMessage().contains("interrupted"));
        assertTrue(Thread.interrupted());
    }
}
