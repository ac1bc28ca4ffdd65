package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.exception.StageTimeoutException;
import com.eyelevel.tableingestor.exception.TransientStoreException;
import com.eyelevel.tableingestor.exception.UnsupportedFileTypeException;
import com.eyelevel.tableingestor.model.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageRunnerTest {

    private static final String CONTEXT = "JobId: 7";

    private final AtomicBoolean released = new AtomicBoolean(false);
    private ThreadPoolTaskExecutor executor;
    private StageRunner runner;

    @BeforeEach
    void setUp() {
        // same shape as the production stage pool, with a single thread
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        runner = new StageRunner(executor);
    }

    @AfterEach
    void tearDown() {
        released.set(true);
        executor.shutdown();
    }

    @Test
    @DisplayName("Should return the stage result when it finishes within budget")
    void run_withinBudget() {
        String result = runner.run(PipelineStage.STRUCTURE, Duration.ofSeconds(5), CONTEXT, () -> "parsed");

        assertEquals("parsed", result);
    }

    @Test
    @DisplayName("Should rethrow a stage's own ingestion error unchanged")
    void run_propagatesStageFailure() {
        assertThrows(UnsupportedFileTypeException.class, () -> runner.run(PipelineStage.STRUCTURE,
                Duration.ofSeconds(5), CONTEXT, () -> {
                    throw new UnsupportedFileTypeException("not a csv");
                }));
    }

    @Test
    @DisplayName("Should fail with TIMEOUT_EXCEEDED when a stage overruns its budget")
    void run_timesOut() {
        StageTimeoutException ex = assertThrows(StageTimeoutException.class, () -> runner.run(PipelineStage.FETCH,
                Duration.ofMillis(100), CONTEXT, this::spinUntilReleased));

        assertEquals(ErrorCode.TIMEOUT_EXCEEDED, ex.getErrorCode());
    }

    @Test
    @DisplayName("Should refuse a stage instead of running it unbounded on the caller when the pool is held by a hung stage")
    void run_neverRunsOnCallerThread() {
        assertThrows(StageTimeoutException.class, () -> runner.run(PipelineStage.FETCH, Duration.ofMillis(100),
                CONTEXT, this::spinUntilReleased));

        String caller = Thread.currentThread().getName();
        AtomicBoolean ranOnCaller = new AtomicBoolean(false);
        long start = System.nanoTime();
        TransientStoreException ex = assertThrows(TransientStoreException.class, () -> runner.run(PipelineStage.FETCH,
                Duration.ofMillis(100), CONTEXT, () -> {
                    ranOnCaller.set(caller.equals(Thread.currentThread().getName()));
                    return spinUntilReleased();
                }));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(ErrorCode.TRANSIENT_STORE_ERROR, ex.getErrorCode());
        assertFalse(ranOnCaller.get());
        assertTrue(elapsedMs < 1000, "Refusal took " + elapsedMs + " ms");
    }

    // Ignores interrupts, like a blocking socket read.
    private String spinUntilReleased() {
        while (!released.get()) {
            Thread.onSpinWait();
        }
        return "released";
    }
}
