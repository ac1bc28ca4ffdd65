package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.StageTimeoutException;
import com.eyelevel.tableingestor.exception.TransientStoreException;
import com.eyelevel.tableingestor.model.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one pipeline stage under a time budget. On expiry the stage is cancelled (its thread is
 * interrupted) and its result discarded.
 * <p>
 * Stages never run on the calling thread. When the stage pool is exhausted, typically by earlier
 * stages that timed out but ignore interrupts, the stage is refused with a
 * {@link TransientStoreException} so the caller's retry policy can back off and try again.
 */
@Slf4j
@Component
public class StageRunner {

    private final AsyncTaskExecutor stageExecutor;

    public StageRunner(@Qualifier("stageExecutor") AsyncTaskExecutor stageExecutor) {
        this.stageExecutor = stageExecutor;
    }

    public <T> T run(PipelineStage stage, Duration budget, String contextInfo, Callable<T> work) {
        Future<T> future;
        try {
            future = stageExecutor.submit(work);
        } catch (TaskRejectedException e) {
            log.warn("[{}] Stage {} rejected: no stage thread available.", contextInfo, stage);
            throw new TransientStoreException("No stage thread available to run " + stage, e);
        }
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Stage {} exceeded its budget of {} ms and was cancelled.", contextInfo, stage,
                    budget.toMillis());
            throw new StageTimeoutException(stage.name(), budget, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IngestionException(ErrorCode.INTERNAL_ERROR, "Interrupted while running stage " + stage, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IngestionException(ErrorCode.INTERNAL_ERROR,
                    "Stage " + stage + " failed: " + cause.getMessage(), cause);
        }
    }
}
