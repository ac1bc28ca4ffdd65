package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.UploadEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Hands accepted events to the bounded worker pool, one job per event.
 */
@Slf4j
@Service
public class IngestionDispatcher implements IngestionTrigger {

    private final JobLifecycleManager lifecycle;
    private final IngestionOrchestrator orchestrator;
    private final TaskExecutor workerExecutor;

    public IngestionDispatcher(JobLifecycleManager lifecycle, IngestionOrchestrator orchestrator,
                               @Qualifier("ingestionWorkerExecutor") TaskExecutor workerExecutor) {
        this.lifecycle = lifecycle;
        this.orchestrator = orchestrator;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public IngestionJob accept(UploadEvent event) {
        if (event == null || !StringUtils.hasText(event.bucket()) || !StringUtils.hasText(event.key())) {
            throw new IllegalArgumentException("Upload event must carry a bucket and a key");
        }
        IngestionJob job = lifecycle.createJob(event);
        try {
            workerExecutor.execute(() -> orchestrator.process(job.getId()));
        } catch (TaskRejectedException e) {
            log.error("[JobId: {}] Worker pool rejected the job.", job.getId(), e);
            lifecycle.fail(job.getId(), ErrorCode.INTERNAL_ERROR, "Worker pool rejected the job: " + e.getMessage());
        }
        return job;
    }
}
