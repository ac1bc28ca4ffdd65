package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.UploadEvent;

/**
 * The single entry point of the pipeline. Queue consumers, webhooks and pollers all hand their
 * {@code {bucket, key}} events to this interface.
 */
public interface IngestionTrigger {

    /**
     * Records a RECEIVED job for the event and schedules it on the worker pool.
     *
     * @return the created job, still in state RECEIVED unless the pool ran it in the caller.
     */
    IngestionJob accept(UploadEvent event);
}
