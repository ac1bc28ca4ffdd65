package com.eyelevel.tableingestor.model;

/**
 * A newly uploaded object, as announced by whatever fires the pipeline.
 */
public record UploadEvent(String bucket, String key) {
}
