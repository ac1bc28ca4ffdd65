package com.eyelevel.tableingestor.model;

/**
 * Classification assigned to an uploaded file. Assigned exactly once per job.
 */
public enum Kind {
    /**
     * Delimited text, handled by the CSV structurer.
     */
    CSV,
    /**
     * A single raster image, handled by one OCR pass.
     */
    IMAGE,
    /**
     * A PDF document, rendered and OCR'd page by page.
     */
    PDF,
    /**
     * Anything else. The job fails without touching any table.
     */
    UNSUPPORTED
}
