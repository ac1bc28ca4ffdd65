package com.eyelevel.tableingestor.model;

/**
 * Which extraction path produced the rows of a table.
 */
public enum TableOrigin {
    CSV,
    OCR
}
