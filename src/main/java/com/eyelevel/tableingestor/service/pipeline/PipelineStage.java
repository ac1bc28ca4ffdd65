package com.eyelevel.tableingestor.service.pipeline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PipelineStage {
    FETCH("Fetching object"),
    CLASSIFY("Classifying file"),
    STRUCTURE("Parsing delimited text"),
    EXTRACT("Extracting text with OCR"),
    SCHEMA("Schema synthesized"),
    LOAD("Loading rows"),
    DONE("Finished");

    private final String description;
}
