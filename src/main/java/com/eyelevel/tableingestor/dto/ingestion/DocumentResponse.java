package com.eyelevel.tableingestor.dto.ingestion;

import com.eyelevel.tableingestor.model.ExtractedPage;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "The stored OCR document of a job, one entry per page slot.")
public record DocumentResponse(Long jobId, String sourceFile, List<ExtractedPage> pages) {
}
