package com.eyelevel.tableingestor.service.ocr;

import com.eyelevel.tableingestor.model.ExtractedDocument;
import com.eyelevel.tableingestor.model.JobIssue;

import java.util.List;

public record OcrResult(ExtractedDocument document, List<JobIssue> warnings) {
}
