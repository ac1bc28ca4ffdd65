package com.eyelevel.tableingestor.service.query;

import com.eyelevel.tableingestor.dto.ingestion.DocumentResponse;
import com.eyelevel.tableingestor.dto.ingestion.JobStatusResponse;
import com.eyelevel.tableingestor.exception.ResourceNotFoundException;
import com.eyelevel.tableingestor.model.ExtractedPage;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.repository.DocumentPageRecordRepository;
import com.eyelevel.tableingestor.repository.IngestionJobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JobQueryService {

    private final IngestionJobRepository jobRepository;
    private final DocumentPageRecordRepository pageRecordRepository;

    public JobStatusResponse getJob(Long jobId) {
        return JobStatusResponse.from(findJob(jobId));
    }

    public List<JobStatusResponse> findJobs(String bucket, String key) {
        return jobRepository.findAllByBucketAndFileKeyOrderByIdDesc(bucket, key).stream()
                .map(JobStatusResponse::from)
                .toList();
    }

    /**
     * Returns the OCR document stored for a job. Jobs that never reached extraction have none.
     */
    public DocumentResponse getDocument(Long jobId) {
        IngestionJob job = findJob(jobId);
        List<ExtractedPage> pages = pageRecordRepository.findAllByJobIdOrderByPageNumberAsc(jobId).stream()
                .map(page -> new ExtractedPage(page.getPageNumber(), page.getText(), page.isOk()))
                .toList();
        if (pages.isEmpty()) {
            throw new ResourceNotFoundException("No extracted document stored for job " + jobId);
        }
        return new DocumentResponse(job.getId(), job.getFileKey(), pages);
    }

    private IngestionJob findJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Ingestion job not found with ID " + jobId));
    }
}
