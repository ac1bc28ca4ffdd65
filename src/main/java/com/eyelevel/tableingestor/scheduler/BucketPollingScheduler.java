package com.eyelevel.tableingestor.scheduler;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.repository.IngestionJobRepository;
import com.eyelevel.tableingestor.service.pipeline.IngestionTrigger;
import com.eyelevel.tableingestor.service.storage.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Periodically lists a bucket and triggers ingestion for every key that has never had a job.
 * An alternative to queue notifications for stores that cannot emit them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.ingestion.polling", name = "enabled", havingValue = "true")
public class BucketPollingScheduler {

    private final IngestionConfig config;
    private final ObjectStore objectStore;
    private final IngestionJobRepository jobRepository;
    private final IngestionTrigger ingestionTrigger;

    @Scheduled(fixedDelayString = "${app.ingestion.polling.interval-ms:60000}")
    public void pollBucket() {
        final String bucket = config.getPolling().getBucket();
        if (!StringUtils.hasText(bucket)) {
            log.warn("Bucket polling is enabled but no bucket is configured. Skipping run.");
            return;
        }
        final String prefix = config.getPolling().getPrefix();

        final List<String> keys;
        try {
            keys = objectStore.list(bucket, prefix);
        } catch (Exception e) {
            log.error("Failed to list s3://{}/{}. Will retry on the next run.", bucket, prefix, e);
            return;
        }

        int triggered = 0;
        for (final String key : keys) {
            if (jobRepository.existsByBucketAndFileKey(bucket, key)) {
                continue;
            }
            try {
                ingestionTrigger.accept(new UploadEvent(bucket, key));
                triggered++;
            } catch (Exception e) {
                log.error("Failed to trigger ingestion for s3://{}/{}", bucket, key, e);
            }
        }
        if (triggered > 0) {
            log.info("Bucket poll of s3://{}/{} triggered {} new job(s) out of {} key(s).", bucket, prefix, triggered,
                    keys.size());
        } else {
            log.debug("Bucket poll of s3://{}/{} found no new keys.", bucket, prefix);
        }
    }
}
