package com.eyelevel.tableingestor.consumer;

import com.eyelevel.tableingestor.common.json.JsonParser;
import com.eyelevel.tableingestor.dto.event.UploadEventMessage;
import com.eyelevel.tableingestor.exception.MessageProcessingFailedException;
import com.eyelevel.tableingestor.exception.json.JsonParsingException;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.service.pipeline.IngestionTrigger;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * An SQS message consumer that turns upload notifications into ingestion jobs.
 * <p>
 * Messages that cannot describe an upload (unparseable bodies, S3 test events) are dropped.
 * If the pipeline cannot accept an event the message is failed so SQS redelivers it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.ingestion.sqs", name = "enabled", havingValue = "true")
public class UploadEventConsumer {

    private final JsonParser jsonParser;
    private final IngestionTrigger ingestionTrigger;

    @SqsListener(value = "${app.ingestion.sqs.queue-name}", factory = "uploadEventContainerFactory")
    public void onMessage(@Payload final String message) {
        final List<UploadEvent> events;
        try {
            events = toEvents(jsonParser.parseObject(message, UploadEventMessage.class));
        } catch (JsonParsingException e) {
            log.error("[FATAL] SQS message is not valid JSON. Message will be dropped. Payload: {}", message);
            return;
        }
        if (events.isEmpty()) {
            log.warn("SQS message carries no upload event. Message will be dropped. Payload: {}", message);
            return;
        }

        for (final UploadEvent event : events) {
            log.info("Received upload event for s3://{}/{}", event.bucket(), event.key());
            try {
                ingestionTrigger.accept(event);
            } catch (Exception e) {
                log.error("Could not accept upload event for s3://{}/{}. Triggering SQS retry.",
                        event.bucket(), event.key(), e);
                throw new MessageProcessingFailedException(
                        "Failed to accept upload event for s3://" + event.bucket() + "/" + event.key(), e);
            }
        }
    }

    static List<UploadEvent> toEvents(UploadEventMessage message) {
        List<UploadEvent> events = new ArrayList<>();
        if (message == null) {
            return events;
        }
        if (!CollectionUtils.isEmpty(message.records())) {
            for (UploadEventMessage.EventRecord entry : message.records()) {
                if (entry == null || entry.s3() == null || entry.s3().bucket() == null
                        || entry.s3().object() == null) {
                    continue;
                }
                String bucket = entry.s3().bucket().name();
                String key = entry.s3().object().key();
                if (StringUtils.hasText(bucket) && StringUtils.hasText(key)) {
                    // S3 notifications carry form-encoded keys
                    events.add(new UploadEvent(bucket, URLDecoder.decode(key, StandardCharsets.UTF_8)));
                }
            }
        } else if (StringUtils.hasText(message.bucket()) && StringUtils.hasText(message.key())) {
            events.add(new UploadEvent(message.bucket(), message.key()));
        }
        return events;
    }
}
