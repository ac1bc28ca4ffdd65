package com.eyelevel.tableingestor.consumer;

import com.eyelevel.tableingestor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.tableingestor.exception.MessageProcessingFailedException;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.service.pipeline.IngestionTrigger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadEventConsumerTest {

    @Mock
    private IngestionTrigger ingestionTrigger;

    private UploadEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new UploadEventConsumer(new JacksonJsonParser(new ObjectMapper()), ingestionTrigger);
    }

    @Test
    @DisplayName("Should trigger one job per record of an S3 notification, decoding the key")
    void onMessage_s3Notification() {
        String message = """
                {"Records": [
                  {"eventName": "ObjectCreated:Put", "awsRegion": "us-east-1",
                   "s3": {"bucket": {"name": "uploads", "arn": "arn:aws:s3:::uploads"},
                          "object": {"key": "incoming/Q1+sales%282%29.csv", "size": 120}}},
                  {"eventName": "ObjectCreated:Put",
                   "s3": {"bucket": {"name": "uploads"}, "object": {"key": "scans/invoice.pdf"}}}
                ]}
                """;

        consumer.onMessage(message);

        verify(ingestionTrigger).accept(new UploadEvent("uploads", "incoming/Q1 sales(2).csv"));
        verify(ingestionTrigger).accept(new UploadEvent("uploads", "scans/invoice.pdf"));
    }

    @Test
    @DisplayName("Should accept a plain bucket and key message")
    void onMessage_plainEvent() {
        consumer.onMessage("{\"bucket\": \"uploads\", \"key\": \"incoming/sales_2024.csv\"}");

        verify(ingestionTrigger).accept(new UploadEvent("uploads", "incoming/sales_2024.csv"));
    }

    @Test
    @DisplayName("Should drop S3 test events and unparseable messages")
    void onMessage_dropsNonEvents() {
        consumer.onMessage("{\"Service\": \"Amazon S3\", \"Event\": \"s3:TestEvent\", \"Bucket\": \"uploads\"}");
        consumer.onMessage("not json at all");

        verifyNoInteractions(ingestionTrigger);
    }

    @Test
    @DisplayName("Should fail the message so it is redelivered when the pipeline cannot accept it")
    void onMessage_triggerFailure() {
        when(ingestionTrigger.accept(any())).thenThrow(new IllegalStateException("database unavailable"));

        assertThrows(MessageProcessingFailedException.class,
                () -> consumer.onMessage("{\"bucket\": \"uploads\", \"key\": \"a.csv\"}"));
    }
}
