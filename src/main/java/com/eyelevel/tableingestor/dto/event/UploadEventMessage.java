package com.eyelevel.tableingestor.dto.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a queue message announcing an upload. Accepts both an S3 event notification
 * ({@code Records[].s3.bucket.name / object.key}) and a plain {@code {"bucket", "key"}} object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadEventMessage(@JsonProperty("Records") List<EventRecord> records, String bucket, String key) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventRecord(String eventName, S3 s3) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record S3(Bucket bucket, S3Object object) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Bucket(String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record S3Object(String key, Long size) {
    }
}
