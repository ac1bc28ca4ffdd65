package com.eyelevel.tableingestor.service.upload;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.EmptyContentException;
import com.eyelevel.tableingestor.exception.ObjectAlreadyExistsException;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.service.pipeline.IngestionTrigger;
import com.eyelevel.tableingestor.service.storage.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Stores a file posted over HTTP in the object store and hands the resulting event to the pipeline,
 * the same way a bucket notification would.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadService {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final IngestionConfig config;
    private final ObjectStore objectStore;
    private final IngestionTrigger trigger;

    public IngestionJob upload(MultipartFile file, String bucket, String key, boolean overwrite) {
        if (file == null || file.isEmpty()) {
            throw new EmptyContentException("Uploaded file is empty");
        }
        String targetBucket = StringUtils.hasText(bucket) ? bucket : config.getUpload().getBucket();
        if (!StringUtils.hasText(targetBucket)) {
            throw new IllegalArgumentException("No bucket given and no default upload bucket configured");
        }
        String targetKey = StringUtils.hasText(key) ? key : FilenameUtils.getName(file.getOriginalFilename());
        if (!StringUtils.hasText(targetKey)) {
            throw new IllegalArgumentException("No key given and the upload carries no file name");
        }

        if (!overwrite && objectStore.exists(targetBucket, targetKey)) {
            throw new ObjectAlreadyExistsException(String.format(
                    "Object s3://%s/%s already exists. Pass overwrite=true to replace it.", targetBucket, targetKey));
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded file " + targetKey, e);
        }
        String contentType = StringUtils.hasText(file.getContentType()) ? file.getContentType() : DEFAULT_CONTENT_TYPE;
        objectStore.put(targetBucket, targetKey, content, contentType);
        log.info("Stored upload of {} bytes at s3://{}/{}", content.length, targetBucket, targetKey);

        return trigger.accept(new UploadEvent(targetBucket, targetKey));
    }
}
