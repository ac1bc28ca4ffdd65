package com.eyelevel.tableingestor.service.storage;

import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.ObjectNotFoundException;
import com.eyelevel.tableingestor.exception.TransientStoreException;
import com.eyelevel.tableingestor.model.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;

/**
 * {@link ObjectStore} over the AWS SDK v2 {@link S3Client}; works against S3 and MinIO.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;

    @Override
    public StoredObject get(String bucket, String key) {
        log.debug("Downloading object s3://{}/{}", bucket, key);
        try {
            GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            byte[] content = response.asByteArray();
            return new StoredObject(content, response.response().contentType(), content.length);
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException(String.format("Object s3://%s/%s does not exist", bucket, key), e);
        } catch (S3Exception e) {
            throw translate("get", bucket, key, e);
        } catch (SdkClientException e) {
            throw new TransientStoreException(String.format("Failed to reach object store for s3://%s/%s: %s",
                    bucket, key, e.getMessage()), e);
        }
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        log.debug("Listing objects under s3://{}/{}", bucket, prefix);
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .map(S3Object::key)
                    .filter(key -> !key.endsWith("/"))
                    .toList();
        } catch (S3Exception e) {
            throw translate("list", bucket, prefix, e);
        } catch (SdkClientException e) {
            throw new TransientStoreException("Failed to list s3://" + bucket + "/" + prefix, e);
        }
    }

    @Override
    public void put(String bucket, String key, byte[] content, String contentType) {
        log.info("Uploading {} bytes to s3://{}/{}", content.length, bucket, key);
        try {
            PutObjectRequest request = PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType)
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (S3Exception e) {
            throw translate("put", bucket, key, e);
        } catch (SdkClientException e) {
            throw new TransientStoreException("Failed to upload s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public boolean exists(String bucket, String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw translate("head", bucket, key, e);
        } catch (SdkClientException e) {
            throw new TransientStoreException("Failed to check s3://" + bucket + "/" + key, e);
        }
    }

    private IngestionException translate(String operation, String bucket, String key, S3Exception e) {
        String message = String.format("S3 %s failed for s3://%s/%s (HTTP %d): %s", operation, bucket, key,
                e.statusCode(), e.getMessage());
        if (e.statusCode() == 404) {
            return new ObjectNotFoundException(message, e);
        }
        if (e.statusCode() >= 500 || e.statusCode() == 429 || e.isThrottlingException()) {
            return new TransientStoreException(message, e);
        }
        return new IngestionException(ErrorCode.INTERNAL_ERROR, message, e);
    }
}
