package com.eyelevel.tableingestor.service.storage;

import java.util.List;

/**
 * Get/list/put access to the object store holding uploaded files.
 */
public interface ObjectStore {

    /**
     * @throws com.eyelevel.tableingestor.exception.ObjectNotFoundException if the key does not exist.
     * @throws com.eyelevel.tableingestor.exception.TransientStoreException on retryable failures.
     */
    StoredObject get(String bucket, String key);

    List<String> list(String bucket, String prefix);

    void put(String bucket, String key, byte[] content, String contentType);

    boolean exists(String bucket, String key);
}
