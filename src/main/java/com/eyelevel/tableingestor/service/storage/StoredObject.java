package com.eyelevel.tableingestor.service.storage;

public record StoredObject(byte[] content, String contentType, long sizeBytes) {
}
