package com.eyelevel.tableingestor.service.load;

/**
 * Identifies the source of a load for the idempotency ledger.
 *
 * @param sourceKey   {@code bucket/key} of the uploaded object.
 * @param contentHash SHA-256 of the object content.
 */
public record LoadRequest(Long jobId, String sourceKey, String contentHash, String contextInfo) {
}
