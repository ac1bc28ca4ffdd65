package com.eyelevel.tableingestor.service.load;

/**
 * Outcome of a committed load.
 *
 * @param alreadyLoaded true when the ledger showed the same content was loaded before; nothing was inserted.
 * @param loadedByJobId the job whose rows are in the table, this job unless {@code alreadyLoaded}.
 */
public record LoadResult(String tableName, int rowsInserted, boolean alreadyLoaded, Long loadedByJobId) {
}
