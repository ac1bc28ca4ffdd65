package com.eyelevel.tableingestor.repository;

import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.JobState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link IngestionJob} entity.
 */
@Repository
public interface IngestionJobRepository extends JpaRepository<IngestionJob, Long> {

    @Transactional(readOnly = true)
    Optional<IngestionJob> findFirstByBucketAndFileKeyAndContentHashAndStateInAndIdNotOrderByIdAsc(
            String bucket, String fileKey, String contentHash, Collection<JobState> states, Long idToExclude);

    @Transactional(readOnly = true)
    List<IngestionJob> findAllByBucketAndFileKeyOrderByIdDesc(String bucket, String fileKey);

    @Transactional(readOnly = true)
    boolean existsByBucketAndFileKeyAndStateNotIn(String bucket, String fileKey, Collection<JobState> states);

    @Transactional(readOnly = true)
    boolean existsByBucketAndFileKey(String bucket, String fileKey);
}
