package com.eyelevel.tableingestor.repository;

import com.eyelevel.tableingestor.model.DocumentPageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentPageRecordRepository extends JpaRepository<DocumentPageRecord, Long> {

    List<DocumentPageRecord> findAllByJobIdOrderByPageNumberAsc(Long jobId);

    void deleteAllByJobId(Long jobId);
}
