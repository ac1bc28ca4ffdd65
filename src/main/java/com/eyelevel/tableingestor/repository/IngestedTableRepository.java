package com.eyelevel.tableingestor.repository;

import com.eyelevel.tableingestor.model.IngestedTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link IngestedTable} registry.
 */
@Repository
public interface IngestedTableRepository extends JpaRepository<IngestedTable, Long> {

    Optional<IngestedTable> findByTableName(String tableName);

    List<IngestedTable> findAllByOrderByTableNameAsc();
}
