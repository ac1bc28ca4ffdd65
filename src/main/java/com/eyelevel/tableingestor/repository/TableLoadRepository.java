package com.eyelevel.tableingestor.repository;

import com.eyelevel.tableingestor.model.TableLoad;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TableLoadRepository extends JpaRepository<TableLoad, Long> {

    Optional<TableLoad> findByTableNameAndSourceKeyAndContentHash(String tableName, String sourceKey,
                                                                   String contentHash);
}
