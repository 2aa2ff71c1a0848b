package com.aicommerce.retraining.repository;

import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.PerformanceRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the append-only performance history.
 * Only inserts and reads are used; records are never updated or deleted.
 *
 * @author Retraining Team
 */
@Repository
public interface PerformanceRecordRepository extends JpaRepository<PerformanceRecord, String> {

    List<PerformanceRecord> findAllByOrderByTimestampDesc(Pageable pageable);

    List<PerformanceRecord> findByTaskOrderByTimestampDesc(ModelTask task, Pageable pageable);
}
