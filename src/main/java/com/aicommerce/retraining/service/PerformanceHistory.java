package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.PerformanceRecord;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.repository.PerformanceRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of retrain decisions.
 *
 * Records are kept in an in-process log and written to the {@code performance_records}
 * table. A failed write is retried once; if it fails again the record stays in the
 * in-process log, a warning is logged and the caller is told the audit write did not
 * persist. Records are never modified or removed.
 *
 * @author Retraining Team
 */
@Service
public class PerformanceHistory {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceHistory.class);

    private final PerformanceRecordRepository performanceRecordRepository;
    private final RetrainingMetricsService metricsService;
    private final List<PerformanceRecord> records = new CopyOnWriteArrayList<>();

    public PerformanceHistory(
            PerformanceRecordRepository performanceRecordRepository,
            RetrainingMetricsService metricsService
    ) {
        this.performanceRecordRepository = performanceRecordRepository;
        this.metricsService = metricsService;
    }

    /**
     * Append a record to the log.
     *
     * @param record Record to append
     * @return true if the record was written to durable storage
     */
    public boolean append(PerformanceRecord record) {
        records.add(record);

        try {
            performanceRecordRepository.save(record);
            return true;
        } catch (DataAccessException first) {
            logger.warn("Writing performance record {} failed, retrying once: {}",
                    record.getRecordId(), first.getMessage());
        }

        try {
            performanceRecordRepository.save(record);
            return true;
        } catch (DataAccessException second) {
            logger.warn("Performance record {} ({} {} for {}) could not be persisted after retry",
                    record.getRecordId(), record.getDecision(), record.getReason(), record.getTask(), second);
            metricsService.recordPersistenceFailure("history");
            return false;
        }
    }

    /**
     * Records appended by this process, oldest first.
     *
     * @return unmodifiable view of the in-process log
     */
    public List<PerformanceRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Most recent records, newest first, from durable storage.
     * Falls back to the in-process log when the store cannot be read.
     *
     * @param task Task filter, null for all tasks
     * @param limit Maximum number of records
     * @return recent records
     */
    public List<PerformanceRecord> recent(ModelTask task, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        try {
            return task == null
                    ? performanceRecordRepository.findAllByOrderByTimestampDesc(page)
                    : performanceRecordRepository.findByTaskOrderByTimestampDesc(task, page);
        } catch (DataAccessException e) {
            logger.warn("Reading performance history failed, serving in-process records: {}", e.getMessage());
            List<PerformanceRecord> result = new ArrayList<>();
            for (int i = records.size() - 1; i >= 0 && result.size() < limit; i--) {
                PerformanceRecord record = records.get(i);
                if (task == null || record.getTask() == task) {
                    result.add(record);
                }
            }
            return result;
        }
    }
}
