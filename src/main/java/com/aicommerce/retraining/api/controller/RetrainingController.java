package com.aicommerce.retraining.api.controller;

import com.aicommerce.retraining.api.dto.ForceRetrainRequest;
import com.aicommerce.retraining.api.dto.PerformanceRecordResponse;
import com.aicommerce.retraining.api.dto.RetrainingStatusResponse;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.RetrainOutcome;
import com.aicommerce.retraining.exception.InvalidRequestException;
import com.aicommerce.retraining.service.PerformanceHistory;
import com.aicommerce.retraining.service.RetrainingOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the retraining service lifecycle.
 *
 * Endpoints:
 * - GET  /status   lifecycle and per-task data progress
 * - POST /start    start the background loop (idempotent)
 * - POST /stop     stop the background loop (idempotent)
 * - POST /force    retrain one task now, synchronously
 * - GET  /history  most recent retrain decisions
 *
 * @author Retraining Team
 */
@RestController
@RequestMapping("/api/v1/retraining")
public class RetrainingController {

    private static final Logger logger = LoggerFactory.getLogger(RetrainingController.class);

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 500;

    private final RetrainingOrchestrator orchestrator;
    private final PerformanceHistory performanceHistory;

    public RetrainingController(RetrainingOrchestrator orchestrator, PerformanceHistory performanceHistory) {
        this.orchestrator = orchestrator;
        this.performanceHistory = performanceHistory;
    }

    @GetMapping("/status")
    public ResponseEntity<RetrainingStatusResponse> getStatus() {
        return ResponseEntity.ok(RetrainingStatusResponse.fromStatus(orchestrator.status()));
    }

    @PostMapping("/start")
    public ResponseEntity<RetrainingStatusResponse> start() {
        logger.info("Start requested");
        orchestrator.start();
        return ResponseEntity.ok(RetrainingStatusResponse.fromStatus(orchestrator.status()));
    }

    @PostMapping("/stop")
    public ResponseEntity<RetrainingStatusResponse> stop() {
        logger.info("Stop requested");
        orchestrator.stop();
        return ResponseEntity.ok(RetrainingStatusResponse.fromStatus(orchestrator.status()));
    }

    /**
     * Force a retrain of one task, bypassing the trigger.
     * Blocks until training and validation finish.
     *
     * @param request Task to retrain
     * @return record of the attempt; 409 if the task is already retraining
     */
    @PostMapping("/force")
    public ResponseEntity<PerformanceRecordResponse> forceRetrain(@Valid @RequestBody ForceRetrainRequest request) {
        ModelTask task = parseTask(request.getTask());
        logger.info("Forced retrain requested for {}", task);

        RetrainOutcome outcome = orchestrator.forceRetrain(task);
        if (!outcome.auditPersisted()) {
            logger.warn("Forced retrain of {} finished with {} but the audit record was not persisted",
                    task, outcome.decision());
        }
        return ResponseEntity.ok(PerformanceRecordResponse.fromOutcome(outcome));
    }

    /**
     * Most recent retrain decisions, newest first.
     *
     * @param task Optional task filter
     * @param limit Maximum number of records (default 50)
     * @return recent records
     */
    @GetMapping("/history")
    public ResponseEntity<List<PerformanceRecordResponse>> getHistory(
            @RequestParam(required = false) String task,
            @RequestParam(defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit
    ) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        ModelTask filter = task == null || task.isBlank() ? null : parseTask(task);

        List<PerformanceRecordResponse> records = performanceHistory.recent(filter, limit).stream()
                .map(PerformanceRecordResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Returning {} performance records (task={})", records.size(), filter);
        return ResponseEntity.ok(records);
    }

    private static ModelTask parseTask(String value) {
        try {
            return ModelTask.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }
}
