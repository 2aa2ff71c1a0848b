package com.aicommerce.retraining;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the model retraining service.
 *
 * System Overview:
 * - Keeps the churn and spending models current as user behavior data accumulates
 * - Retrains when enough new samples arrive or the check interval elapses
 * - Promotes a candidate only if it beats production by a relative threshold
 * - Retains a bounded rollback history per task
 * - Append-only audit log of every retrain decision
 *
 * Architecture:
 * - API Layer: REST control surface (start, stop, force, status, history, rollback)
 * - Service Layer: orchestrator, trigger evaluator, promotion validator, model store
 * - Data Access Layer: JPA repositories for behavior data, audit records and artifacts
 * - Infrastructure Layer: Weka trainer, Kafka lifecycle events, CloudWatch metrics
 *
 * @author Retraining Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class RetrainingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetrainingApplication.class, args);
    }
}
