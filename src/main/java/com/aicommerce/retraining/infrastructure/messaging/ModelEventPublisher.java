package com.aicommerce.retraining.infrastructure.messaging;

import com.aicommerce.retraining.infrastructure.messaging.events.ModelLifecycleEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes model lifecycle events to Kafka.
 *
 * Topic partitioning strategy:
 * - Key: task name, so all events for a task stay ordered on one partition
 *
 * Publishing is best-effort: the in-memory production pointer is the source of
 * truth, so a failed send is logged and never fails the retrain that caused it.
 *
 * @author Retraining Team
 */
@Service
public class ModelEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ModelEventPublisher.class);

    static final String MODEL_LIFECYCLE_TOPIC = "model-lifecycle-events";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public ModelEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${retraining.events.enabled:false}") boolean enabled
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    /**
     * Publish a lifecycle event for a task.
     *
     * @param event Model lifecycle event
     */
    public void publish(ModelLifecycleEvent event) {
        if (!enabled) {
            logger.debug("Event publishing disabled, dropping {}", event);
            return;
        }

        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    MODEL_LIFECYCLE_TOPIC,
                    event.getTask().name(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} event for task {} version {}, partition: {}",
                            event.getEventType(), event.getTask(), event.getProductionVersion(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for task {} version {}",
                            event.getEventType(), event.getTask(), event.getProductionVersion(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing lifecycle event for task {}", event.getTask(), e);
        } catch (Exception e) {
            logger.error("Error sending lifecycle event for task {}", event.getTask(), e);
        }
    }
}
