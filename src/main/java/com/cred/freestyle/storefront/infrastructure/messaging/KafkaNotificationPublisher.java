package com.cred.freestyle.storefront.infrastructure.messaging;

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
 * Kafka producer for store notifications consumed by the presentation adapter.
 *
 * Topic partitioning strategy:
 * - Key: recipient id (falls back to the referenced entity)
 * - All notifications for one user land on the same partition, in order
 *
 * @author Storefront Team
 */
@Service
public class KafkaNotificationPublisher implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(KafkaNotificationPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaNotificationPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${storefront.notifications.topic:storefront-notifications}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    @Override
    public void send(StoreNotification notification) {
        try {
            String payload = objectMapper.writeValueAsString(notification);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    topic,
                    notification.partitionKey(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} notification for {}, partition: {}",
                            notification.getType(), notification.partitionKey(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} notification for {}",
                            notification.getType(), notification.partitionKey(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} notification for {}",
                    notification.getType(), notification.partitionKey(), e);
        } catch (RuntimeException e) {
            // KafkaTemplate.send can throw synchronously when metadata is unavailable
            logger.error("Could not hand {} notification to Kafka", notification.getType(), e);
        }
    }
}
