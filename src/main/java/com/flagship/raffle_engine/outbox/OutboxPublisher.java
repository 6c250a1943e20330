package com.flagship.raffle_engine.outbox;

import com.flagship.raffle_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to Kafka.
 *
 * Raffle events go to the raffles topic and payout events to the payouts
 * topic, keyed by aggregate id so each raffle's events stay in order on one
 * partition. Sends are synchronous; an event is marked published only after
 * the broker acknowledges it. Events that keep failing stop being picked up
 * after {@code outbox.publisher.max-retries} and show up as dead letters in
 * {@link OutboxMetrics}.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.raffles:raffles}")
    private String rafflesTopic;

    @Value("${kafka.topic.payouts:payouts}")
    private String payoutsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            String topic = topicFor(event);
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted while sending");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it for manual replay. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case OutboxService.AGGREGATE_RAFFLE -> rafflesTopic;
            case OutboxService.AGGREGATE_PAYOUT -> payoutsTopic;
            default -> throw new IllegalArgumentException("Unknown aggregate type: " + event.getAggregateType());
        };
    }
}
