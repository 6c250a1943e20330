package com.flagship.raffle_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.raffle_engine.event.RaffleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes domain events to the outbox inside the caller's transaction.
 *
 * If the raffle, entry, draw or payout change commits, its event commits with
 * it; if it rolls back, so does the event. {@link OutboxPublisher} sends
 * committed events to Kafka afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_RAFFLE = "Raffle";
    public static final String AGGREGATE_PAYOUT = "Payout";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Must be called within an existing transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, RaffleEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
                aggregateType,
                event.getAggregateId(),
                event.getEventType(),
                serializePayload(event),
                clock.instant());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), aggregateType, event.getAggregateId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one aggregate in commit order, for auditing a raffle or payout.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String serializePayload(RaffleEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
