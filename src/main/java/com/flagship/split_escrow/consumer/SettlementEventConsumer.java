package com.flagship.split_escrow.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.event.JobDeadLetteredEvent;
import com.flagship.split_escrow.event.MilestoneTransitionedEvent;
import com.flagship.split_escrow.event.PayoutBatchScheduledEvent;
import com.flagship.split_escrow.event.PayoutItemSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Kafka consumer for settlement events.
 *
 * Offsets are acknowledged manually, only after the event was handled or
 * recognized as a duplicate. A failing handler leaves the offset uncommitted
 * and the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    static final String CONSUMER_GROUP = "settlement-notifier";

    private final IdempotentEventProcessor eventProcessor;
    private final SettlementEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.settlement-events:settlement-events}",
        groupId = "${spring.kafka.consumer.group-id:split-escrow-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEvent(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope);
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, aggregateId={}",
                        envelope.eventType(), envelope.eventId(), envelope.aggregateId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    boolean route(EventEnvelope envelope) {
        switch (envelope.eventType()) {
            case MilestoneTransitionedEvent.EVENT_TYPE:
                return handle(envelope, eventHandler::onMilestoneTransitioned);
            case PayoutBatchScheduledEvent.EVENT_TYPE:
                return handle(envelope, eventHandler::onPayoutBatchScheduled);
            case PayoutItemSettledEvent.EVENT_TYPE:
                return handle(envelope, eventHandler::onPayoutItemSettled);
            case JobDeadLetteredEvent.EVENT_TYPE:
                return handle(envelope, eventHandler::onJobDeadLettered);
            default:
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                        envelope.aggregateType(), envelope.aggregateId(),
                        CONSUMER_GROUP, "No notification for event type");
                return false;
        }
    }

    private boolean handle(EventEnvelope envelope, Consumer<JsonNode> handler) {
        return eventProcessor.processEvent(
                envelope.eventId(), envelope.eventType(),
                envelope.aggregateType(), envelope.aggregateId(),
                CONSUMER_GROUP,
                () -> handler.accept(envelope.body()));
    }

    EventEnvelope parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return new EventEnvelope(
                    UUID.fromString(node.get("eventId").asText()),
                    node.get("eventType").asText(),
                    node.path("aggregateType").asText("Unknown"),
                    UUID.fromString(node.get("aggregateId").asText()),
                    node);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    record EventEnvelope(UUID eventId, String eventType, String aggregateType, UUID aggregateId, JsonNode body) {}
}
