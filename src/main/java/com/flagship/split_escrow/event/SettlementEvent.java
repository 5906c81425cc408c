package com.flagship.split_escrow.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for settlement domain events.
 *
 * All events share:
 * - Event ID for consumer deduplication
 * - Aggregate type and ID (the Kafka partition key)
 * - Timestamp of when the event occurred
 */
public interface SettlementEvent {

    UUID getEventId();

    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
