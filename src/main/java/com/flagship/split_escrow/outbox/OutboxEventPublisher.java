package com.flagship.split_escrow.outbox;

import com.flagship.split_escrow.event.SettlementEvent;
import com.flagship.split_escrow.port.EventPublisherPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link EventPublisherPort} backed by the transactional outbox.
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPublisher implements EventPublisherPort {

    private final OutboxService outboxService;

    @Override
    public void publish(SettlementEvent event) {
        outboxService.saveEvent(event.getAggregateType(), event.getAggregateId(), event.getEventType(), event);
    }
}
