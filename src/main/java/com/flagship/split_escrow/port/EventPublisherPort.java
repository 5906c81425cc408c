package com.flagship.split_escrow.port;

import com.flagship.split_escrow.event.SettlementEvent;

/**
 * Outbound port for domain events.
 *
 * Implementations must join the caller's transaction so that an event is
 * recorded if and only if the state change that produced it commits.
 */
public interface EventPublisherPort {

    void publish(SettlementEvent event);
}
