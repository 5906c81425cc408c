package com.flagship.split_escrow.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.split_escrow.event.EscrowStatusChangedEvent;
import com.flagship.split_escrow.event.MilestoneTransitionedEvent;
import com.flagship.split_escrow.event.PayoutItemSettledEvent;
import com.flagship.split_escrow.port.NotificationPort;
import com.flagship.split_escrow.project.ProjectEntity;
import com.flagship.split_escrow.project.ProjectService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Routing and acknowledgement behaviour of the settlement consumer, with the
 * idempotency store and notification port mocked out.
 */
class SettlementEventConsumerTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private NotificationPort notifications;
    private ProjectService projectService;
    private IdempotentEventProcessor eventProcessor;
    private SettlementEventConsumer consumer;

    @BeforeEach
    void setUp() {
        notifications = mock(NotificationPort.class);
        projectService = mock(ProjectService.class);
        eventProcessor = mock(IdempotentEventProcessor.class);

        when(eventProcessor.processEvent(any(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            Runnable handler = invocation.getArgument(5);
            handler.run();
            return true;
        });

        consumer = new SettlementEventConsumer(eventProcessor,
                new SettlementEventHandler(notifications, projectService), objectMapper);
    }

    private String toJson(Object event) throws Exception {
        return objectMapper.writeValueAsString(event);
    }

    private ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("settlement-events", 0, 42L, "key", value);
    }

    @Test
    @DisplayName("Milestone transitions notify the owner and every member")
    void milestoneTransitionNotifiesParticipants() throws Exception {
        UUID projectId = UUID.randomUUID();
        UUID ownerId = UUID.randomUUID();
        UUID memberA = UUID.randomUUID();
        UUID memberB = UUID.randomUUID();

        ProjectEntity project = mock(ProjectEntity.class);
        when(project.getOwnerId()).thenReturn(ownerId);
        when(project.getMemberIds()).thenReturn(Set.of(ownerId, memberA, memberB));
        when(projectService.getProject(projectId)).thenReturn(project);

        MilestoneTransitionedEvent event = MilestoneTransitionedEvent.of(
                UUID.randomUUID(), projectId, "COMPLETED", "APPROVED", ownerId, null);

        SettlementEventConsumer.EventEnvelope envelope = consumer.parseEvent(toJson(event));
        assertNotNull(envelope);
        assertEquals(event.getEventId(), envelope.eventId());
        assertEquals("Milestone", envelope.aggregateType());

        assertTrue(consumer.route(envelope));

        verify(notifications).notify(eq(ownerId), eq("milestone.approved"), anyMap());
        verify(notifications).notify(eq(memberA), eq("milestone.approved"), anyMap());
        verify(notifications).notify(eq(memberB), eq("milestone.approved"), anyMap());
        verifyNoMoreInteractions(notifications);
        verify(eventProcessor).processEvent(eq(event.getEventId()), eq(MilestoneTransitionedEvent.EVENT_TYPE),
                eq("Milestone"), eq(event.getMilestoneId()), eq(SettlementEventConsumer.CONSUMER_GROUP), any());
    }

    @Test
    @DisplayName("Settled payout items notify the recipient with the item outcome")
    void payoutItemSettledNotifiesRecipient() throws Exception {
        UUID recipientId = UUID.randomUUID();
        PayoutItemSettledEvent event = PayoutItemSettledEvent.of(
                UUID.randomUUID(), UUID.randomUUID(), recipientId, 5700L, "USD", "PAID", null);

        assertTrue(consumer.route(consumer.parseEvent(toJson(event))));

        verify(notifications).notify(eq(recipientId), eq("payout.paid"), argThat(data ->
                Long.valueOf(5700L).equals(data.get("netAmount")) && "USD".equals(data.get("currency"))));
    }

    @Test
    @DisplayName("Event types without a notification are recorded as skipped")
    void unknownTypesAreSkipped() throws Exception {
        EscrowStatusChangedEvent event = EscrowStatusChangedEvent.of(
                UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 9500L, "USD", "RELEASED");

        assertFalse(consumer.route(consumer.parseEvent(toJson(event))));

        verify(eventProcessor).skipEvent(eq(event.getEventId()), eq(EscrowStatusChangedEvent.EVENT_TYPE),
                any(), any(), eq(SettlementEventConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(notifications);
    }

    @Test
    @DisplayName("Malformed messages are acknowledged and dropped")
    void malformedMessagesAreAcknowledged() {
        assertNull(consumer.parseEvent("{not json"));
        assertNull(consumer.parseEvent("{\"eventType\":\"MilestoneTransitioned\"}"));

        Acknowledgment ack = mock(Acknowledgment.class);
        consumer.consume(record("{not json"), ack);

        verify(ack).acknowledge();
        verifyNoInteractions(eventProcessor);
    }

    @Test
    @DisplayName("Handler failures propagate and leave the offset uncommitted")
    void handlerFailureIsNotAcknowledged() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(projectService.getProject(projectId)).thenThrow(new IllegalStateException("db unavailable"));

        MilestoneTransitionedEvent event = MilestoneTransitionedEvent.of(
                UUID.randomUUID(), projectId, "FUNDED", "COMPLETED", UUID.randomUUID(), null);
        Acknowledgment ack = mock(Acknowledgment.class);

        assertThrows(IllegalStateException.class, () -> consumer.consume(record(toJson(event)), ack));
        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Duplicates are acknowledged without notifying anyone")
    void duplicatesAreAcknowledged() throws Exception {
        doReturn(false).when(eventProcessor).processEvent(any(), any(), any(), any(), any(), any());
        PayoutItemSettledEvent event = PayoutItemSettledEvent.of(
                UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 100L, "USD", "FAILED", "account closed");
        Acknowledgment ack = mock(Acknowledgment.class);

        consumer.consume(record(toJson(event)), ack);

        verify(ack).acknowledge();
        verifyNoInteractions(notifications);
    }
}
