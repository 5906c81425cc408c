package com.flagship.split_escrow.notification;

import com.flagship.split_escrow.port.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Notification channel that writes to the application log.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    @Override
    public void notify(UUID recipientId, String template, Map<String, Object> data) {
        log.info("Notification: recipientId={}, template={}, data={}", recipientId, template, data);
    }
}
