package com.flagship.split_escrow.port;

import java.util.Map;
import java.util.UUID;

/**
 * Outbound port for user-facing notifications. Delivery is best effort.
 */
public interface NotificationPort {

    void notify(UUID recipientId, String template, Map<String, Object> data);
}
