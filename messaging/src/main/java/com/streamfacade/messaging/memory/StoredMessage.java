/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import java.time.Instant;
import java.util.Map;

record StoredMessage(long sequence, String subject, byte[] data, Map<String, String> headers,
                     String messageId, Instant timestamp) {

    InMemoryMessage deliver(long deliveryCount, InMemoryConsumer consumer) {
        return new InMemoryMessage(subject, data, headers, messageId, sequence, deliveryCount, timestamp, consumer);
    }
}
