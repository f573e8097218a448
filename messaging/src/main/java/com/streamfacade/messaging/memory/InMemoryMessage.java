/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.messaging.bridge.RawMessage;

import java.time.Instant;
import java.util.Map;

/**
 * One delivery of a stored message.
 */
record InMemoryMessage(String subject, byte[] data, Map<String, String> headers, String messageId,
                       long streamSequence, long deliveryCount, Instant timestamp,
                       InMemoryConsumer consumer) implements RawMessage {

    @Override
    public byte[] data() {
        return data.clone();
    }
}
