/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import java.time.Instant;
import java.util.Map;

/**
 * A message as delivered by the backend, before it is handed to application code.
 */
public interface RawMessage {

    String subject();

    byte[] data();

    Map<String, String> headers();

    /** Deduplication id the message was published with, or {@code null}. */
    String messageId();

    long streamSequence();

    /** 1 on first delivery, incremented on every redelivery. */
    long deliveryCount();

    Instant timestamp();
}
