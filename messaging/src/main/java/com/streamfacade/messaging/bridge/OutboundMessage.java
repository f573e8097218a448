/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

public record OutboundMessage(String subject, byte[] data, Map<String, String> headers) {

    public OutboundMessage {
        Objects.requireNonNull(subject, "subject must not be null");
        data = data == null ? new byte[0] : data;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public OutboundMessage(String subject, byte[] data) {
        this(subject, data, Map.of());
    }

    public static OutboundMessage of(String subject, String payload) {
        return new OutboundMessage(subject, payload.getBytes(StandardCharsets.UTF_8), Map.of());
    }
}
