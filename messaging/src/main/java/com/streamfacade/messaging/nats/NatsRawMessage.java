/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.nats;

import com.streamfacade.messaging.bridge.RawMessage;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A JetStream message with its metadata read once on arrival.
 */
final class NatsRawMessage implements RawMessage {

    static final String MSG_ID_HEADER = "Nats-Msg-Id";

    private final Message message;
    private final Map<String, String> headers;
    private final long streamSequence;
    private final long deliveryCount;
    private final Instant timestamp;

    NatsRawMessage(Message message) {
        this.message = message;
        NatsJetStreamMetaData meta = message.metaData();
        this.streamSequence = meta.streamSequence();
        this.deliveryCount = meta.deliveredCount();
        this.timestamp = meta.timestamp() != null ? meta.timestamp().toInstant() : Instant.EPOCH;
        this.headers = flatten(message.getHeaders());
    }

    Message message() { return message; }

    @Override public String subject() { return message.getSubject(); }
    @Override public byte[] data() { return message.getData() == null ? new byte[0] : message.getData().clone(); }
    @Override public Map<String, String> headers() { return headers; }
    @Override public String messageId() { return headers.get(MSG_ID_HEADER); }
    @Override public long streamSequence() { return streamSequence; }
    @Override public long deliveryCount() { return deliveryCount; }
    @Override public Instant timestamp() { return timestamp; }

    private static Map<String, String> flatten(Headers natsHeaders) {
        if (natsHeaders == null || natsHeaders.isEmpty()) return Collections.emptyMap();
        Map<String, String> flat = new LinkedHashMap<>();
        for (String key : natsHeaders.keySet()) {
            flat.put(key, natsHeaders.getFirst(key));
        }
        return Collections.unmodifiableMap(flat);
    }
}
