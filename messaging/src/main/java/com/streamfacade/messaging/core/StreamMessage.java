/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.messaging.bridge.RawMessage;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable envelope of a delivered message as seen by a {@link MessageHandler}.
 */
public final class StreamMessage {

    private final String subject;
    private final byte[] data;
    private final Map<String, String> headers;
    private final String messageId;
    private final long streamSequence;
    private final long deliveryCount;
    private final Instant timestamp;

    public StreamMessage(String subject, byte[] data, Map<String, String> headers, String messageId,
                         long streamSequence, long deliveryCount, Instant timestamp) {
        this.subject = subject;
        this.data = data == null ? new byte[0] : data.clone();
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.messageId = messageId;
        this.streamSequence = streamSequence;
        this.deliveryCount = deliveryCount;
        this.timestamp = timestamp;
    }

    static StreamMessage from(RawMessage raw) {
        return new StreamMessage(raw.subject(), raw.data(), raw.headers(), raw.messageId(),
                raw.streamSequence(), raw.deliveryCount(), raw.timestamp());
    }

    public String getSubject() { return subject; }
    public byte[] getData() { return data.clone(); }
    public String getPayload() { return new String(data, StandardCharsets.UTF_8); }
    public Map<String, String> getHeaders() { return headers; }
    /** Deduplication id the message was published with. */
    public String getMessageId() { return messageId; }
    public long getStreamSequence() { return streamSequence; }
    /** 1 on first delivery. */
    public long getDeliveryCount() { return deliveryCount; }
    public boolean isRedelivery() { return deliveryCount > 1; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "StreamMessage{subject=" + subject + ", seq=" + streamSequence
                + ", delivery=" + deliveryCount + ", id=" + messageId + "}";
    }
}
