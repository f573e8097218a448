/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.exception.PublishException;
import com.streamfacade.common.util.Subjects;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.bridge.PublishReceipt;
import com.streamfacade.messaging.bridge.TransportBridge;

import java.util.Map;

/**
 * Sends messages into one stream. Every publish carries a deduplication key; the backend drops
 * repeated publishes of the same key inside its duplicate window, which makes retries by the
 * caller safe.
 *
 * <p>There is no buffering: one call is one send attempt, and a failed attempt is not retried.
 * A publisher holds no lock of its own; concurrent calls are serialized by the shared bridge.</p>
 */
public class Publisher {

    private final TransportBridge bridge;
    private final String streamName;

    Publisher(TransportBridge bridge, String streamName) {
        this.bridge = bridge;
        this.streamName = streamName;
    }

    public String streamName() { return streamName; }

    public PublishReceipt publish(String subject, byte[] data, String dedupKey) {
        return publish(new OutboundMessage(subject, data, Map.of()), dedupKey);
    }

    /**
     * @param dedupKey caller-chosen identity of the logical event, e.g. an event id or a hash of the payload
     * @throws PublishException if the subject is outside this stream or the backend rejects the message
     */
    public PublishReceipt publish(OutboundMessage message, String dedupKey) {
        if (dedupKey == null || dedupKey.isBlank()) {
            throw new IllegalArgumentException("dedupKey must not be blank");
        }
        if (!Subjects.isLiteral(message.subject())) {
            throw new PublishException("Invalid publish subject '" + message.subject() + "'");
        }
        if (!streamName.equals(Subjects.streamName(message.subject()))) {
            throw new PublishException("Subject '" + message.subject() + "' is not part of stream '" + streamName + "'");
        }
        try {
            return bridge.publish(message, dedupKey);
        } catch (RuntimeException e) {
            throw new PublishException("Message '" + dedupKey + "' could not be published to '"
                    + message.subject() + "': " + e.getMessage(), e);
        }
    }
}
