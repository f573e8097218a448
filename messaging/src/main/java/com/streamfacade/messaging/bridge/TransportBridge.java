/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import com.streamfacade.messaging.core.SubscriptionMode;

import java.util.List;

/**
 * Narrow capability interface between the delivery core and the message backend.
 * Everything transport related (framing, reconnection, TLS, server discovery) lives behind it.
 *
 * <p>All failures are reported as {@link BridgeException}. Implementations must be thread-safe:
 * one bridge is shared by every publisher and subscriber of a connection.</p>
 */
public interface TransportBridge {

    /** Returns the stream named in {@code spec}, creating it if it does not exist yet. */
    StreamDescriptor ensureStream(StreamSpec spec);

    /**
     * Creates a pull subscription for {@code subject} under the durable consumer
     * {@code consumerName}. The first token of the subject names the stream.
     * In {@link SubscriptionMode#SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER} the consumer allows
     * only one unacknowledged message at a time.
     */
    RawSubscription createSubscription(String subject, String consumerName, SubscriptionMode mode);

    /** Known server addresses, in connection preference order. */
    List<String> servers();

    /** Publishes one message; the backend drops duplicates of {@code dedupKey} within its window. */
    PublishReceipt publish(OutboundMessage message, String dedupKey);

    /**
     * Stops accepting new work, flushes in-flight work and closes the session.
     * Publishing afterwards fails.
     */
    void drain();
}
