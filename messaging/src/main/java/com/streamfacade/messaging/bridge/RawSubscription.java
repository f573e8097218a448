/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Backend handle of one pull subscription. Owned by exactly one subscriber.
 */
public interface RawSubscription {

    String subject();

    String consumerName();

    /**
     * Requests the next message. The future completes when one is available, or exceptionally
     * with a {@link BridgeException} when the subscription can no longer deliver.
     * Cancelling the future withdraws the request; a message it would have carried stays
     * unacknowledged on the backend.
     */
    CompletableFuture<RawMessage> nextMessage();

    void ack(RawMessage message);

    /** Negative acknowledgement; the backend redelivers after {@code delay} (zero = its own schedule). */
    void nak(RawMessage message, Duration delay);

    /** Drops the message for good. */
    void terminate(RawMessage message);

    /** Stops new pulls and lets already-delivered messages be acknowledged. */
    void drain();
}
