/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.nats;

import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.RawMessage;
import com.streamfacade.messaging.bridge.RawSubscription;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pull subscription on a durable JetStream consumer. Each {@link #nextMessage()} runs a fetch
 * loop of single-message batches on the bridge's pull executor until a message arrives, the
 * request is cancelled or the subscription is drained.
 */
final class NatsRawSubscription implements RawSubscription {

    private static final Logger log = LoggerFactory.getLogger(NatsRawSubscription.class);

    private final JetStreamSubscription subscription;
    private final String subject;
    private final String consumerName;
    private final ExecutorService pullExecutor;
    private final Duration pullWait;
    private final Duration drainTimeout;
    private volatile boolean drained;

    NatsRawSubscription(JetStreamSubscription subscription, String subject, String consumerName,
                        ExecutorService pullExecutor, Duration pullWait, Duration drainTimeout) {
        this.subscription = subscription;
        this.subject = subject;
        this.consumerName = consumerName;
        this.pullExecutor = pullExecutor;
        this.pullWait = pullWait;
        this.drainTimeout = drainTimeout;
    }

    @Override public String subject() { return subject; }
    @Override public String consumerName() { return consumerName; }

    @Override
    public CompletableFuture<RawMessage> nextMessage() {
        CompletableFuture<RawMessage> next = new CompletableFuture<>();
        if (drained) return next;
        try {
            pullExecutor.execute(() -> pull(next));
        } catch (RejectedExecutionException e) {
            next.completeExceptionally(new BridgeException("Session is closed", e));
        }
        return next;
    }

    private void pull(CompletableFuture<RawMessage> next) {
        while (!next.isDone() && !drained) {
            List<Message> batch;
            try {
                batch = subscription.fetch(1, pullWait);
            } catch (RuntimeException e) {
                if (drained) {
                    log.debug("Fetch on '{}' ended by drain: {}", subject, e.getMessage());
                    return;
                }
                next.completeExceptionally(new BridgeException("Fetch on '" + subject + "' failed: " + e.getMessage(), e));
                return;
            }
            for (Message message : batch) {
                if (!message.isJetStream()) continue;
                if (next.isDone() || drained || !next.complete(new NatsRawMessage(message))) {
                    // withdrawn while fetching: let the server redeliver it
                    message.nak();
                }
            }
        }
    }

    @Override
    public void ack(RawMessage message) {
        Message m = own(message);
        try {
            m.ack();
        } catch (RuntimeException e) {
            throw new BridgeException("Ack failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void nak(RawMessage message, Duration delay) {
        Message m = own(message);
        try {
            if (delay == null || delay.isZero()) {
                m.nak();
            } else {
                m.nakWithDelay(delay);
            }
        } catch (RuntimeException e) {
            throw new BridgeException("Nak failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void terminate(RawMessage message) {
        Message m = own(message);
        try {
            m.term();
        } catch (RuntimeException e) {
            throw new BridgeException("Term failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void drain() {
        drained = true;
        try {
            subscription.drain(drainTimeout).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException("Interrupted while draining '" + subject + "'", e);
        } catch (Exception e) {
            throw new BridgeException("Drain of '" + subject + "' failed: " + e.getMessage(), e);
        }
        log.debug("Subscription '{}' of consumer '{}' drained", subject, consumerName);
    }

    private static Message own(RawMessage message) {
        if (message instanceof NatsRawMessage nats) return nats.message();
        throw new BridgeException("Not a JetStream message: " + message.getClass().getName());
    }
}
