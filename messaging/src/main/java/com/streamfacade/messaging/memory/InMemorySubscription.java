/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.RawMessage;
import com.streamfacade.messaging.bridge.RawSubscription;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

final class InMemorySubscription implements RawSubscription {

    private final InMemoryBridge session;
    private final InMemoryConsumer consumer;
    private final String subject;
    /** guards {@code drained} against concurrent pull registration */
    private final Object lock = new Object();
    private final Set<CompletableFuture<RawMessage>> pending = ConcurrentHashMap.newKeySet();
    private volatile boolean drained;

    InMemorySubscription(InMemoryBridge session, InMemoryConsumer consumer, String subject) {
        this.session = session;
        this.consumer = consumer;
        this.subject = subject;
    }

    @Override
    public String subject() { return subject; }

    @Override
    public String consumerName() { return consumer.name(); }

    @Override
    public CompletableFuture<RawMessage> nextMessage() {
        CompletableFuture<RawMessage> next = new CompletableFuture<>();
        synchronized (lock) {
            if (drained) return next;
            pending.add(next);
            next.whenComplete((m, t) -> pending.remove(next));
            consumer.request(next);
        }
        return next;
    }

    @Override
    public void ack(RawMessage message) {
        consumer.ack(own(message).streamSequence());
    }

    @Override
    public void nak(RawMessage message, Duration delay) {
        consumer.nak(own(message).streamSequence(), Objects.requireNonNullElse(delay, Duration.ZERO));
    }

    @Override
    public void terminate(RawMessage message) {
        consumer.terminate(own(message).streamSequence());
    }

    @Override
    public void drain() {
        synchronized (lock) {
            drained = true;
            for (CompletableFuture<RawMessage> next : pending) {
                consumer.withdraw(next);
            }
            pending.clear();
        }
    }

    boolean isDrained() {
        return drained;
    }

    private InMemoryMessage own(RawMessage message) {
        if (session.isClosed()) {
            throw new BridgeException("Session is closed");
        }
        if (!(message instanceof InMemoryMessage m) || m.consumer() != consumer) {
            throw new BridgeException("Message was not delivered by consumer '" + consumer.name() + "'");
        }
        return m;
    }
}
