/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.messaging.bridge.RawMessage;
import com.streamfacade.messaging.core.SubscriptionMode;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Durable consumer state of one stream: a delivery cursor, the unacknowledged messages and
 * the pull requests waiting for a message.
 *
 * <p>Redeliveries go out before new messages, lowest sequence first. In strict mode at most
 * one message is unacknowledged at a time.</p>
 */
final class InMemoryConsumer {

    private final InMemoryStream stream;
    private final String name;
    private final String filter;
    private final SubscriptionMode mode;
    private final int maxAckPending;
    private final ScheduledExecutorService scheduler;

    /** last sequence delivered for the first time */
    private long cursor;
    /** sequence → deliveries so far */
    private final Map<Long, Integer> outstanding = new HashMap<>();
    private final TreeSet<Long> redeliverable = new TreeSet<>();
    private final Deque<CompletableFuture<RawMessage>> waiters = new ArrayDeque<>();
    private long acked;
    private long terminated;

    InMemoryConsumer(InMemoryStream stream, String name, String filter, SubscriptionMode mode,
                     ScheduledExecutorService scheduler) {
        this.stream = stream;
        this.name = name;
        this.filter = filter;
        this.mode = mode;
        this.maxAckPending = mode == SubscriptionMode.SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER ? 1 : Integer.MAX_VALUE;
        this.scheduler = scheduler;
    }

    String name() { return name; }
    String filter() { return filter; }
    SubscriptionMode mode() { return mode; }

    synchronized void request(CompletableFuture<RawMessage> waiter) {
        waiters.add(waiter);
        dispatch();
    }

    synchronized void withdraw(CompletableFuture<RawMessage> waiter) {
        waiters.remove(waiter);
    }

    synchronized void dispatch() {
        while (!waiters.isEmpty()) {
            CompletableFuture<RawMessage> waiter = waiters.peek();
            if (waiter.isDone()) {
                waiters.poll();
                continue;
            }
            InMemoryMessage next = takeNext();
            if (next == null) return;
            waiters.poll();
            if (!waiter.complete(next)) {
                giveBack(next);
            }
        }
    }

    synchronized void ack(long sequence) {
        if (outstanding.remove(sequence) != null) {
            redeliverable.remove(sequence);
            acked++;
            dispatch();
        }
    }

    synchronized void terminate(long sequence) {
        if (outstanding.remove(sequence) != null) {
            redeliverable.remove(sequence);
            terminated++;
            dispatch();
        }
    }

    synchronized void nak(long sequence, Duration delay) {
        if (!outstanding.containsKey(sequence)) return;
        if (delay.isZero() || delay.isNegative()) {
            release(sequence);
        } else {
            scheduler.schedule(() -> release(sequence), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    synchronized int pendingAcks() {
        return outstanding.size();
    }

    synchronized long ackedCount() {
        return acked;
    }

    synchronized long terminatedCount() {
        return terminated;
    }

    private synchronized void release(long sequence) {
        if (outstanding.containsKey(sequence)) {
            redeliverable.add(sequence);
            dispatch();
        }
    }

    private InMemoryMessage takeNext() {
        Long sequence = redeliverable.pollFirst();
        if (sequence != null) {
            int deliveries = outstanding.merge(sequence, 1, Integer::sum);
            return stream.message(sequence).deliver(deliveries, this);
        }
        if (outstanding.size() >= maxAckPending) return null;
        StoredMessage stored = stream.nextMatching(cursor, filter);
        if (stored == null) return null;
        cursor = stored.sequence();
        outstanding.put(stored.sequence(), 1);
        return stored.deliver(1, this);
    }

    /** Undoes a delivery whose pull request was withdrawn in the meantime. */
    private void giveBack(InMemoryMessage message) {
        long sequence = message.streamSequence();
        if (message.deliveryCount() == 1) {
            outstanding.remove(sequence);
            cursor = sequence - 1;
        } else {
            outstanding.computeIfPresent(sequence, (k, v) -> v - 1);
            redeliverable.add(sequence);
        }
    }
}
