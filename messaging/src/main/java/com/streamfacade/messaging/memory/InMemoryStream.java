/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.common.util.Subjects;
import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.bridge.PublishReceipt;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import com.streamfacade.messaging.core.SubscriptionMode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Append-only message log with a deduplication window and named durable consumers.
 */
final class InMemoryStream {

    private final StreamSpec spec;
    private final ScheduledExecutorService scheduler;
    private final List<StoredMessage> messages = new ArrayList<>();
    /** dedup key → original message, in publish order */
    private final LinkedHashMap<String, StoredMessage> recentIds = new LinkedHashMap<>();
    private final Map<String, InMemoryConsumer> consumers = new LinkedHashMap<>();

    InMemoryStream(StreamSpec spec, ScheduledExecutorService scheduler) {
        this.spec = spec;
        this.scheduler = scheduler;
    }

    String name() { return spec.name(); }

    boolean captures(String subject) {
        return spec.subjects().stream().anyMatch(filter -> Subjects.matches(filter, subject));
    }

    synchronized StreamDescriptor describe(boolean created) {
        return new StreamDescriptor(spec.name(), spec.subjects(), messages.size(), created);
    }

    synchronized long messageCount() {
        return messages.size();
    }

    PublishReceipt append(OutboundMessage message, String dedupKey) {
        StoredMessage stored;
        List<InMemoryConsumer> toNotify;
        synchronized (this) {
            Instant now = Instant.now();
            expireIds(now);
            if (dedupKey != null) {
                StoredMessage original = recentIds.get(dedupKey);
                if (original != null) {
                    return new PublishReceipt(spec.name(), original.sequence(), true);
                }
            }
            stored = new StoredMessage(messages.size() + 1L, message.subject(), message.data().clone(),
                    message.headers(), dedupKey, now);
            messages.add(stored);
            if (dedupKey != null) recentIds.put(dedupKey, stored);
            toNotify = new ArrayList<>(consumers.values());
        }
        for (InMemoryConsumer consumer : toNotify) {
            consumer.dispatch();
        }
        return new PublishReceipt(spec.name(), stored.sequence(), false);
    }

    synchronized StoredMessage message(long sequence) {
        return messages.get((int) (sequence - 1));
    }

    /** First message after {@code sequence} whose subject matches {@code filter}, or {@code null}. */
    synchronized StoredMessage nextMatching(long sequence, String filter) {
        for (int i = (int) sequence; i < messages.size(); i++) {
            StoredMessage candidate = messages.get(i);
            if (Subjects.matches(filter, candidate.subject())) return candidate;
        }
        return null;
    }

    /**
     * Returns the durable consumer {@code name}, creating it on first use.
     *
     * @throws BridgeException if it exists with another filter or mode
     */
    synchronized InMemoryConsumer consumer(String name, String filter, SubscriptionMode mode) {
        InMemoryConsumer existing = consumers.get(name);
        if (existing == null) {
            InMemoryConsumer created = new InMemoryConsumer(this, name, filter, mode, scheduler);
            consumers.put(name, created);
            return created;
        }
        if (!existing.filter().equals(filter) || existing.mode() != mode) {
            throw new BridgeException("Consumer '" + name + "' of stream '" + spec.name()
                    + "' already exists with filter '" + existing.filter() + "' and mode " + existing.mode());
        }
        return existing;
    }

    synchronized InMemoryConsumer existingConsumer(String name) {
        return consumers.get(name);
    }

    private void expireIds(Instant now) {
        Duration window = spec.duplicateWindow();
        Iterator<StoredMessage> it = recentIds.values().iterator();
        while (it.hasNext()) {
            if (it.next().timestamp().plus(window).isAfter(now)) break;
            it.remove();
        }
    }
}
