/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.bridge.PublishReceipt;
import com.streamfacade.messaging.bridge.RawMessage;
import com.streamfacade.messaging.bridge.RawSubscription;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import com.streamfacade.messaging.bridge.TransportBridge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Bridge that never delivers anything and records the calls it receives.
 */
class RecordingBridge implements TransportBridge {

    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final List<StreamSpec> streamSpecs = Collections.synchronizedList(new ArrayList<>());
    final Set<String> failingDrains = new HashSet<>();
    boolean failBridgeDrain;
    boolean failEnsureStream;
    boolean failCreateSubscription;

    @Override
    public StreamDescriptor ensureStream(StreamSpec spec) {
        if (failEnsureStream) throw new BridgeException("stream refused");
        streamSpecs.add(spec);
        events.add("ensureStream:" + spec.name());
        return new StreamDescriptor(spec.name(), spec.subjects(), 0, true);
    }

    @Override
    public RawSubscription createSubscription(String subject, String consumerName, SubscriptionMode mode) {
        if (failCreateSubscription) throw new BridgeException("consumer refused");
        events.add("subscribe:" + consumerName);
        return new RecordingSubscription(subject, consumerName);
    }

    @Override
    public List<String> servers() {
        return List.of("test://recording");
    }

    @Override
    public PublishReceipt publish(OutboundMessage message, String dedupKey) {
        events.add("publish:" + message.subject() + ":" + dedupKey);
        return new PublishReceipt("TEST", events.size(), false);
    }

    @Override
    public void drain() {
        if (failBridgeDrain) throw new BridgeException("flush failed");
        events.add("drain:bridge");
    }

    List<String> drainEvents() {
        synchronized (events) {
            return events.stream().filter(e -> e.startsWith("drain:")).toList();
        }
    }

    private class RecordingSubscription implements RawSubscription {

        private final String subject;
        private final String consumerName;

        RecordingSubscription(String subject, String consumerName) {
            this.subject = subject;
            this.consumerName = consumerName;
        }

        @Override public String subject() { return subject; }
        @Override public String consumerName() { return consumerName; }

        @Override
        public CompletableFuture<RawMessage> nextMessage() {
            return new CompletableFuture<>();
        }

        @Override public void ack(RawMessage message) { events.add("ack:" + consumerName); }
        @Override public void nak(RawMessage message, Duration delay) { events.add("nak:" + consumerName); }
        @Override public void terminate(RawMessage message) { events.add("term:" + consumerName); }

        @Override
        public void drain() {
            if (failingDrains.contains(consumerName)) throw new BridgeException("drain refused");
            events.add("drain:" + consumerName);
        }
    }
}
