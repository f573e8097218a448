/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.common.logging.LogLevel;
import com.streamfacade.common.util.Subjects;
import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.OutboundMessage;
import com.streamfacade.messaging.bridge.PublishReceipt;
import com.streamfacade.messaging.bridge.RawSubscription;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import com.streamfacade.messaging.bridge.TransportBridge;
import com.streamfacade.messaging.core.SubscriptionMode;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One session on an {@link InMemoryBackend}.
 */
public class InMemoryBridge implements TransportBridge {

    private final InMemoryBackend backend;
    private final List<String> servers;
    private final LogFunction log;
    private final List<InMemorySubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    InMemoryBridge(InMemoryBackend backend, List<String> servers, LogFunction log) {
        this.backend = backend;
        this.servers = List.copyOf(servers);
        this.log = log;
    }

    @Override
    public StreamDescriptor ensureStream(StreamSpec spec) {
        checkOpen();
        return backend.ensureStream(spec);
    }

    @Override
    public RawSubscription createSubscription(String subject, String consumerName, SubscriptionMode mode) {
        checkOpen();
        String streamName = Subjects.streamName(subject);
        InMemoryStream stream = backend.stream(streamName);
        if (stream == null) {
            throw new BridgeException("Stream '" + streamName + "' not found");
        }
        InMemorySubscription subscription =
                new InMemorySubscription(this, stream.consumer(consumerName, subject, mode), subject);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public List<String> servers() {
        return servers;
    }

    @Override
    public PublishReceipt publish(OutboundMessage message, String dedupKey) {
        checkOpen();
        InMemoryStream stream = backend.streamFor(message.subject());
        if (stream == null) {
            throw new BridgeException("No stream captures subject '" + message.subject() + "'");
        }
        return stream.append(message, dedupKey);
    }

    @Override
    public void drain() {
        if (closed) return;
        log.log(LogLevel.TRACE, "Draining in-memory session on %s", servers);
        for (InMemorySubscription subscription : subscriptions) {
            if (!subscription.isDrained()) subscription.drain();
        }
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new BridgeException("Session is closed");
        }
    }
}
