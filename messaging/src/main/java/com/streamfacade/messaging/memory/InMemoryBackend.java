/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.memory;

import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.messaging.bridge.BridgeFactory;
import com.streamfacade.messaging.bridge.StreamDescriptor;
import com.streamfacade.messaging.bridge.StreamSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Process-local message backend with JetStream-like semantics: streams capturing subject
 * hierarchies, durable pull consumers, explicit acks, delayed redelivery and a publish
 * deduplication window.
 *
 * <p>Sessions opened for the same {@code mem://name} URL share one backend.
 * Tests usually create their own instance and hand {@link #bridgeFactory()} to the connection.</p>
 *
 * <p>Not enforced: retention policy, max age, storage type, replicas, ack wait.</p>
 */
public class InMemoryBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackend.class);
    private static final Map<String, InMemoryBackend> SHARED = new ConcurrentHashMap<>();

    private final Map<String, InMemoryStream> streams = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sf-mem-redelivery");
        t.setDaemon(true);
        return t;
    });

    /** Backend registered under {@code server}, created on first use. */
    public static InMemoryBackend shared(String server) {
        return SHARED.computeIfAbsent(server.trim(), s -> {
            log.info("Starting in-memory backend {}", s);
            return new InMemoryBackend();
        });
    }

    public InMemoryBridge openSession(List<String> servers, LogFunction logFunction) {
        return new InMemoryBridge(this, servers, logFunction);
    }

    public BridgeFactory bridgeFactory() {
        return (servers, config, logFunction) -> openSession(servers, logFunction);
    }

    public Set<String> streamNames() {
        return new TreeSet<>(streams.keySet());
    }

    /** Messages stored in {@code streamName}, duplicates excluded; 0 if the stream does not exist. */
    public long messageCount(String streamName) {
        InMemoryStream stream = streams.get(streamName);
        return stream == null ? 0 : stream.messageCount();
    }

    /** Unacknowledged deliveries of a durable consumer; 0 if it does not exist. */
    public int pendingAcks(String streamName, String consumerName) {
        InMemoryConsumer consumer = consumer(streamName, consumerName);
        return consumer == null ? 0 : consumer.pendingAcks();
    }

    public long ackedCount(String streamName, String consumerName) {
        InMemoryConsumer consumer = consumer(streamName, consumerName);
        return consumer == null ? 0 : consumer.ackedCount();
    }

    public long terminatedCount(String streamName, String consumerName) {
        InMemoryConsumer consumer = consumer(streamName, consumerName);
        return consumer == null ? 0 : consumer.terminatedCount();
    }

    StreamDescriptor ensureStream(StreamSpec spec) {
        InMemoryStream existing = streams.get(spec.name());
        if (existing != null) return existing.describe(false);
        boolean[] created = {false};
        InMemoryStream stream = streams.computeIfAbsent(spec.name(), n -> {
            created[0] = true;
            log.debug("Created in-memory stream {} for {}", n, spec.subjects());
            return new InMemoryStream(spec, scheduler);
        });
        return stream.describe(created[0]);
    }

    InMemoryStream stream(String name) {
        return streams.get(name);
    }

    InMemoryStream streamFor(String subject) {
        return streams.values().stream().filter(s -> s.captures(subject)).findFirst().orElse(null);
    }

    private InMemoryConsumer consumer(String streamName, String consumerName) {
        InMemoryStream stream = streams.get(streamName);
        return stream == null ? null : stream.existingConsumer(consumerName);
    }
}
