/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.config;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.messaging.bridge.BridgeException;
import com.streamfacade.messaging.bridge.TransportBridge;
import com.streamfacade.messaging.memory.InMemoryBackend;
import com.streamfacade.messaging.nats.NatsBridge;

import java.util.List;
import java.util.Locale;

/**
 * Factory to create the TransportBridge matching the server URLs.
 * Supports: NATS JetStream ({@code nats://}, {@code tls://}, {@code ws://}, {@code wss://})
 * and the in-process backend ({@code mem://}).
 */
public final class MessagingFactory {

    public static final String MEMORY_SCHEME = "mem://";

    public enum Backend {
        NATS, IN_MEMORY
    }

    private MessagingFactory() {}

    public static Backend backendFor(List<String> servers) {
        long inMemory = servers.stream()
                .filter(s -> s != null && s.trim().toLowerCase(Locale.ROOT).startsWith(MEMORY_SCHEME))
                .count();
        if (inMemory == 0) return Backend.NATS;
        if (inMemory == servers.size()) return Backend.IN_MEMORY;
        throw new BridgeException("Cannot mix " + MEMORY_SCHEME + " with network servers: " + servers);
    }

    public static TransportBridge createBridge(List<String> servers, ConnectionConfig config, LogFunction log) {
        return switch (backendFor(servers)) {
            case NATS -> NatsBridge.connect(servers, config, log);
            case IN_MEMORY -> InMemoryBackend.shared(servers.get(0)).openSession(servers, log);
        };
    }
}
