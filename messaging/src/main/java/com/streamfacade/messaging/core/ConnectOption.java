/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.logging.LogFunction;
import com.streamfacade.messaging.bridge.BridgeFactory;
import com.streamfacade.messaging.config.MessagingFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Optional argument of {@link Connection#connect}. Options are applied before the session is
 * opened, so a logger passed here already sees the connection setup.
 */
public final class ConnectOption {

    private final Consumer<Settings> applier;

    private ConnectOption(Consumer<Settings> applier) {
        this.applier = applier;
    }

    /** Routes the library's log records to {@code log}. Without it nothing is logged. */
    public static ConnectOption withLogger(LogFunction log) {
        Objects.requireNonNull(log, "log must not be null");
        return new ConnectOption(s -> s.log = log);
    }

    public static ConnectOption withConfig(ConnectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new ConnectOption(s -> s.config = config);
    }

    /** Replaces the default server-URL based choice of backend adapter. */
    public static ConnectOption withBridgeFactory(BridgeFactory factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        return new ConnectOption(s -> s.bridgeFactory = factory);
    }

    void applyTo(Settings settings) {
        applier.accept(settings);
    }

    static final class Settings {
        LogFunction log = LogFunction.noOp();
        ConnectionConfig config = ConnectionConfig.defaults();
        BridgeFactory bridgeFactory = MessagingFactory::createBridge;
    }
}
