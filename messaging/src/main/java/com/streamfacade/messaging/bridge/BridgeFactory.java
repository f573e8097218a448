/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import com.streamfacade.common.config.ConnectionConfig;
import com.streamfacade.common.logging.LogFunction;

import java.util.List;

/**
 * Opens a {@link TransportBridge} session.
 */
@FunctionalInterface
public interface BridgeFactory {

    TransportBridge create(List<String> servers, ConnectionConfig config, LogFunction log);
}
