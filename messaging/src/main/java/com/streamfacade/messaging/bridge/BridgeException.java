/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import com.streamfacade.common.exception.StreamFacadeException;

/**
 * Transport-level failure reported by a {@link TransportBridge}.
 */
public class BridgeException extends StreamFacadeException {
    public BridgeException(String message) {
        super("SF_BRIDGE", message);
    }

    public BridgeException(String message, Throwable cause) {
        super("SF_BRIDGE", message, cause);
    }
}
