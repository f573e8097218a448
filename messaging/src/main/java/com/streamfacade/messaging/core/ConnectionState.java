/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

/**
 * Lifecycle states of a {@link Connection}.
 */
public enum ConnectionState {
    OPEN,
    DRAINING,
    CLOSED,
    FAILED
}
