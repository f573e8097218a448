/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import com.streamfacade.common.exception.StreamFacadeException;

/**
 * Thrown by a {@link MessageHandler} for a message that can never be processed.
 * The message is terminated instead of redelivered.
 */
public class TerminalMessageException extends StreamFacadeException {
    public TerminalMessageException(String message) {
        super("SF_TERMINAL_MESSAGE", message);
    }

    public TerminalMessageException(String message, Throwable cause) {
        super("SF_TERMINAL_MESSAGE", message, cause);
    }
}
