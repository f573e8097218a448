/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

/**
 * Application callback of a {@link Subscriber}.
 *
 * <p>Returning normally acknowledges the message. Throwing {@link TerminalMessageException}
 * drops it for good. Any other exception asks the backend to redeliver it.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(StreamMessage message) throws Exception;
}
