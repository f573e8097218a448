/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

/**
 * Arguments of {@link Connection#newPublisher(CreatePublisherArgs)}.
 *
 * @param streamName name of the stream, like {@code "PRODUCTS"} or {@code "ORDERS"}.
 *                   It is created if it does not exist.
 */
public record CreatePublisherArgs(String streamName) {

    public CreatePublisherArgs {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName must not be blank");
        }
        if (streamName.contains(".") || streamName.contains("*") || streamName.contains(">")) {
            throw new IllegalArgumentException("streamName must be a single subject token: " + streamName);
        }
    }
}
