/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

/**
 * How a consumer and its {@link Subscriber} are configured. Pick
 * {@link #SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER} when messages must be processed strictly in
 * order, {@link #MULTIPLE_SUBSCRIBERS_ALLOWED} when horizontal scaling matters more.
 */
public enum SubscriptionMode {

    /**
     * Default. Several subscriber processes may pull from one consumer. Once a message is
     * nak'd, later messages can overtake it, so order is not guaranteed.
     */
    MULTIPLE_SUBSCRIBERS_ALLOWED,

    /**
     * A failed message is retried until it is resolved before the next one is delivered.
     * This blocks the whole consumer, so scaling out does not help.
     */
    SINGLE_SUBSCRIBER_STRICT_MESSAGE_ORDER
}
