/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.core;

import java.util.Objects;

/**
 * Arguments of {@link Connection#newSubscriber(CreateSubscriberArgs, MessageHandler)}.
 *
 * @param consumerName durable consumer name, usually the name of the service
 * @param subject      subjects to subscribe, first token is the stream:
 *                     {@code "ORDERS.new"} (one subject), {@code "ORDERS.>"} (all levels below ORDERS),
 *                     {@code "ORDERS.*"} (direct children only, not {@code "ORDERS.new.error"})
 * @param mode         defaults to {@link SubscriptionMode#MULTIPLE_SUBSCRIBERS_ALLOWED}
 * @param retryPolicy  defaults to {@link RetryPolicy#unbounded()}
 */
public record CreateSubscriberArgs(String consumerName, String subject, SubscriptionMode mode,
                                   RetryPolicy retryPolicy) {

    public CreateSubscriberArgs {
        if (consumerName == null || consumerName.isBlank()) {
            throw new IllegalArgumentException("consumerName must not be blank");
        }
        Objects.requireNonNull(subject, "subject must not be null");
        mode = Objects.requireNonNullElse(mode, SubscriptionMode.MULTIPLE_SUBSCRIBERS_ALLOWED);
        retryPolicy = Objects.requireNonNullElse(retryPolicy, RetryPolicy.unbounded());
    }

    public CreateSubscriberArgs(String consumerName, String subject) {
        this(consumerName, subject, SubscriptionMode.MULTIPLE_SUBSCRIBERS_ALLOWED, RetryPolicy.unbounded());
    }

    public CreateSubscriberArgs(String consumerName, String subject, SubscriptionMode mode) {
        this(consumerName, subject, mode, RetryPolicy.unbounded());
    }
}
