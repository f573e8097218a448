/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

public class SubscriptionCreateException extends StreamFacadeException {
    public SubscriptionCreateException(String message) {
        super("SF_SUBSCRIPTION_CREATE", message);
    }

    public SubscriptionCreateException(String subject, String consumerName, Throwable cause) {
        super("SF_SUBSCRIPTION_CREATE",
              "Subscription for subject='" + subject + "' consumer='" + consumerName
                      + "' could not be created: " + StreamProvisionException.messageOf(cause), cause);
    }
}
