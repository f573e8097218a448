/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

public class StreamProvisionException extends StreamFacadeException {
    public StreamProvisionException(String streamName, Throwable cause) {
        super("SF_STREAM_PROVISION",
              "Stream '" + streamName + "' could not be provisioned: " + messageOf(cause), cause);
    }

    static String messageOf(Throwable cause) {
        return cause == null ? "unknown cause" : cause.getMessage();
    }
}
