/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

/**
 * Raised by a connection close when a subscription drain or the final session drain fails.
 */
public class DrainException extends StreamFacadeException {
    public DrainException(String message) {
        super("SF_DRAIN", message);
    }

    public DrainException(String message, Throwable cause) {
        super("SF_DRAIN", message, cause);
    }
}
