/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

/**
 * A single publish attempt failed. Nothing is retried internally.
 */
public class PublishException extends StreamFacadeException {
    public PublishException(String message) {
        super("SF_PUBLISH", message);
    }

    public PublishException(String message, Throwable cause) {
        super("SF_PUBLISH", message, cause);
    }
}
