/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

/**
 * The session to the backend could not be established. No partial connection is handed out.
 */
public class ConnectionException extends StreamFacadeException {
    public ConnectionException(String message) {
        super("SF_CONNECTION", message);
    }

    public ConnectionException(String message, Throwable cause) {
        super("SF_CONNECTION", message, cause);
    }
}
