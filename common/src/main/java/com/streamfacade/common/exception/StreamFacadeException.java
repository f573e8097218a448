/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

/**
 * Base exception for all StreamFacade errors.
 */
public class StreamFacadeException extends RuntimeException {
    private final String errorCode;

    public StreamFacadeException(String message) {
        super(message);
        this.errorCode = "SF_GENERIC";
    }

    public StreamFacadeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StreamFacadeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
