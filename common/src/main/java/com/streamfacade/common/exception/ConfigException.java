/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.exception;

public class ConfigException extends StreamFacadeException {
    public ConfigException(String message) {
        super("SF_CONFIG", message);
    }

    public ConfigException(String message, Throwable cause) {
        super("SF_CONFIG", message, cause);
    }
}
