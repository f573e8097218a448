/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.logging;

import org.slf4j.Logger;

import java.util.IllegalFormatException;
import java.util.Objects;

/**
 * {@link LogFunction} backed by an SLF4J {@link Logger}. Formatting only happens when the
 * target level is enabled.
 */
public final class Slf4jLogFunction implements LogFunction {

    private final Logger logger;

    public Slf4jLogFunction(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void log(LogLevel level, String format, Object... args) {
        switch (level) {
            case TRACE -> { if (logger.isTraceEnabled()) logger.trace(render(format, args)); }
            case DEBUG -> { if (logger.isDebugEnabled()) logger.debug(render(format, args)); }
            case INFO -> { if (logger.isInfoEnabled()) logger.info(render(format, args)); }
            case WARN -> { if (logger.isWarnEnabled()) logger.warn(render(format, args)); }
            case ERROR -> { if (logger.isErrorEnabled()) logger.error(render(format, args)); }
        }
    }

    static String render(String format, Object... args) {
        if (args == null || args.length == 0) return format;
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            return format + " " + java.util.Arrays.toString(args);
        }
    }
}
