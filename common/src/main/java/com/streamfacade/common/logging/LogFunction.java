/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.logging;

/**
 * Generic logging hook that lets an application pull the library's log records into its own
 * logging setup. The format string follows {@link String#format} semantics.
 *
 * <p>Without an explicit log function a connection uses {@link #noOp()}.</p>
 */
@FunctionalInterface
public interface LogFunction {

    void log(LogLevel level, String format, Object... args);

    /** Stateless function that discards every record. */
    static LogFunction noOp() {
        return NoOp.INSTANCE;
    }

    /** Routes records into the SLF4J logger of the given class. */
    static LogFunction slf4j(Class<?> owner) {
        return new Slf4jLogFunction(org.slf4j.LoggerFactory.getLogger(owner));
    }

    /** Returns a function that drops records below {@code threshold} before delegating. */
    default LogFunction atLeast(LogLevel threshold) {
        return (level, format, args) -> {
            if (level.isAtLeast(threshold)) log(level, format, args);
        };
    }

    enum NoOp implements LogFunction {
        INSTANCE;

        @Override
        public void log(LogLevel level, String format, Object... args) {
            // discard
        }
    }
}
