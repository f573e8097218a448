/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.util;

import com.streamfacade.common.exception.ConfigException;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses duration strings used in configuration files. Supports:
 * <ul>
 *   <li>Plain number → milliseconds</li>
 *   <li>{@code "250ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
 *   <li>ISO-8601 ({@code "PT30S"}) via {@link Duration#parse}</li>
 * </ul>
 */
public final class Durations {

    private Durations() {}

    public static Duration parse(String value, Duration defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String val = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.substring(0, val.length() - 2).trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            throw new ConfigException("Invalid duration '" + value + "'", e);
        }
    }
}
