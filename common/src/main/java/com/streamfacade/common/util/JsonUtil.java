/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfacade.common.exception.ConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Centralized Jackson ObjectMapper utility, thread-safe singleton.
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonUtil() {}

    public static ObjectMapper mapper() { return MAPPER; }

    public static Map<String, Object> readMap(String json) {
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigException("JSON deserialization failed: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> readMap(Path file) {
        try {
            return readMap(Files.readString(file));
        } catch (IOException e) {
            throw new ConfigException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    public static <T> T convert(Map<String, Object> values, Class<T> type) {
        try {
            return MAPPER.convertValue(values, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
