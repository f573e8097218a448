/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.config;

import com.streamfacade.common.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in configuration values
 * using a waterfall resolution strategy:
 *
 * <ol>
 *   <li><strong>JVM system properties</strong> ({@code -Dkey=value})</li>
 *   <li><strong>Properties</strong> handed to this resolver, e.g. read from a properties file</li>
 *   <li><strong>Environment variable</strong></li>
 *   <li><strong>Default value</strong> specified after colon: {@code ${key:defaultValue}}</li>
 *   <li>If none resolve → throws {@link ConfigException}</li>
 * </ol>
 *
 * <p>Only the first un-escaped colon separates the key from the default, so
 * {@code ${NATS_URL:nats://localhost:4222}} keeps the whole URL as its default.
 * Use {@code \:} to put a literal colon into the key.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties properties;
    private final Map<String, String> environment;

    public ConfigPropertyResolver() {
        this(new Properties(), System.getenv());
    }

    public ConfigPropertyResolver(Properties properties, Map<String, String> environment) {
        this.properties = properties != null ? properties : new Properties();
        this.environment = environment != null ? environment : Map.of();
    }

    /**
     * Resolve a single string value, replacing all ${...} placeholders.
     *
     * @throws ConfigException if a placeholder cannot be resolved
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = resolveExpression(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Recursively resolve all string values in a map (modifies in place).
     */
    public void resolveMap(Map<String, Object> map) {
        if (map == null) return;
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            entry.setValue(resolveValue(entry.getValue()));
        }
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object val) {
        if (val instanceof String s) {
            return resolve(s);
        } else if (val instanceof Map) {
            resolveMap((Map<String, Object>) val);
        } else if (val instanceof List) {
            List<Object> list = (List<Object>) val;
            for (int i = 0; i < list.size(); i++) {
                list.set(i, resolveValue(list.get(i)));
            }
        }
        return val;
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;

        int colonIdx = findDefaultSeparator(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).replace("\\:", ":").trim();
            defaultValue = expr.substring(colonIdx + 1);
        } else {
            key = expr.replace("\\:", ":").trim();
        }

        String val = System.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{}} from JVM system property", key);
            return val;
        }

        val = properties.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{}} from properties", key);
            return val;
        }

        val = environment.get(key);
        if (val != null) {
            log.debug("Resolved ${{}} from environment variable", key);
            return val;
        }

        if (defaultValue != null) {
            log.debug("Resolved ${{}} using default: {}", key, defaultValue);
            return defaultValue;
        }

        String msg = "Cannot resolve configuration placeholder ${" + key + "}. " +
                "Provide it as a JVM arg -D" + key + "=value, a properties entry, " +
                "an environment variable, or an inline default ${" + key + ":defaultValue}";
        log.error(msg);
        throw new ConfigException(msg);
    }

    /** First colon not preceded by a backslash. */
    private int findDefaultSeparator(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) != ':') continue;
            if (i > 0 && expr.charAt(i - 1) == '\\') continue;
            return i;
        }
        return -1;
    }
}
