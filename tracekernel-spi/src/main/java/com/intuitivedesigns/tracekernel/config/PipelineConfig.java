/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration manager backed by {@link Properties}.
 * <p>
 * The process-wide instance loads from {@code -Dtk.config.path} or ENV {@code TK_CONFIG_PATH}.
 * Programmatic instances can be built with {@link #fromProperties(Properties)} and {@link #fromMap(Map)}.
 */
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String CONFIG_PATH_PROPERTY = "tk.config.path";
    public static final String CONFIG_PATH_ENV = "TK_CONFIG_PATH";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = new PipelineConfig(loadDefault());
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        final Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new PipelineConfig(copy);
    }

    public static PipelineConfig fromMap(Map<String, ?> source) {
        Objects.requireNonNull(source, "source");
        final Properties p = new Properties();
        for (Map.Entry<String, ?> e : source.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                p.setProperty(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return new PipelineConfig(p);
    }

    public static PipelineConfig load(String path) {
        Objects.requireNonNull(path, "path");
        final Properties p = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            p.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new PipelineConfig(p);
    }

    private static Properties loadDefault() {
        // System property first, then environment
        String path = System.getProperty(CONFIG_PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(CONFIG_PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/config.properties", CONFIG_PATH_PROPERTY);
            return new Properties();
        }

        log.info("Loading configuration from: {}", path);
        final Properties p = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            p.load(is);
            log.info("Loaded {} properties.", p.size());
        } catch (IOException e) {
            log.error("FAILED to load config file: {}", path, e);
        }
        return p;
    }

    public String getString(String key, String defaultValue) {
        final String val = props.getProperty(key);
        return (val == null) ? defaultValue : val.trim();
    }

    public int getInt(String key, int defaultValue) {
        final String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}', using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}', using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Reads a millisecond value. A negative value means "infinite" and is returned as {@code null}.
     */
    public Duration getMillis(String key, Duration defaultValue) {
        final String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            final long ms = Long.parseLong(val.trim());
            return (ms < 0) ? null : Duration.ofMillis(ms);
        } catch (NumberFormatException e) {
            log.warn("Invalid millis for '{}': '{}', using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Returns a view of all keys under {@code prefix}, with the prefix stripped.
     * {@code subset("sink.db.")} turns {@code sink.db.table} into {@code table}.
     */
    public PipelineConfig subset(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        final Properties p = new Properties();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                p.setProperty(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return new PipelineConfig(p);
    }

    public Map<String, Object> asMap() {
        final Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
