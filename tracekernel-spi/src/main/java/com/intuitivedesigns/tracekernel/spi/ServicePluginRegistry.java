/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry for SPI discovery.
 *
 * <p>The ServiceLoader classpath scan runs <b>once</b> at construction. Plugins can also be added
 * explicitly with {@link #register(PipelinePlugin)}, which is how tests and embedding applications
 * wire sinks without {@code META-INF/services} files.</p>
 *
 * @param <T> The SPI interface type (e.g., SinkPlugin.class)
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final Class<T> spiType;
    private final Map<String, T> byId = new LinkedHashMap<>();

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this.spiType = Objects.requireNonNull(spiType, "spiType");
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            register(plugin);
        }
    }

    private ServicePluginRegistry(Class<T> spiType, List<? extends T> plugins) {
        this.spiType = Objects.requireNonNull(spiType, "spiType");
        for (T plugin : plugins) {
            register(plugin);
        }
    }

    /**
     * A registry that skips classpath discovery.
     */
    public static <T extends PipelinePlugin<?>> ServicePluginRegistry<T> empty(Class<T> spiType) {
        return new ServicePluginRegistry<>(spiType, List.of());
    }

    public static <T extends PipelinePlugin<?>> ServicePluginRegistry<T> of(Class<T> spiType, List<? extends T> plugins) {
        return new ServicePluginRegistry<>(spiType, plugins);
    }

    /**
     * @throws IllegalStateException if the id is blank or already taken
     */
    public synchronized ServicePluginRegistry<T> register(T plugin) {
        Objects.requireNonNull(plugin, "plugin");
        final String id = PluginIds.normalize(plugin.id());
        if (id.isEmpty()) {
            throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
        }
        final T existing = byId.get(id);
        if (existing != null) {
            throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName()
                    + ". Conflict between: " + existing.getClass().getName() + " and " + plugin.getClass().getName());
        }
        byId.put(id, plugin);
        return this;
    }

    /**
     * @throws IllegalArgumentException naming the config key and the available ids if nothing matches
     */
    public synchronized T require(String id, String configKeyName) {
        final T plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin found for '" + configKeyName + "=" + id + "'. "
                    + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public synchronized Set<String> availableIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byId.keySet()));
    }

    public synchronized Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }
}
