package com.graphflow.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name → component registry for one namespace (node types, guards, hooks). Instance-scoped: every engine
 * owns its registries, nothing is global. Names are unique within the namespace; a second registration
 * under the same name is rejected and leaves the first one in place.
 * <p>
 * Registration is expected to happen during setup. A registry can be {@link #freeze() frozen} once
 * a graph is built against it; after that it only serves lookups.
 *
 * @param <T> component type
 */
public final class ComponentRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final String namespace;
    private final Map<String, T> byName = new LinkedHashMap<>();
    private volatile boolean frozen;

    public ComponentRegistry(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @throws DuplicateTypeException if {@code name} is already registered
     * @throws IllegalStateException  if the registry is frozen
     */
    public synchronized void register(String name, T component) {
        Objects.requireNonNull(component, "component");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Registration name must be non-blank in '" + namespace + "'");
        }
        if (frozen) {
            throw new IllegalStateException("Registry '" + namespace + "' is frozen; cannot register " + name);
        }
        if (byName.putIfAbsent(name, component) != null) {
            throw new DuplicateTypeException(namespace, name);
        }
        log.debug("Registered | namespace={} | name={} | class={}", namespace, name, component.getClass().getName());
    }

    /**
     * @throws UnknownTypeException if nothing is registered under {@code name}
     */
    public synchronized T resolve(String name) {
        T component = byName.get(name);
        if (component == null) {
            throw new UnknownTypeException(namespace, name);
        }
        return component;
    }

    public synchronized Optional<T> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public synchronized boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Registered names in registration order. */
    public synchronized List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(byName.keySet()));
    }

    /** Registered components in registration order. */
    public synchronized List<T> components() {
        return Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }

    public synchronized int size() {
        return byName.size();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Unfrozen copy with the same entries. */
    public synchronized ComponentRegistry<T> copy() {
        ComponentRegistry<T> copy = new ComponentRegistry<>(namespace);
        copy.byName.putAll(byName);
        return copy;
    }
}
