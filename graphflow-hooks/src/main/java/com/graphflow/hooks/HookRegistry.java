package com.graphflow.hooks;

import com.graphflow.annotations.GraphHook;
import com.graphflow.annotations.HookPhase;
import com.graphflow.registry.ComponentRegistry;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hook namespace of an engine. Instance-scoped; hooks run in registration order; names are unique
 * (a duplicate throws {@link com.graphflow.registry.DuplicateTypeException} and keeps the first).
 * A hook implements {@link Trigger}, {@link RunPlugin} or both.
 */
public final class HookRegistry {

    public static final String NAMESPACE = "hooks";

    private final ComponentRegistry<HookEntry> entries;

    public HookRegistry() {
        this(new ComponentRegistry<>(NAMESPACE));
    }

    private HookRegistry(ComponentRegistry<HookEntry> entries) {
        this.entries = entries;
    }

    /**
     * Registers a hook whose class is annotated with {@link GraphHook}.
     *
     * @throws IllegalArgumentException if the annotation is missing or the instance implements no hook contract
     */
    public HookRegistry register(Object hook) {
        Objects.requireNonNull(hook, "hook");
        GraphHook ann = hook.getClass().getAnnotation(GraphHook.class);
        if (ann == null) {
            throw new IllegalArgumentException("Hook class must be annotated with @GraphHook: " + hook.getClass().getName());
        }
        HookPrivilege privilege = ann.critical() ? HookPrivilege.CRITICAL : HookPrivilege.OBSERVER;
        return add(new HookEntry(ann.name(), ann.phase(), privilege, List.of(ann.applicableNodeTypes()), hook));
    }

    /** Registers an observer trigger (around node) under an explicit name. */
    public HookRegistry registerTrigger(String name, Trigger trigger) {
        return register(name, trigger, HookPrivilege.OBSERVER);
    }

    /** Registers a run plugin under an explicit name. */
    public HookRegistry registerPlugin(String name, RunPlugin plugin) {
        return register(name, plugin, HookPrivilege.OBSERVER);
    }

    /**
     * Registers any hook instance with explicit metadata. Phase is AROUND_NODE for triggers, RUN for plugin-only hooks.
     */
    public HookRegistry register(String name, Object hook, HookPrivilege privilege, String... applicableNodeTypes) {
        Objects.requireNonNull(hook, "hook");
        HookPhase phase = hook instanceof Trigger ? HookPhase.AROUND_NODE : HookPhase.RUN;
        return add(new HookEntry(name, phase, privilege, List.of(applicableNodeTypes), hook));
    }

    private HookRegistry add(HookEntry entry) {
        if (!(entry.getInstance() instanceof Trigger) && !(entry.getInstance() instanceof RunPlugin)) {
            throw new IllegalArgumentException("Hook '" + entry.getName() + "' implements neither Trigger nor RunPlugin: "
                    + entry.getInstance().getClass().getName());
        }
        entries.register(entry.getName(), entry);
        return this;
    }

    public HookEntry get(String name) {
        return entries.resolve(name);
    }

    public List<HookEntry> all() {
        return entries.components();
    }

    /** Triggers applicable to the node type, in registration order. */
    public List<HookEntry> triggersFor(String nodeType) {
        return entries.components().stream()
                .filter(HookEntry::isTrigger)
                .filter(e -> e.appliesTo(nodeType))
                .collect(Collectors.toList());
    }

    /** Run plugins in registration order. */
    public List<HookEntry> runPlugins() {
        return entries.components().stream()
                .filter(HookEntry::isRunPlugin)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.size() == 0;
    }

    public void freeze() {
        entries.freeze();
    }

    public HookRegistry copy() {
        return new HookRegistry(entries.copy());
    }
}
