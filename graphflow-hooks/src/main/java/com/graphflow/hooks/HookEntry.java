package com.graphflow.hooks;

import com.graphflow.annotations.HookPhase;

import java.util.List;
import java.util.Objects;

/**
 * Registered hook: name, phase, privilege, node-type patterns and the instance.
 */
public final class HookEntry {

    private final String name;
    private final HookPhase phase;
    private final HookPrivilege privilege;
    private final List<String> applicableNodeTypes;
    private final Object instance;

    HookEntry(String name, HookPhase phase, HookPrivilege privilege, List<String> applicableNodeTypes, Object instance) {
        this.name = Objects.requireNonNull(name, "name");
        this.phase = Objects.requireNonNull(phase, "phase");
        this.privilege = Objects.requireNonNull(privilege, "privilege");
        this.applicableNodeTypes = applicableNodeTypes != null ? List.copyOf(applicableNodeTypes) : List.of();
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    public String getName() {
        return name;
    }

    public HookPhase getPhase() {
        return phase;
    }

    public HookPrivilege getPrivilege() {
        return privilege;
    }

    public boolean isCritical() {
        return privilege == HookPrivilege.CRITICAL;
    }

    public List<String> getApplicableNodeTypes() {
        return applicableNodeTypes;
    }

    public Object getInstance() {
        return instance;
    }

    public boolean isTrigger() {
        return instance instanceof Trigger && phase != HookPhase.RUN;
    }

    public boolean isRunPlugin() {
        return instance instanceof RunPlugin;
    }

    boolean runsBefore() {
        return phase == HookPhase.BEFORE_NODE || phase == HookPhase.AROUND_NODE;
    }

    boolean runsAfter() {
        return phase == HookPhase.AFTER_NODE || phase == HookPhase.AROUND_NODE;
    }

    /** Empty list or {@code *} matches all; {@code prefix.*} matches by prefix; otherwise exact. */
    public boolean appliesTo(String nodeType) {
        if (applicableNodeTypes.isEmpty()) return true;
        String type = nodeType != null ? nodeType : "";
        for (String pattern : applicableNodeTypes) {
            if ("*".equals(pattern)) return true;
            if (pattern.endsWith(".*") && type.startsWith(pattern.substring(0, pattern.length() - 1))) return true;
            if (pattern.equals(type)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "HookEntry{name=" + name + ", phase=" + phase + ", privilege=" + privilege + "}";
    }
}
