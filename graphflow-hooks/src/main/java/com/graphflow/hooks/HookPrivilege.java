package com.graphflow.hooks;

/**
 * How the runner treats a failing hook.
 * <p>
 * <b>CRITICAL:</b> a thrown exception fails the run (wrapped in {@link HookFailureException}).
 * <p>
 * <b>OBSERVER:</b> a thrown exception is logged and the run continues; a failing {@code before} counts as allow.
 */
public enum HookPrivilege {

    CRITICAL,

    OBSERVER
}
